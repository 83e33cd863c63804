package io.agency.server.config;

import io.agency.adapter.langchain4j.LangChain4jProvider;
import io.agency.core.AgencyConfig;
import io.agency.core.AgencyEnvironment;
import io.agency.core.AgencyFactory;
import io.agency.core.exception.ConfigurationException;
import io.agency.core.state.SnapshotStore;
import io.agency.serialization.store.FileMemoryStore;
import io.agency.serialization.store.FileSnapshotStore;
import io.agency.server.execution.LoggingExecutionListener;
import io.agency.server.persistence.JdbcSnapshotStore;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Properties;
import javax.sql.DataSource;
import org.eclipse.microprofile.config.Config;
import org.jboss.logging.Logger;

/// CDI producer for the agency runtime environment.
///
/// Translates `agency.*` configuration into an {@link AgencyConfig}, picks the
/// snapshot backend and hands everything to {@link AgencyFactory}.
///
/// ### Credential Discovery
/// Credentials are loaded from (in priority order):
/// 1. **Application properties** under `agency.credentials.*`
/// 2. **Environment variables** matching `*_API_KEY`, `*_KEY`, `*_SECRET`, `*_TOKEN`
///
/// ### Configuration Properties
/// | Property | Type | Default | Description |
/// |----------|------|---------|-------------|
/// | `agency.snapshot.store` | String | `memory` | `memory`, `file` or `jdbc` |
/// | `agency.data-dir` | Path | `data` | Root for file snapshots and persistent memory |
/// | `agency.memory.persistent` | Boolean | `false` | File-backed memory store |
/// | `agency.agent.use-memory` | Boolean | `true` | Loop may consult memory |
/// | `agency.agent.use-tools` | Boolean | `true` | Loop may invoke tools |
/// | `agency.agent.max-thinking-steps` | Integer | `10` | Default reasoning bound |
/// | `agency.workflow.enable-suspend-resume` | Boolean | `true` | Accept suspend/resume |
/// | `agency.stub.enabled` | Boolean | `false` | Route every model to stub agents |
/// | `agency.verbose.enabled` | Boolean | `false` | Log every saga event |
///
/// @implNote Application-scoped singleton. Thread-safe after initialization.
///
/// @see AgencyEnvironment
/// @see AgencyFactory
@ApplicationScoped
public class AgencyEnvironmentProducer {

    private static final Logger LOG = Logger.getLogger(AgencyEnvironmentProducer.class);

    static final String CREDENTIALS_PREFIX = "agency.credentials.";
    static final String STUB_ENABLED_KEY = "agency.stub.enabled";

    private AgencyEnvironment agencyEnvironment;

    @Inject Config config;

    @Inject Instance<DataSource> dataSourceInstance;

    /// Produces the agency runtime environment for CDI injection.
    ///
    /// @return configured environment singleton, never null
    /// @throws ConfigurationException if the configuration is invalid
    @Produces
    @ApplicationScoped
    public AgencyEnvironment agencyEnvironment() {
        AgencyConfig agencyConfig = readConfig();
        Path dataDir = Path.of(value("agency.data-dir", String.class, "data"));

        AgencyFactory.Builder builder =
                AgencyFactory.builder()
                        .config(agencyConfig)
                        .loadCredentials(extractAgencyProperties())
                        .agentProviders(List.of(new LangChain4jProvider()))
                        .snapshotStore(snapshotStore(dataDir));

        if (agencyConfig.isMemoryPersistent()) {
            Path memoryFile = dataDir.resolve("memory.jsonl");
            builder.memoryStore(new FileMemoryStore(memoryFile));
            LOG.infov("Using persistent memory at {0}", memoryFile);
        }
        if (value("agency.verbose.enabled", Boolean.class, false)) {
            builder.listener(new LoggingExecutionListener());
        }

        agencyEnvironment = builder.build();
        LOG.infov(
                "Configured AgencyEnvironment: agent={0}, model={1}",
                agencyConfig.getAgentName(),
                agencyConfig.getAgentModel());
        return agencyEnvironment;
    }

    private SnapshotStore snapshotStore(Path dataDir) {
        String kind = value("agency.snapshot.store", String.class, "memory");
        switch (kind) {
            case "memory" -> {
                LOG.info("Using in-memory snapshot store");
                return null;
            }
            case "file" -> {
                Path root = dataDir.resolve("snapshots");
                LOG.infov("Using file snapshot store at {0}", root);
                return new FileSnapshotStore(root);
            }
            case "jdbc" -> {
                boolean dsActive = value("quarkus.datasource.active", Boolean.class, true);
                if (!dsActive || !dataSourceInstance.isResolvable()) {
                    throw new ConfigurationException(
                            "agency.snapshot.store=jdbc requires an active datasource");
                }
                LOG.info("Using JDBC snapshot store (PostgreSQL)");
                return new JdbcSnapshotStore(dataSourceInstance.get());
            }
            default ->
                    throw new ConfigurationException(
                            "Unknown agency.snapshot.store '" + kind + "'");
        }
    }

    AgencyConfig readConfig() {
        AgencyConfig defaults = new AgencyConfig();
        return AgencyConfig.builder()
                .memoryPersistent(
                        value("agency.memory.persistent", Boolean.class, defaults.isMemoryPersistent()))
                .useMemory(value("agency.agent.use-memory", Boolean.class, defaults.isUseMemory()))
                .useTools(value("agency.agent.use-tools", Boolean.class, defaults.isUseTools()))
                .maxThinkingSteps(
                        value(
                                "agency.agent.max-thinking-steps",
                                Integer.class,
                                defaults.getMaxThinkingSteps()))
                .enableSuspendResume(
                        value(
                                "agency.workflow.enable-suspend-resume",
                                Boolean.class,
                                defaults.isEnableSuspendResume()))
                .resumeInterruptedOnStartup(
                        value(
                                "agency.workflow.resume-interrupted-on-startup",
                                Boolean.class,
                                defaults.isResumeInterruptedOnStartup()))
                .retryBudget(
                        value("agency.reasoning.retry-budget", Integer.class, defaults.getRetryBudget()))
                .retryBaseDelay(
                        value(
                                "agency.reasoning.retry-base-delay",
                                Duration.class,
                                defaults.getRetryBaseDelay()))
                .maxMemoryResults(
                        value(
                                "agency.memory.max-search-results",
                                Integer.class,
                                defaults.getMaxMemoryResults()))
                .threadPoolSize(
                        value(
                                "agency.workflow.thread-pool-size",
                                Integer.class,
                                defaults.getThreadPoolSize()))
                .agentName(value("agency.agent.name", String.class, defaults.getAgentName()))
                .agentModel(value("agency.agent.model", String.class, defaults.getAgentModel()))
                .systemPrompt(
                        config.getOptionalValue("agency.agent.system-prompt", String.class)
                                .orElse(defaults.getSystemPrompt()))
                .snapshotRetention(
                        value(
                                "agency.snapshot.retention",
                                Duration.class,
                                defaults.getSnapshotRetention()))
                .shutdownTimeout(
                        value(
                                "agency.shutdown.timeout",
                                Duration.class,
                                defaults.getShutdownTimeout()))
                .build();
    }

    private <T> T value(String name, Class<T> type, T fallback) {
        return config.getOptionalValue(name, type).orElse(fallback);
    }

    /// Extracts `agency.credentials.*` and `agency.stub.enabled` from Quarkus config.
    Properties extractAgencyProperties() {
        Properties properties = new Properties();
        for (String propertyName : config.getPropertyNames()) {
            if (propertyName.startsWith(CREDENTIALS_PREFIX)) {
                config.getOptionalValue(propertyName, String.class)
                        .ifPresent(value -> properties.setProperty(propertyName, value));
            }
        }
        config.getOptionalValue(STUB_ENABLED_KEY, String.class)
                .ifPresent(value -> properties.setProperty(STUB_ENABLED_KEY, value));
        return properties;
    }

    /// Drains running workflows when the application shuts down.
    @PreDestroy
    public void cleanup() {
        if (agencyEnvironment != null) {
            agencyEnvironment.close();
            LOG.info("AgencyEnvironment closed");
        }
    }
}

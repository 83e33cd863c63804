package io.agency.core;

import io.agency.core.agent.AgentConfig;
import io.agency.core.agent.AgentFactory;
import io.agency.core.agent.AgentRegistry;
import io.agency.core.agent.DefaultAgentRegistry;
import io.agency.core.agent.spi.AgentProvider;
import io.agency.core.agent.stub.StubAgentProvider;
import io.agency.core.exception.ConfigurationException;
import io.agency.core.execution.ActionRunner;
import io.agency.core.execution.ExecutionListener;
import io.agency.core.execution.WorkflowManager;
import io.agency.core.memory.InMemoryMemoryStore;
import io.agency.core.memory.MemoryStore;
import io.agency.core.reasoning.ReasoningLoop;
import io.agency.core.reasoning.RetryPolicy;
import io.agency.core.state.InMemorySnapshotStore;
import io.agency.core.state.SnapshotStore;
import io.agency.core.tool.DefaultToolInvoker;
import io.agency.core.tool.DefaultToolRegistry;
import io.agency.core.tool.SystemInfoTool;
import io.agency.core.tool.ToolHandler;
import io.agency.core.tool.ToolInvoker;
import io.agency.core.tool.ToolRegistry;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/// Factory for creating and wiring agency environments.
///
/// Provides static factory methods and a fluent {@link Builder} that assemble
/// agents, tools, memory, snapshot storage, the reasoning loop and the
/// {@link WorkflowManager} into one {@link AgencyEnvironment}.
///
/// ### Usage Patterns
///
/// **Builder with explicit providers** (the server does this):
/// {@snippet :
/// var env = AgencyFactory.builder()
///     .config(AgencyConfig.builder().maxThinkingSteps(5).build())
///     .loadCredentials(properties)
///     .agentProviders(List.of(new LangChain4jProvider()))
///     .snapshotStore(new FileSnapshotStore(dataDir))
///     .build();
/// }
///
/// **Quick start with environment variables**:
/// {@snippet :
/// var env = AgencyFactory.createEnvironment();
/// }
///
/// @implNote Utility class with only static methods. Dependencies are wired
/// through constructors of the created components.
///
/// @see AgencyEnvironment
/// @see AgencyConfig
public final class AgencyFactory {

    static final String CREDENTIALS_PREFIX = "agency.credentials.";
    static final String STUB_ENABLED_KEY = "agency.stub.enabled";

    private AgencyFactory() {}

    /// Creates an environment with default configuration and credentials
    /// discovered from environment variables.
    ///
    /// @return a fully-configured environment, never null
    public static AgencyEnvironment createEnvironment() {
        return builder().build();
    }

    /// Creates an environment with custom configuration and credentials
    /// discovered from environment variables.
    ///
    /// @param config engine options, not null
    /// @return a fully-configured environment, never null
    public static AgencyEnvironment createEnvironment(AgencyConfig config) {
        return builder().config(config).build();
    }

    /// Discovers API credentials in environment variables.
    ///
    /// Matches `*_API_KEY`, `*_KEY`, `*_SECRET` and `*_TOKEN`.
    ///
    /// @return discovered credentials, never null
    public static Map<String, String> loadCredentialsFromEnvironment() {
        Map<String, String> credentials = new HashMap<>();
        System.getenv()
                .forEach(
                        (key, value) -> {
                            if (value != null && !value.isEmpty() && isApiKeyPattern(key)) {
                                credentials.put(key, value);
                            }
                        });
        return credentials;
    }

    /// Loads credentials from properties.
    ///
    /// Accepts `agency.credentials.*` keys (prefix stripped), direct API key
    /// names and the `agency.stub.enabled` switch.
    ///
    /// @param properties the source, not null
    /// @return credential keys to values, never null
    public static Map<String, String> loadCredentialsFromProperties(Properties properties) {
        Map<String, String> credentials = new HashMap<>();
        properties.forEach(
                (key, value) -> {
                    String name = key.toString();
                    String text = value.toString();
                    if (text.isEmpty()) {
                        return;
                    }
                    if (name.startsWith(CREDENTIALS_PREFIX)) {
                        credentials.put(name.substring(CREDENTIALS_PREFIX.length()), text);
                    } else if (name.equals(STUB_ENABLED_KEY)) {
                        credentials.put(STUB_ENABLED_KEY, text);
                    } else if (isApiKeyPattern(name)) {
                        credentials.put(name, text);
                    }
                });
        return credentials;
    }

    /// Merges environment and property credentials; properties win.
    ///
    /// @param properties the source, not null
    /// @return merged credentials, never null
    public static Map<String, String> loadCredentials(Properties properties) {
        Map<String, String> credentials = loadCredentialsFromEnvironment();
        credentials.putAll(loadCredentialsFromProperties(properties));
        return credentials;
    }

    private static boolean isApiKeyPattern(String key) {
        String upper = key.toUpperCase();
        return upper.endsWith("_API_KEY")
                || upper.endsWith("_KEY")
                || upper.endsWith("_SECRET")
                || upper.endsWith("_TOKEN");
    }

    /// @apiNote **Side effects**: sets the `agency.stub.enabled` system property
    /// when the credentials enable stub mode.
    private static void applyStubModeSetting(Map<String, String> credentials) {
        if ("true".equalsIgnoreCase(credentials.get(STUB_ENABLED_KEY))) {
            System.setProperty(STUB_ENABLED_KEY, "true");
        }
    }

    private static void validate(AgencyConfig config) {
        if (config.getMaxThinkingSteps() < 1) {
            throw new ConfigurationException("agent.max_thinking_steps must be at least 1");
        }
        if (config.getRetryBudget() < 1) {
            throw new ConfigurationException("reasoning.retry_budget must be at least 1");
        }
        if (config.getThreadPoolSize() < 1) {
            throw new ConfigurationException("workflow.thread_pool_size must be at least 1");
        }
        if (config.getAgentName() == null || config.getAgentName().isBlank()) {
            throw new ConfigurationException("agent.name must not be blank");
        }
    }

    /// Fluent builder for {@link AgencyEnvironment}.
    ///
    /// Anything not set falls back to an in-process default: in-memory snapshot
    /// and memory stores, a fixed thread pool and the stub agent provider.
    public static class Builder {
        private AgencyConfig config = new AgencyConfig();
        private Map<String, String> credentials = new HashMap<>();
        private final List<AgentProvider> agentProviders = new ArrayList<>();
        private final List<ToolHandler> toolHandlers = new ArrayList<>();
        private SnapshotStore snapshotStore;
        private MemoryStore memoryStore;
        private ExecutionListener listener = ExecutionListener.NOOP;
        private ExecutorService executorService;
        private RetryPolicy retryPolicy;

        public Builder config(AgencyConfig config) {
            this.config = config;
            return this;
        }

        public Builder credential(String key, String value) {
            this.credentials.put(key, value);
            return this;
        }

        public Builder credentials(Map<String, String> credentials) {
            this.credentials.putAll(credentials);
            return this;
        }

        /// Adds model providers; the stub provider is always appended.
        ///
        /// @param providers providers to consult when creating agents, not null
        /// @return this builder for chaining, never null
        public Builder agentProviders(List<AgentProvider> providers) {
            this.agentProviders.addAll(providers);
            return this;
        }

        public Builder agentProvider(AgentProvider provider) {
            this.agentProviders.add(provider);
            return this;
        }

        /// Routes every model to stub agents.
        ///
        /// @param enabled `true` to enable stub mode
        /// @return this builder for chaining, never null
        public Builder stubMode(boolean enabled) {
            this.credentials.put(STUB_ENABLED_KEY, String.valueOf(enabled));
            return this;
        }

        /// Registers a tool next to the built-in `system_info`.
        public Builder toolHandler(ToolHandler handler) {
            this.toolHandlers.add(handler);
            return this;
        }

        /// Sets the durable snapshot store.
        ///
        /// @param snapshotStore the store, may be null for an in-memory store
        /// @return this builder for chaining, never null
        public Builder snapshotStore(SnapshotStore snapshotStore) {
            this.snapshotStore = snapshotStore;
            return this;
        }

        /// Sets the memory collaborator. Required when `memoryPersistent` is on.
        ///
        /// @param memoryStore the store, may be null for an in-memory store
        /// @return this builder for chaining, never null
        public Builder memoryStore(MemoryStore memoryStore) {
            this.memoryStore = memoryStore;
            return this;
        }

        public Builder listener(ExecutionListener listener) {
            this.listener = listener != null ? listener : ExecutionListener.NOOP;
            return this;
        }

        /// Sets the pool for background runs. The environment shuts it down on close.
        ///
        /// @param executorService the pool, may be null for a fixed pool of
        ///     `threadPoolSize` threads
        /// @return this builder for chaining, never null
        public Builder executorService(ExecutorService executorService) {
            this.executorService = executorService;
            return this;
        }

        /// Overrides the retry policy derived from the configuration.
        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder loadCredentialsFromEnvironment() {
            this.credentials.putAll(AgencyFactory.loadCredentialsFromEnvironment());
            return this;
        }

        public Builder loadCredentials(Properties properties) {
            this.credentials.putAll(AgencyFactory.loadCredentials(properties));
            return this;
        }

        /// Builds the environment.
        ///
        /// @apiNote **Side effects**:
        /// - Auto-loads environment credentials if none were provided
        /// - Sets `agency.stub.enabled` system property if stub mode is enabled
        /// - Creates a thread pool if none was provided
        ///
        /// @return the configured environment, never null
        /// @throws ConfigurationException if the configuration is invalid or the
        ///     default agent's model has no provider
        public AgencyEnvironment build() {
            validate(config);
            if (credentials.isEmpty()) {
                credentials = AgencyFactory.loadCredentialsFromEnvironment();
            }
            applyStubModeSetting(credentials);

            List<AgentProvider> providers = new ArrayList<>(agentProviders);
            providers.add(new StubAgentProvider());
            AgentFactory agentFactory = new AgentFactory(credentials, providers);
            DefaultAgentRegistry agentRegistry = new DefaultAgentRegistry(agentFactory);
            registerDefaultAgent(agentFactory, agentRegistry);

            ToolRegistry toolRegistry = new DefaultToolRegistry();
            toolRegistry.register(new SystemInfoTool());
            toolHandlers.forEach(toolRegistry::register);
            ToolInvoker toolInvoker = new DefaultToolInvoker(toolRegistry);

            if (memoryStore == null) {
                if (config.isMemoryPersistent()) {
                    throw new ConfigurationException(
                            "memory.persistent is on but no durable MemoryStore was supplied");
                }
                memoryStore = new InMemoryMemoryStore();
            }
            if (snapshotStore == null) {
                snapshotStore = new InMemorySnapshotStore();
            }
            if (retryPolicy == null) {
                retryPolicy = RetryPolicy.from(config);
            }
            if (executorService == null) {
                executorService = Executors.newFixedThreadPool(config.getThreadPoolSize());
            }

            ReasoningLoop reasoningLoop =
                    new ReasoningLoop(
                            agentRegistry,
                            toolRegistry,
                            toolInvoker,
                            memoryStore,
                            config,
                            retryPolicy);
            ActionRunner actionRunner = new ActionRunner(reasoningLoop, toolInvoker, retryPolicy);
            WorkflowManager workflowManager =
                    new WorkflowManager(
                            config, snapshotStore, actionRunner, listener, executorService);

            return new AgencyEnvironment(
                    config,
                    workflowManager,
                    agentRegistry,
                    toolRegistry,
                    memoryStore,
                    snapshotStore,
                    executorService);
        }

        private void registerDefaultAgent(AgentFactory agentFactory, AgentRegistry registry) {
            if (!agentFactory.isModelSupported(config.getAgentModel())) {
                throw new ConfigurationException(
                        "No provider supports model '" + config.getAgentModel() + "'");
            }
            registry.registerAgent(
                    config.getAgentName(),
                    AgentConfig.builder()
                            .id(config.getAgentName())
                            .model(config.getAgentModel())
                            .systemPrompt(config.getSystemPrompt())
                            .build());
        }
    }

    /// Creates a new builder for fluent environment configuration.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }
}

package io.agency.core.agent.stub;

import io.agency.core.agent.Agent;
import io.agency.core.agent.AgentConfig;
import io.agency.core.agent.spi.AgentProvider;
import java.util.Map;
import java.util.logging.Logger;

/// Provider that serves {@link StubAgent}s for offline runs and tests.
///
/// ### Enabling Stub Mode
/// - Credentials map: `agency.stub.enabled=true`
/// - System property: `-Dagency.stub.enabled=true`
/// - Environment variable: `AGENCY_STUB_ENABLED=true`
///
/// ### Priority Behavior
/// - When enabled: priority 1000 (intercepts all models)
/// - When disabled: priority -1 and supports only the literal model `stub`
///
/// @implNote Thread-safe and stateless.
public class StubAgentProvider implements AgentProvider {

    private static final Logger logger = Logger.getLogger(StubAgentProvider.class.getName());

    private static final String ENABLED_KEY = "AGENCY_STUB_ENABLED";
    private static final String ENABLED_PROPERTY = "agency.stub.enabled";
    private static final String STUB_MODEL = "stub";

    @Override
    public String getName() {
        return "stub";
    }

    @Override
    public boolean supportsModel(String modelName) {
        return isEnabledGlobally() || STUB_MODEL.equalsIgnoreCase(modelName);
    }

    @Override
    public Agent createAgent(String agentId, AgentConfig config, Map<String, String> credentials) {
        if (!isEnabled(credentials) && !STUB_MODEL.equalsIgnoreCase(config.getModel())) {
            throw new IllegalStateException(
                    "Stub provider is disabled and model is not 'stub': " + config.getModel());
        }

        logger.info(
                "[STUB] Creating stub agent: " + agentId + " (model: " + config.getModel() + ")");
        return new StubAgent(agentId, config);
    }

    @Override
    public int getPriority() {
        return isEnabledGlobally() ? 1000 : -1;
    }

    private boolean isEnabledGlobally() {
        if ("true".equalsIgnoreCase(System.getProperty(ENABLED_PROPERTY))) {
            return true;
        }
        return "true".equalsIgnoreCase(System.getenv(ENABLED_KEY));
    }

    private boolean isEnabled(Map<String, String> credentials) {
        if (credentials != null) {
            String credValue = credentials.get(ENABLED_KEY);
            if (credValue == null) {
                credValue = credentials.get(ENABLED_PROPERTY);
            }
            if ("true".equalsIgnoreCase(credValue)) {
                return true;
            }
            if ("false".equalsIgnoreCase(credValue)) {
                return false;
            }
        }
        return isEnabledGlobally();
    }
}

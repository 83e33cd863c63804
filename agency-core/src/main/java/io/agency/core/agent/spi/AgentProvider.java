package io.agency.core.agent.spi;

import io.agency.core.agent.Agent;
import io.agency.core.agent.AgentConfig;
import java.util.Map;

/// Provider interface for pluggable model backends.
///
/// Providers are passed explicitly to {@link io.agency.core.agent.AgentFactory};
/// there is no classpath scanning.
///
/// ### Registration
/// {@snippet :
/// var env = AgencyFactory.builder()
///     .agentProviders(List.of(new LangChain4jProvider()))
///     .build();
/// }
///
/// ### Priority System
/// When several providers support a model, the one with the highest
/// {@link #getPriority()} wins. The stub provider uses this to intercept
/// every model in test and offline mode.
///
/// @implNote Implementations should be stateless and thread-safe.
///
/// @see io.agency.core.agent.stub.StubAgentProvider
public interface AgentProvider {

    /// Returns the provider's display name for logging.
    ///
    /// @return provider name (e.g. "langchain4j", "stub"), never null
    String getName();

    /// Checks if this provider can create agents for the model.
    ///
    /// @param modelName model identifier, not null
    /// @return `true` if supported
    boolean supportsModel(String modelName);

    /// Creates an agent for the configuration.
    ///
    /// @param agentId unique identifier for the agent, not null
    /// @param config agent configuration, not null
    /// @param credentials API keys and related settings, not null
    /// @return configured agent, never null
    /// @throws IllegalStateException if required credentials are missing
    Agent createAgent(String agentId, AgentConfig config, Map<String, String> credentials);

    /// Returns this provider's priority for model selection.
    ///
    /// @return priority value; higher values are preferred (default: 0)
    default int getPriority() {
        return 0;
    }
}

package io.agency.core.agent;

import io.agency.core.agent.spi.AgentProvider;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/// Creates agents through the highest-priority provider that supports a model.
///
/// @implNote Thread-safe after construction. Provider list and credentials are
/// copied at construction and never modified.
///
/// @see AgentProvider
/// @see AgentRegistry
public class AgentFactory {

    private static final Logger logger = Logger.getLogger(AgentFactory.class.getName());

    private final List<AgentProvider> providers;
    private final Map<String, String> credentials;

    /// Creates a factory over an explicit provider list.
    ///
    /// @param credentials API keys and settings, not null
    /// @param providers available providers, not null
    public AgentFactory(Map<String, String> credentials, List<AgentProvider> providers) {
        this.credentials = new HashMap<>(credentials);
        this.providers = new ArrayList<>(providers);

        logger.info(
                "Loaded "
                        + this.providers.size()
                        + " agent providers: "
                        + this.providers.stream().map(AgentProvider::getName).toList());
    }

    /// Creates an agent for the configured model.
    ///
    /// @param agentId unique identifier for the agent, not null
    /// @param config agent configuration, not null
    /// @return the created agent, never null
    /// @throws IllegalStateException if no provider supports the configured model
    public Agent createAgent(String agentId, AgentConfig config) {
        String modelName = config.getModel();

        AgentProvider provider =
                providers.stream()
                        .filter(p -> p.supportsModel(modelName))
                        .max(Comparator.comparingInt(AgentProvider::getPriority))
                        .orElseThrow(
                                () ->
                                        new IllegalStateException(
                                                "No provider found for model: "
                                                        + modelName
                                                        + ". Available providers: "
                                                        + providers.stream()
                                                                .map(AgentProvider::getName)
                                                                .toList()));

        logger.info("Creating agent '" + agentId + "' with provider: " + provider.getName());
        return provider.createAgent(agentId, config, credentials);
    }

    public List<AgentProvider> getProviders() {
        return Collections.unmodifiableList(providers);
    }

    /// Checks if any provider supports the given model.
    ///
    /// @param modelName the model identifier, not null
    /// @return `true` if at least one provider supports it
    public boolean isModelSupported(String modelName) {
        return providers.stream().anyMatch(p -> p.supportsModel(modelName));
    }
}

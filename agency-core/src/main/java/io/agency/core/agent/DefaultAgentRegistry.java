package io.agency.core.agent;

import io.agency.core.exception.AgentNotFoundException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/// {@link AgentRegistry} backed by a {@link ConcurrentHashMap} that creates
/// agents through an {@link AgentFactory}.
///
/// @implNote Thread-safe.
public class DefaultAgentRegistry implements AgentRegistry {

    private static final Logger logger = Logger.getLogger(DefaultAgentRegistry.class.getName());

    private final Map<String, Agent> agents = new ConcurrentHashMap<>();
    private final AgentFactory agentFactory;

    public DefaultAgentRegistry(AgentFactory agentFactory) {
        this.agentFactory = agentFactory;
    }

    @Override
    public Optional<Agent> getAgent(String agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }

    @Override
    public Agent getAgentOrThrow(String id) {
        return getAgent(id).orElseThrow(() -> new AgentNotFoundException(id));
    }

    /// Creates and registers an agent.
    ///
    /// @apiNote **Side effects**:
    /// - Overwrites an existing agent with the same id and logs a warning
    ///
    /// @param agentId unique identifier for the agent, not null
    /// @param config agent configuration, not null
    /// @return the registered agent, never null
    @Override
    public Agent registerAgent(String agentId, AgentConfig config) {
        if (agents.containsKey(agentId)) {
            logger.warning("Agent already exists: " + agentId + ". Replacing...");
        }

        Agent agent = agentFactory.createAgent(agentId, config);
        agents.put(agentId, agent);

        logger.info("Registered agent: " + agentId + " with model: " + config.getModel());
        return agent;
    }

    /// Registers an already constructed agent under its own id.
    ///
    /// @param agent the agent, not null
    public void register(Agent agent) {
        agents.put(agent.getId(), agent);
    }

    @Override
    public boolean hasAgent(String agentId) {
        return agents.containsKey(agentId);
    }

    public int size() {
        return agents.size();
    }
}

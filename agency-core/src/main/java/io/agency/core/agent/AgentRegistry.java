package io.agency.core.agent;

import io.agency.core.exception.AgentNotFoundException;
import java.util.Optional;

/// Registry of agents available to reasoning steps.
///
/// @implNote Implementations must be thread-safe.
///
/// @see DefaultAgentRegistry
public interface AgentRegistry {

    /// Retrieves an agent by id.
    ///
    /// @param id the agent identifier, not null
    /// @return the agent, or empty if not registered
    Optional<Agent> getAgent(String id);

    /// Retrieves an agent by id or fails.
    ///
    /// @param id the agent identifier, not null
    /// @return the agent, never null
    /// @throws AgentNotFoundException if no agent is registered under `id`
    Agent getAgentOrThrow(String id);

    /// Creates and registers an agent, replacing any agent with the same id.
    ///
    /// @param agentId unique identifier, not null
    /// @param config agent configuration, not null
    /// @return the registered agent, never null
    /// @throws IllegalStateException if no provider supports the configured model
    Agent registerAgent(String agentId, AgentConfig config);

    boolean hasAgent(String agentId);
}

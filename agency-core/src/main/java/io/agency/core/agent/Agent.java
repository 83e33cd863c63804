package io.agency.core.agent;

import io.agency.core.tool.ToolDefinition;
import java.util.List;
import java.util.Map;

/// Model-provider collaborator consulted by the reasoning loop.
///
/// Each agent wraps one model and answers a prompt with a final answer, a
/// tool-call request or an error. Transient failures may be reported either
/// as an {@link AgentResponse.Error} with a transient type or by throwing
/// {@link io.agency.core.exception.TransientProviderException}.
///
/// ### Contracts
/// - **Postcondition**: `execute()` returns a non-null {@link AgentResponse} or throws
/// - **Invariant**: agent id and config are fixed after construction
///
/// @implNote Implementations should be thread-safe. Steps of different
/// workflows may consult the same agent concurrently.
///
/// @see AgentRegistry
/// @see io.agency.core.agent.spi.AgentProvider
public interface Agent {

    /// Sends a prompt to the model.
    ///
    /// @param prompt the full prompt, not null
    /// @param context step context (workflow id, step name, parameters), not null
    /// @return the model's response, never null
    AgentResponse execute(String prompt, Map<String, Object> context);

    /// Sends a prompt to the model and offers it a set of tools.
    ///
    /// Agents that cannot request tools ignore `tools` and answer in text.
    ///
    /// @param prompt the full prompt, not null
    /// @param context step context, not null
    /// @param tools tools the model may ask to call, not null (may be empty)
    /// @return the model's response, never null
    default AgentResponse execute(
            String prompt, Map<String, Object> context, List<ToolDefinition> tools) {
        return execute(prompt, context);
    }

    String getId();

    AgentConfig getConfig();
}

package io.agency.core.tool;

import java.util.Map;

/// Tool collaborator consulted by the reasoning loop and by tool steps.
///
/// @see DefaultToolInvoker
public interface ToolInvoker {

    /// Invokes a named tool.
    ///
    /// @param toolName registered tool name, not null
    /// @param arguments tool arguments, not null
    /// @return the tool's observation, never null
    /// @throws io.agency.core.exception.TransientToolException if the call may succeed on retry
    /// @throws io.agency.core.exception.UnrecoverableException if the tool is unknown,
    ///     the arguments are invalid or the tool failed permanently
    String invoke(String toolName, Map<String, Object> arguments);
}

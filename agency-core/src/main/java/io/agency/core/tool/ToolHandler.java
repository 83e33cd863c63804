package io.agency.core.tool;

import java.util.Map;

/// Executable tool backend.
///
/// Handlers report retryable failures with
/// {@link io.agency.core.exception.TransientToolException} and permanent ones with
/// {@link io.agency.core.exception.UnrecoverableException}. Any other runtime
/// exception is treated as permanent.
///
/// @implNote Implementations must be thread-safe.
public interface ToolHandler {

    ToolDefinition definition();

    /// Runs the tool.
    ///
    /// @param arguments validated arguments, not null
    /// @return the observation handed back to the model, never null
    String execute(Map<String, Object> arguments);
}

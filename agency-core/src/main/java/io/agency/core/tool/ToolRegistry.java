package io.agency.core.tool;

import java.util.List;
import java.util.Optional;

/// Registry of tool handlers available to reasoning steps and tool steps.
///
/// @implNote Implementations must be thread-safe.
///
/// @see DefaultToolRegistry
public interface ToolRegistry {

    /// Registers a handler, replacing any handler with the same tool name.
    ///
    /// @param handler the handler, not null
    void register(ToolHandler handler);

    /// Looks up a handler by tool name.
    ///
    /// @param name the tool name, not null
    /// @return the handler, or empty if not registered
    Optional<ToolHandler> get(String name);

    /// Returns definitions of every registered tool, sorted by name.
    ///
    /// @return tool definitions, never null
    List<ToolDefinition> definitions();

    boolean contains(String name);
}

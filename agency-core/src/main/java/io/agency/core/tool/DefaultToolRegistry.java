package io.agency.core.tool;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// Thread-safe {@link ToolRegistry} backed by a {@link ConcurrentHashMap}.
///
/// ### Usage
/// {@snippet :
/// ToolRegistry registry = new DefaultToolRegistry(List.of(new SystemInfoTool()));
/// registry.register(myHandler);
/// }
public final class DefaultToolRegistry implements ToolRegistry {

    private final Map<String, ToolHandler> tools = new ConcurrentHashMap<>();

    public DefaultToolRegistry() {}

    /// Creates a registry with initial handlers.
    ///
    /// @param initialTools handlers to register, not null
    public DefaultToolRegistry(List<ToolHandler> initialTools) {
        Objects.requireNonNull(initialTools, "initialTools must not be null");
        initialTools.forEach(this::register);
    }

    @Override
    public void register(ToolHandler handler) {
        Objects.requireNonNull(handler, "handler must not be null");
        tools.put(handler.definition().name(), handler);
    }

    @Override
    public Optional<ToolHandler> get(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return Optional.ofNullable(tools.get(name));
    }

    @Override
    public List<ToolDefinition> definitions() {
        return tools.values().stream()
                .map(ToolHandler::definition)
                .sorted(Comparator.comparing(ToolDefinition::name))
                .toList();
    }

    @Override
    public boolean contains(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return tools.containsKey(name);
    }
}

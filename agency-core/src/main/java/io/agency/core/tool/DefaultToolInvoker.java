package io.agency.core.tool;

import io.agency.core.exception.TransientException;
import io.agency.core.exception.UnrecoverableException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Invokes handlers from a {@link ToolRegistry} after checking required arguments.
///
/// Transient and unrecoverable failures raised by a handler pass through
/// unchanged; anything else, engine exceptions included, becomes an
/// {@link UnrecoverableException}.
///
/// @implNote Thread-safe if the registry and handlers are.
public final class DefaultToolInvoker implements ToolInvoker {

    private static final Logger logger = Logger.getLogger(DefaultToolInvoker.class.getName());

    private final ToolRegistry registry;

    public DefaultToolInvoker(ToolRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    @Override
    public String invoke(String toolName, Map<String, Object> arguments) {
        Objects.requireNonNull(toolName, "toolName must not be null");
        Map<String, Object> args = arguments != null ? arguments : Map.of();

        ToolHandler handler =
                registry.get(toolName)
                        .orElseThrow(
                                () -> new UnrecoverableException("Unknown tool: " + toolName));

        List<String> missing =
                handler.definition().requiredParameterNames().stream()
                        .filter(name -> !args.containsKey(name))
                        .toList();
        if (!missing.isEmpty()) {
            throw new UnrecoverableException(
                    "Tool '" + toolName + "' missing required arguments: " + missing);
        }

        logger.fine("Invoking tool: " + toolName);
        try {
            String result = handler.execute(args);
            return result != null ? result : "";
        } catch (TransientException | UnrecoverableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new UnrecoverableException("Tool '" + toolName + "' failed: " + e.getMessage(), e);
        }
    }
}

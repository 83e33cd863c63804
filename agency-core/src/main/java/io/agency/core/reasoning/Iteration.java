package io.agency.core.reasoning;

import java.util.Map;

/// One think/act/observe cycle.
///
/// @param index 1-based iteration number
/// @param prompt the prompt sent to the model, not null
/// @param response answer text or the model's reasoning for a tool call, not null
/// @param toolName requested tool, null when the model answered directly
/// @param toolArguments tool arguments, empty when no tool was requested
/// @param observation tool result or refusal, null when no tool was requested
public record Iteration(
        int index,
        String prompt,
        String response,
        String toolName,
        Map<String, Object> toolArguments,
        String observation) {

    public Iteration {
        toolArguments = toolArguments != null ? Map.copyOf(toolArguments) : Map.of();
        response = response != null ? response : "";
    }

    public boolean hasToolCall() {
        return toolName != null;
    }
}

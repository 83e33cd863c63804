package io.agency.core.reasoning;

import io.agency.core.memory.MemoryEntry;
import io.agency.core.workflow.StepAction;
import java.util.List;
import java.util.Map;

/// Renders the prompt for one reasoning iteration.
///
/// ### Layout
/// ```
/// ## Relevant context        (only when memory returned entries)
/// - ...
/// ## Task
/// <instruction>
/// ## Parameters              (only when the action carries parameters)
/// - key: value
/// ## Previous steps          (only after the first iteration)
/// [1] Tool call: name {args}
///     Observation: ...
/// <closing instruction>
/// ```
final class PromptBuilder {

    String build(
            StepAction.Reason action,
            Trajectory trajectory,
            List<MemoryEntry> memory,
            boolean toolsEnabled) {
        StringBuilder prompt = new StringBuilder();

        if (!memory.isEmpty()) {
            prompt.append("## Relevant context\n");
            for (MemoryEntry entry : memory) {
                prompt.append("- ").append(entry.content().replace("\n", "\n  ")).append('\n');
            }
            prompt.append('\n');
        }

        prompt.append("## Task\n").append(action.instruction()).append("\n\n");

        if (!action.parameters().isEmpty()) {
            prompt.append("## Parameters\n");
            for (Map.Entry<String, Object> parameter : action.parameters().entrySet()) {
                prompt.append("- ")
                        .append(parameter.getKey())
                        .append(": ")
                        .append(parameter.getValue())
                        .append('\n');
            }
            prompt.append('\n');
        }

        if (!trajectory.isEmpty()) {
            prompt.append("## Previous steps\n");
            for (Iteration iteration : trajectory.iterations()) {
                prompt.append('[').append(iteration.index()).append("] ");
                if (iteration.hasToolCall()) {
                    prompt.append("Tool call: ")
                            .append(iteration.toolName())
                            .append(' ')
                            .append(iteration.toolArguments())
                            .append('\n');
                    if (!iteration.response().isBlank()) {
                        prompt.append("    Reasoning: ").append(iteration.response()).append('\n');
                    }
                    prompt.append("    Observation: ").append(iteration.observation()).append('\n');
                } else {
                    prompt.append(iteration.response()).append('\n');
                }
            }
            prompt.append('\n');
        }

        prompt.append(
                toolsEnabled
                        ? "Answer the task, or call one of the available tools if you need more information."
                        : "Answer the task directly.");
        return prompt.toString();
    }
}

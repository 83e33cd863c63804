package io.agency.core.workflow;

import java.util.Map;
import java.util.Objects;

/// Closed set of operations a saga step can perform, forward or compensating.
///
/// - {@link Reason}: run the bounded reasoning loop over an instruction
/// - {@link InvokeTool}: call one named tool directly with fixed arguments
/// - {@link NoOp}: do nothing and succeed
///
/// The executor dispatches over exactly these kinds; adding a kind means
/// extending the `permits` clause and every dispatch site with it.
///
/// @see io.agency.core.execution.ActionRunner
public sealed interface StepAction
        permits StepAction.Reason, StepAction.InvokeTool, StepAction.NoOp {

    /// Short label used in logs and in the JSON `type` discriminator.
    String kind();

    /// Runs the reasoning loop over an instruction.
    ///
    /// @param instruction the task text given to the model, not null
    /// @param agentId agent to consult, null for the configured default agent
    /// @param parameters extra values exposed to the prompt, not null
    record Reason(String instruction, String agentId, Map<String, Object> parameters)
            implements StepAction {

        public Reason {
            Objects.requireNonNull(instruction, "instruction must not be null");
            parameters = parameters != null ? Map.copyOf(parameters) : Map.of();
        }

        public static Reason of(String instruction) {
            return new Reason(instruction, null, Map.of());
        }

        public static Reason of(String instruction, String agentId) {
            return new Reason(instruction, agentId, Map.of());
        }

        @Override
        public String kind() {
            return "reason";
        }
    }

    /// Invokes a registered tool without consulting a model.
    ///
    /// @param toolName registered tool name, not null
    /// @param arguments tool arguments, not null
    record InvokeTool(String toolName, Map<String, Object> arguments) implements StepAction {

        public InvokeTool {
            Objects.requireNonNull(toolName, "toolName must not be null");
            arguments = arguments != null ? Map.copyOf(arguments) : Map.of();
        }

        public static InvokeTool of(String toolName, Map<String, Object> arguments) {
            return new InvokeTool(toolName, arguments);
        }

        @Override
        public String kind() {
            return "tool";
        }
    }

    /// Succeeds immediately with an empty output.
    record NoOp() implements StepAction {

        private static final NoOp INSTANCE = new NoOp();

        public static NoOp of() {
            return INSTANCE;
        }

        @Override
        public String kind() {
            return "noop";
        }
    }
}

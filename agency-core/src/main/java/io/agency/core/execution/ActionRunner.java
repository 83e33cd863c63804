package io.agency.core.execution;

import io.agency.core.reasoning.ReasoningLoop;
import io.agency.core.reasoning.ReasoningResult;
import io.agency.core.reasoning.RetryPolicy;
import io.agency.core.reasoning.RetryTracker;
import io.agency.core.tool.ToolInvoker;
import io.agency.core.workflow.StepAction;
import java.util.Map;
import java.util.Objects;

/// Runs one {@link StepAction}, forward or compensating, and reports the result.
///
/// Dispatch covers every permitted action kind; a new kind fails here until it
/// is handled.
///
/// @implNote Thread-safe if the reasoning loop and tool invoker are.
public class ActionRunner {

    private final ReasoningLoop reasoningLoop;
    private final ToolInvoker toolInvoker;
    private final RetryPolicy retryPolicy;

    public ActionRunner(
            ReasoningLoop reasoningLoop, ToolInvoker toolInvoker, RetryPolicy retryPolicy) {
        this.reasoningLoop = Objects.requireNonNull(reasoningLoop, "reasoningLoop must not be null");
        this.toolInvoker = Objects.requireNonNull(toolInvoker, "toolInvoker must not be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
    }

    /// Runs an action.
    ///
    /// @param action the action, not null
    /// @param context step context, not null
    /// @param maxThinkingSteps reasoning bound for `Reason` actions
    /// @return success or failure, never null
    public ActionResult run(StepAction action, Map<String, Object> context, int maxThinkingSteps) {
        if (action instanceof StepAction.Reason reason) {
            ReasoningResult result = reasoningLoop.run(reason, context, maxThinkingSteps);
            return result.isSuccess()
                    ? new ActionResult.Success(
                            result.output(),
                            result.isTruncated(),
                            result.retries(),
                            result.iterations().size())
                    : new ActionResult.Failure(result.error(), result.retries());
        }
        if (action instanceof StepAction.InvokeTool tool) {
            RetryTracker tracker = new RetryTracker();
            try {
                String output =
                        retryPolicy.execute(
                                "Tool '" + tool.toolName() + "'",
                                () -> toolInvoker.invoke(tool.toolName(), tool.arguments()),
                                tracker);
                return new ActionResult.Success(output, false, tracker.retries(), 0);
            } catch (RuntimeException e) {
                // anything that survives the retry policy is permanent
                return new ActionResult.Failure(e.getMessage(), tracker.retries());
            }
        }
        if (action instanceof StepAction.NoOp) {
            return new ActionResult.Success("", false, 0, 0);
        }
        throw new IllegalStateException("Unhandled action kind: " + action.kind());
    }
}

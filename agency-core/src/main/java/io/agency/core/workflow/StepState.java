package io.agency.core.workflow;

import java.util.Objects;

/// Runtime record of one step, indexed by the step's position.
///
/// @param status current step status, not null
/// @param attemptCount attempts consumed, counting transient retries, zero before the step starts
/// @param thinkingSteps reasoning iterations used by the forward action, zero for non-reasoning actions
/// @param output result payload on success, may be null
/// @param truncated whether `output` is a partial answer cut off by the thinking-step bound
/// @param error error description on failure, may be null
public record StepState(
        StepStatus status,
        int attemptCount,
        int thinkingSteps,
        String output,
        boolean truncated,
        String error) {

    private static final StepState NOT_STARTED =
            new StepState(StepStatus.NOT_STARTED, 0, 0, null, false, null);

    public StepState {
        Objects.requireNonNull(status, "status must not be null");
        if (attemptCount < 0 || thinkingSteps < 0) {
            throw new IllegalArgumentException("counters must not be negative");
        }
    }

    public static StepState notStarted() {
        return NOT_STARTED;
    }

    public StepState inProgress() {
        return new StepState(StepStatus.IN_PROGRESS, attemptCount + 1, 0, null, false, null);
    }

    public StepState succeeded(String output, boolean truncated, int retries, int thinkingSteps) {
        return new StepState(
                StepStatus.SUCCEEDED, attemptCount + retries, thinkingSteps, output, truncated, null);
    }

    public StepState failed(String error, int retries) {
        return new StepState(StepStatus.FAILED, attemptCount + retries, 0, null, false, error);
    }

    /// Marks a step that was `IN_PROGRESS` when the process stopped.
    public StepState interrupted() {
        return new StepState(
                StepStatus.FAILED,
                attemptCount,
                0,
                null,
                false,
                "Interrupted while in progress; outcome unknown");
    }

    public StepState compensated() {
        return new StepState(
                StepStatus.COMPENSATED, attemptCount, thinkingSteps, output, truncated, error);
    }

    public StepState compensationFailed(String compensationError) {
        return new StepState(
                StepStatus.COMPENSATION_FAILED,
                attemptCount,
                thinkingSteps,
                output,
                truncated,
                compensationError);
    }
}

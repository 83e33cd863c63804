package io.agency.core.execution;

import io.agency.core.workflow.WorkflowStatus;

/// What a single {@link SagaExecutor#advance} call did.
public sealed interface StepOutcome
        permits StepOutcome.Started,
                StepOutcome.StepSucceeded,
                StepOutcome.StepFailed,
                StepOutcome.StepCompensated,
                StepOutcome.CompensationFailed,
                StepOutcome.Halted {

    /// Returns whether further `advance` calls can make progress.
    default boolean canContinue() {
        return true;
    }

    /// `PENDING` moved to `RUNNING`.
    record Started() implements StepOutcome {}

    record StepSucceeded(int stepIndex, String stepName, boolean truncated) implements StepOutcome {}

    /// The step failed and the workflow moved to `COMPENSATING`.
    record StepFailed(int stepIndex, String stepName, String error) implements StepOutcome {}

    record StepCompensated(int stepIndex, String stepName) implements StepOutcome {}

    /// A compensation failed and the workflow moved to `FAILED`.
    record CompensationFailed(int stepIndex, String stepName, String error) implements StepOutcome {
        @Override
        public boolean canContinue() {
            return false;
        }
    }

    /// The workflow is terminal or suspended; nothing was done, or the last
    /// transition into that status was committed.
    record Halted(WorkflowStatus status) implements StepOutcome {
        @Override
        public boolean canContinue() {
            return false;
        }
    }
}

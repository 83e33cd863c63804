package io.agency.core.execution;

import java.util.Objects;

/// Result of running one step action.
public sealed interface ActionResult permits ActionResult.Success, ActionResult.Failure {

    /// Transient retries consumed while running the action.
    int retries();

    /// @param output action output, never null (may be empty)
    /// @param truncated whether `output` is a partial reasoning answer
    /// @param retries transient retries consumed
    /// @param thinkingSteps reasoning iterations used, zero for non-reasoning actions
    record Success(String output, boolean truncated, int retries, int thinkingSteps)
            implements ActionResult {
        public Success {
            output = output != null ? output : "";
        }
    }

    /// @param error failure description, not null
    /// @param retries transient retries consumed
    record Failure(String error, int retries) implements ActionResult {
        public Failure {
            Objects.requireNonNull(error, "error must not be null");
        }
    }
}

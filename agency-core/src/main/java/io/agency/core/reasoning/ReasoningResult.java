package io.agency.core.reasoning;

import java.util.List;
import java.util.Objects;

/// Outcome of one reasoning-loop run.
///
/// @param terminatedBy why the loop stopped, not null
/// @param output final or partial answer, null on unrecoverable error
/// @param error failure description, null unless `terminatedBy` is `UNRECOVERABLE_ERROR`
/// @param iterations the trajectory, not null
/// @param retries transient retries consumed across all iterations
public record ReasoningResult(
        TerminationReason terminatedBy,
        String output,
        String error,
        List<Iteration> iterations,
        int retries) {

    public ReasoningResult {
        Objects.requireNonNull(terminatedBy, "terminatedBy must not be null");
        iterations = iterations != null ? List.copyOf(iterations) : List.of();
    }

    public static ReasoningResult finalAnswer(String output, Trajectory trajectory, int retries) {
        return new ReasoningResult(
                TerminationReason.FINAL_ANSWER, output, null, trajectory.iterations(), retries);
    }

    public static ReasoningResult stepLimitReached(Trajectory trajectory, int retries) {
        return new ReasoningResult(
                TerminationReason.STEP_LIMIT_REACHED,
                trajectory.partialAnswer(),
                null,
                trajectory.iterations(),
                retries);
    }

    public static ReasoningResult unrecoverable(String error, Trajectory trajectory, int retries) {
        return new ReasoningResult(
                TerminationReason.UNRECOVERABLE_ERROR,
                null,
                error,
                trajectory.iterations(),
                retries);
    }

    /// Returns whether the step may be marked succeeded.
    ///
    /// @return `true` for a final answer and for a truncated answer
    public boolean isSuccess() {
        return terminatedBy != TerminationReason.UNRECOVERABLE_ERROR;
    }

    public boolean isTruncated() {
        return terminatedBy == TerminationReason.STEP_LIMIT_REACHED;
    }
}

package io.agency.core.workflow;

/// Lifecycle of a workflow.
///
/// ```
/// PENDING → RUNNING ⇄ SUSPENDED
///           RUNNING → COMPLETED
///           RUNNING → COMPENSATING → COMPENSATED | FAILED
/// ```
public enum WorkflowStatus {
    PENDING,
    RUNNING,
    SUSPENDED,
    COMPENSATING,
    COMPLETED,
    COMPENSATED,
    FAILED;

    /// Returns whether no further transition is possible.
    ///
    /// @return `true` for `COMPLETED`, `COMPENSATED` and `FAILED`
    public boolean isTerminal() {
        return this == COMPLETED || this == COMPENSATED || this == FAILED;
    }

    /// Returns whether an executor was working on the workflow when this status
    /// was committed, so finding it at startup means the process died mid-run.
    ///
    /// @return `true` for `PENDING`, `RUNNING` and `COMPENSATING`
    public boolean isInterrupted() {
        return this == PENDING || this == RUNNING || this == COMPENSATING;
    }
}

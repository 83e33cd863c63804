package io.agency.core.workflow;

/// Lifecycle of a single step within a workflow.
public enum StepStatus {
    NOT_STARTED,
    IN_PROGRESS,
    SUCCEEDED,
    FAILED,
    COMPENSATED,
    COMPENSATION_FAILED
}

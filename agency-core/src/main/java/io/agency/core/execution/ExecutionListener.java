package io.agency.core.execution;

import io.agency.core.workflow.StepState;
import io.agency.core.workflow.WorkflowSnapshot;

/// Listener for saga lifecycle events.
///
/// All methods have no-op defaults. Callbacks fire after the corresponding
/// snapshot has been committed, so a listener never observes state that the
/// store rejected.
///
/// ### Callback Order
/// ```
/// onCheckpoint(snapshot)                    every committed version
/// onStepStarted(workflowId, index, name)    step marked IN_PROGRESS
/// onStepFinished(workflowId, index, name, state)
/// onCompensationStarted(workflowId, index, name)
/// onCompensationFinished(workflowId, index, name, state)
/// onWorkflowFinished(snapshot)              terminal or suspended
/// ```
///
/// @implNote Implementations must be thread-safe; different workflows report
/// from different threads.
public interface ExecutionListener {

    ExecutionListener NOOP = new ExecutionListener() {};

    default void onCheckpoint(WorkflowSnapshot snapshot) {}

    default void onStepStarted(String workflowId, int stepIndex, String stepName) {}

    default void onStepFinished(String workflowId, int stepIndex, String stepName, StepState state) {}

    default void onCompensationStarted(String workflowId, int stepIndex, String stepName) {}

    default void onCompensationFinished(
            String workflowId, int stepIndex, String stepName, StepState state) {}

    /// Called when a run stops because the workflow reached a terminal status
    /// or was suspended.
    ///
    /// @param snapshot the final committed snapshot of the run, not null
    default void onWorkflowFinished(WorkflowSnapshot snapshot) {}
}

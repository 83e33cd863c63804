package io.agency.core.execution;

import io.agency.core.exception.CompensationFailedException;
import io.agency.core.state.SnapshotStore;
import io.agency.core.workflow.StepDescriptor;
import io.agency.core.workflow.StepState;
import io.agency.core.workflow.StepStatus;
import io.agency.core.workflow.Workflow;
import io.agency.core.workflow.WorkflowSnapshot;
import io.agency.core.workflow.WorkflowStatus;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Drives a workflow through its steps with rollback-on-failure semantics.
///
/// ### Forward Path
/// The first `NOT_STARTED` step is marked `IN_PROGRESS` and committed before its
/// action runs. Success commits `SUCCEEDED`; failure commits `FAILED` together
/// with the move to `COMPENSATING`.
///
/// ### Compensation Path
/// Previously succeeded steps are compensated in strict reverse order. Steps
/// without a compensation are skipped. The first failed compensation marks its
/// step `COMPENSATION_FAILED`, moves the workflow to `FAILED` and stops; earlier
/// steps are left as they are for an operator to resolve.
///
/// ### Persist Before Proceed
/// Every transition is written to the {@link SnapshotStore} before the live
/// {@link Workflow} handle is updated. A {@link io.agency.core.exception.StorageException}
/// propagates to the caller and leaves the handle at the last committed version,
/// so a result whose snapshot was rejected is never reported as committed.
///
/// ### Suspension
/// Suspend requests are honoured only while `RUNNING`, at a step boundary. An
/// action that is already running is never interrupted.
///
/// @implNote Thread-safe for different workflows. A single workflow must be
/// advanced by one thread at a time; the {@link WorkflowManager} enforces this.
///
/// @see WorkflowManager
/// @see ActionRunner
public class SagaExecutor {

    private static final Logger logger = Logger.getLogger(SagaExecutor.class.getName());

    private final SnapshotStore snapshotStore;
    private final ActionRunner actionRunner;
    private final ExecutionListener listener;

    public SagaExecutor(
            SnapshotStore snapshotStore, ActionRunner actionRunner, ExecutionListener listener) {
        this.snapshotStore = Objects.requireNonNull(snapshotStore, "snapshotStore must not be null");
        this.actionRunner = Objects.requireNonNull(actionRunner, "actionRunner must not be null");
        this.listener = listener != null ? listener : ExecutionListener.NOOP;
    }

    /// Performs one transition.
    ///
    /// @param workflow the workflow to advance, not null
    /// @return what was done, never null
    /// @throws io.agency.core.exception.StorageException if a snapshot could not be committed
    /// @throws IllegalStateException if a step is still `IN_PROGRESS`; call
    ///     {@link #prepareResume} first
    public StepOutcome advance(Workflow workflow) {
        Objects.requireNonNull(workflow, "workflow must not be null");
        WorkflowSnapshot current = workflow.current();

        return switch (current.status()) {
            case PENDING -> start(workflow, current);
            case RUNNING -> advanceForward(workflow, current);
            case COMPENSATING -> advanceCompensation(workflow, current);
            case SUSPENDED, COMPLETED, COMPENSATED, FAILED -> new StepOutcome.Halted(
                    current.status());
        };
    }

    /// Advances until the workflow is terminal or suspended.
    ///
    /// @param workflow the workflow to run, not null
    /// @return the final committed snapshot, never null
    /// @throws CompensationFailedException after committing `FAILED` when a compensation fails
    /// @throws io.agency.core.exception.StorageException if a snapshot could not be committed
    public WorkflowSnapshot runToCompletion(Workflow workflow) {
        StepOutcome outcome;
        do {
            outcome = advance(workflow);
        } while (outcome.canContinue());

        if (outcome instanceof StepOutcome.CompensationFailed failed) {
            throw new CompensationFailedException(
                    workflow.getId(), failed.stepIndex(), failed.stepName(), failed.error());
        }
        return workflow.current();
    }

    /// Makes a reloaded workflow runnable again.
    ///
    /// - A step left `IN_PROGRESS` by a crash is marked `FAILED` and compensation
    ///   begins; its action is never re-run because its side effects are unknown.
    /// - A `SUSPENDED` workflow moves back to `RUNNING`.
    /// - Terminal workflows are returned unchanged.
    ///
    /// @param workflow the reloaded workflow, not null
    /// @return the committed snapshot after recovery, never null
    /// @throws io.agency.core.exception.StorageException if the recovery snapshot could not be committed
    public WorkflowSnapshot prepareResume(Workflow workflow) {
        WorkflowSnapshot current = workflow.current();
        if (current.status().isTerminal()) {
            return current;
        }

        int inProgress = current.indexOf(StepStatus.IN_PROGRESS);
        if (inProgress >= 0) {
            StepDescriptor step = current.step(inProgress);
            logger.warning(
                    "Workflow '"
                            + workflow.getId()
                            + "' has step "
                            + inProgress
                            + " ("
                            + step.name()
                            + ") in progress; marking it failed and compensating");
            return commit(
                    workflow,
                    current.next()
                            .step(inProgress, current.stepState(inProgress).interrupted())
                            .status(WorkflowStatus.COMPENSATING)
                            .compensationCursor(inProgress - 1)
                            .checkpointReason("recovered-in-progress:" + step.name())
                            .build());
        }
        if (current.status() == WorkflowStatus.SUSPENDED) {
            return commit(
                    workflow,
                    current.next().status(WorkflowStatus.RUNNING).checkpointReason("resumed").build());
        }
        return current;
    }

    // --- Forward path ---

    private StepOutcome start(Workflow workflow, WorkflowSnapshot current) {
        commit(
                workflow,
                current.next().status(WorkflowStatus.RUNNING).checkpointReason("started").build());
        logger.info("Workflow '" + workflow.getId() + "' started");
        return new StepOutcome.Started();
    }

    private StepOutcome advanceForward(Workflow workflow, WorkflowSnapshot current) {
        if (workflow.isSuspendRequested()) {
            return suspend(workflow, current);
        }

        int running = current.indexOf(StepStatus.IN_PROGRESS);
        if (running >= 0) {
            throw new IllegalStateException(
                    "Step " + running + " of workflow '" + workflow.getId() + "' is in progress");
        }

        int index = current.indexOf(StepStatus.NOT_STARTED);
        if (index < 0) {
            WorkflowSnapshot completed =
                    commit(
                            workflow,
                            current.next()
                                    .status(WorkflowStatus.COMPLETED)
                                    .checkpointReason("completed")
                                    .build());
            logger.info("Workflow '" + workflow.getId() + "' completed");
            listener.onWorkflowFinished(completed);
            return new StepOutcome.Halted(WorkflowStatus.COMPLETED);
        }

        StepDescriptor step = current.step(index);
        WorkflowSnapshot started =
                commit(
                        workflow,
                        current.next()
                                .step(index, current.stepState(index).inProgress())
                                .checkpointReason("step-started:" + step.name())
                                .build());
        listener.onStepStarted(workflow.getId(), index, step.name());

        ActionResult result =
                actionRunner.run(
                        step.forward(),
                        stepContext(started, index, false),
                        started.maxThinkingSteps());
        StepState inProgress = started.stepState(index);

        if (result instanceof ActionResult.Success success) {
            StepState succeeded =
                    inProgress.succeeded(
                            success.output(),
                            success.truncated(),
                            success.retries(),
                            success.thinkingSteps());
            commit(
                    workflow,
                    started.next()
                            .step(index, succeeded)
                            .checkpointReason("step-succeeded:" + step.name())
                            .build());
            listener.onStepFinished(workflow.getId(), index, step.name(), succeeded);
            return new StepOutcome.StepSucceeded(index, step.name(), success.truncated());
        }

        ActionResult.Failure failure = (ActionResult.Failure) result;
        StepState failed = inProgress.failed(failure.error(), failure.retries());
        commit(
                workflow,
                started.next()
                        .step(index, failed)
                        .status(WorkflowStatus.COMPENSATING)
                        .compensationCursor(index - 1)
                        .checkpointReason("step-failed:" + step.name())
                        .build());
        logger.warning(
                "Workflow '"
                        + workflow.getId()
                        + "' step "
                        + index
                        + " ("
                        + step.name()
                        + ") failed, compensating: "
                        + failure.error());
        listener.onStepFinished(workflow.getId(), index, step.name(), failed);
        return new StepOutcome.StepFailed(index, step.name(), failure.error());
    }

    private StepOutcome suspend(Workflow workflow, WorkflowSnapshot current) {
        WorkflowSnapshot suspended =
                commit(
                        workflow,
                        current.next()
                                .status(WorkflowStatus.SUSPENDED)
                                .checkpointReason(workflow.peekSuspendReason())
                                .build());
        workflow.takeSuspendRequest();
        logger.info("Workflow '" + workflow.getId() + "' suspended at a step boundary");
        listener.onWorkflowFinished(suspended);
        return new StepOutcome.Halted(WorkflowStatus.SUSPENDED);
    }

    // --- Compensation path ---

    private StepOutcome advanceCompensation(Workflow workflow, WorkflowSnapshot current) {
        int cursor = current.compensationCursor();
        while (cursor >= 0 && !isCompensable(current, cursor)) {
            cursor--;
        }

        if (cursor < 0) {
            WorkflowSnapshot compensated =
                    commit(
                            workflow,
                            current.next()
                                    .status(WorkflowStatus.COMPENSATED)
                                    .compensationCursor(-1)
                                    .checkpointReason("compensated")
                                    .build());
            logger.info("Workflow '" + workflow.getId() + "' fully compensated");
            listener.onWorkflowFinished(compensated);
            return new StepOutcome.Halted(WorkflowStatus.COMPENSATED);
        }

        StepDescriptor step = current.step(cursor);
        listener.onCompensationStarted(workflow.getId(), cursor, step.name());
        ActionResult result =
                actionRunner.run(
                        step.compensation(),
                        stepContext(current, cursor, true),
                        current.maxThinkingSteps());
        StepState succeeded = current.stepState(cursor);

        if (result instanceof ActionResult.Success) {
            StepState compensated = succeeded.compensated();
            commit(
                    workflow,
                    current.next()
                            .step(cursor, compensated)
                            .compensationCursor(cursor - 1)
                            .checkpointReason("step-compensated:" + step.name())
                            .build());
            listener.onCompensationFinished(workflow.getId(), cursor, step.name(), compensated);
            return new StepOutcome.StepCompensated(cursor, step.name());
        }

        String error = ((ActionResult.Failure) result).error();
        StepState compensationFailed = succeeded.compensationFailed(error);
        String detail =
                "Compensation of step " + cursor + " (" + step.name() + ") failed: " + error;
        WorkflowSnapshot failed =
                commit(
                        workflow,
                        current.next()
                                .step(cursor, compensationFailed)
                                .status(WorkflowStatus.FAILED)
                                .compensationCursor(-1)
                                .failureDetail(detail)
                                .checkpointReason("compensation-failed:" + step.name())
                                .build());
        logger.severe("Workflow '" + workflow.getId() + "' failed: " + detail);
        listener.onCompensationFinished(workflow.getId(), cursor, step.name(), compensationFailed);
        listener.onWorkflowFinished(failed);
        return new StepOutcome.CompensationFailed(cursor, step.name(), error);
    }

    private static boolean isCompensable(WorkflowSnapshot snapshot, int index) {
        return snapshot.stepState(index).status() == StepStatus.SUCCEEDED
                && snapshot.step(index).hasCompensation();
    }

    // --- Helpers ---

    private WorkflowSnapshot commit(Workflow workflow, WorkflowSnapshot candidate) {
        snapshotStore.put(candidate);
        workflow.commit(candidate);
        listener.onCheckpoint(candidate);
        return candidate;
    }

    private static Map<String, Object> stepContext(
            WorkflowSnapshot snapshot, int index, boolean compensating) {
        Map<String, Object> context = new HashMap<>();
        context.put("workflow_id", snapshot.workflowId());
        context.put("step", snapshot.step(index).name());
        context.put("step_index", index);
        context.put("compensating", compensating);
        if (snapshot.initialMessage() != null) {
            context.put("initial_message", snapshot.initialMessage());
        }
        for (int i = index - 1; i >= 0; i--) {
            StepState previous = snapshot.stepState(i);
            if (previous.output() != null) {
                context.put("previous_output", previous.output());
                break;
            }
        }
        if (compensating && snapshot.stepState(index).output() != null) {
            context.put("step_output", snapshot.stepState(index).output());
        }
        return context;
    }
}

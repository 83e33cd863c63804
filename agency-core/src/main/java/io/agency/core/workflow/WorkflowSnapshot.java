package io.agency.core.workflow;

import io.agency.core.state.SnapshotSummary;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Immutable, versioned capture of a workflow and all of its step states.
///
/// A snapshot holds everything needed to resume execution without replaying
/// any reasoning: the fixed step list, every step's runtime state, the
/// workflow status and, during rollback, the position of the next step to
/// compensate.
///
/// ### Contracts
/// - **Invariant**: `steps` is non-empty and `stepStates` has the same size
/// - **Invariant**: at most one step is `IN_PROGRESS`
/// - **Invariant**: `version` starts at 1; {@link #next()} produces exactly `version + 1`
///
/// ### Usage
/// {@snippet :
/// WorkflowSnapshot started = snapshot.next()
///     .status(WorkflowStatus.RUNNING)
///     .checkpointReason("started")
///     .build();
/// }
///
/// @param workflowId caller-supplied workflow identifier, not null
/// @param version monotonically increasing snapshot version, at least 1
/// @param status workflow status at this version, not null
/// @param steps ordered step definitions, fixed at creation, not null
/// @param stepStates runtime state per step, same order as `steps`, not null
/// @param maxThinkingSteps reasoning iteration bound per action, at least 1
/// @param initialMessage the message the workflow was created from, may be null
/// @param createdAt when the workflow was created, not null
/// @param updatedAt when this version was produced, not null
/// @param checkpointReason why this version was written, may be null
/// @param compensationCursor index of the next step to examine while compensating, -1 otherwise
/// @param failureDetail description of the compensation that failed, may be null
public record WorkflowSnapshot(
        String workflowId,
        long version,
        WorkflowStatus status,
        List<StepDescriptor> steps,
        List<StepState> stepStates,
        int maxThinkingSteps,
        String initialMessage,
        Instant createdAt,
        Instant updatedAt,
        String checkpointReason,
        int compensationCursor,
        String failureDetail) {

    public WorkflowSnapshot {
        Objects.requireNonNull(workflowId, "workflowId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(steps, "steps must not be null");
        Objects.requireNonNull(stepStates, "stepStates must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        if (version < 1) {
            throw new IllegalArgumentException("version must be at least 1");
        }
        if (steps.isEmpty()) {
            throw new IllegalArgumentException("steps must not be empty");
        }
        if (steps.size() != stepStates.size()) {
            throw new IllegalArgumentException(
                    "stepStates size " + stepStates.size() + " != steps size " + steps.size());
        }
        if (maxThinkingSteps < 1) {
            throw new IllegalArgumentException("maxThinkingSteps must be at least 1");
        }
        long inProgress =
                stepStates.stream().filter(s -> s.status() == StepStatus.IN_PROGRESS).count();
        if (inProgress > 1) {
            throw new IllegalArgumentException("at most one step may be IN_PROGRESS");
        }
        steps = List.copyOf(steps);
        stepStates = List.copyOf(stepStates);
        updatedAt = updatedAt != null ? updatedAt : createdAt;
    }

    /// Creates version 1 of a new workflow with every step `NOT_STARTED`.
    ///
    /// @param workflowId workflow identifier, not null
    /// @param steps ordered step definitions, not null or empty
    /// @param maxThinkingSteps reasoning bound per action, at least 1
    /// @param initialMessage originating message, may be null
    /// @return a `PENDING` snapshot, never null
    public static WorkflowSnapshot initial(
            String workflowId,
            List<StepDescriptor> steps,
            int maxThinkingSteps,
            String initialMessage) {
        Instant now = Instant.now();
        List<StepState> states = new ArrayList<>(steps.size());
        for (int i = 0; i < steps.size(); i++) {
            states.add(StepState.notStarted());
        }
        return new WorkflowSnapshot(
                workflowId,
                1,
                WorkflowStatus.PENDING,
                steps,
                states,
                maxThinkingSteps,
                initialMessage,
                now,
                now,
                "created",
                -1,
                null);
    }

    /// Starts building the successor version of this snapshot.
    ///
    /// @return a builder pre-filled with this snapshot's fields, never null
    public Successor next() {
        return new Successor(this);
    }

    public StepState stepState(int index) {
        return stepStates.get(index);
    }

    public StepDescriptor step(int index) {
        return steps.get(index);
    }

    /// Returns the index of the first step in the given status.
    ///
    /// @param stepStatus status to look for, not null
    /// @return the lowest matching index, or -1 if none
    public int indexOf(StepStatus stepStatus) {
        for (int i = 0; i < stepStates.size(); i++) {
            if (stepStates.get(i).status() == stepStatus) {
                return i;
            }
        }
        return -1;
    }

    /// Returns the output of the latest succeeded step.
    ///
    /// @return output text, or null if no step has succeeded
    public String output() {
        for (int i = stepStates.size() - 1; i >= 0; i--) {
            StepState state = stepStates.get(i);
            if (state.status() == StepStatus.SUCCEEDED && state.output() != null) {
                return state.output();
            }
        }
        return null;
    }

    public SnapshotSummary summary() {
        return new SnapshotSummary(workflowId, version, status, updatedAt);
    }

    /// Builder for the next snapshot version.
    ///
    /// @implNote **Not thread-safe**. Used by a single executor thread.
    public static final class Successor {
        private final WorkflowSnapshot base;
        private final List<StepState> stepStates;
        private WorkflowStatus status;
        private String checkpointReason;
        private int compensationCursor;
        private String failureDetail;

        private Successor(WorkflowSnapshot base) {
            this.base = base;
            this.stepStates = new ArrayList<>(base.stepStates);
            this.status = base.status;
            this.compensationCursor = base.compensationCursor;
            this.failureDetail = base.failureDetail;
        }

        public Successor status(WorkflowStatus status) {
            this.status = status;
            return this;
        }

        public Successor step(int index, StepState state) {
            stepStates.set(index, state);
            return this;
        }

        public Successor checkpointReason(String checkpointReason) {
            this.checkpointReason = checkpointReason;
            return this;
        }

        public Successor compensationCursor(int compensationCursor) {
            this.compensationCursor = compensationCursor;
            return this;
        }

        public Successor failureDetail(String failureDetail) {
            this.failureDetail = failureDetail;
            return this;
        }

        public WorkflowSnapshot build() {
            return new WorkflowSnapshot(
                    base.workflowId,
                    base.version + 1,
                    status,
                    base.steps,
                    stepStates,
                    base.maxThinkingSteps,
                    base.initialMessage,
                    base.createdAt,
                    Instant.now(),
                    checkpointReason,
                    compensationCursor,
                    failureDetail);
        }
    }
}

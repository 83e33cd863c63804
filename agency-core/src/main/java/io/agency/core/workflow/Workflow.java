package io.agency.core.workflow;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/// Live handle on a workflow held by the manager.
///
/// Exposes the last committed snapshot and a cooperative suspend flag. Only the
/// saga executor replaces the committed snapshot, and only after the store has
/// accepted it, so readers never see state that was not persisted.
///
/// @implNote Thread-safe. The committed snapshot and the suspend request are
/// read by request threads while one executor thread advances the workflow.
public final class Workflow {

    private final String id;
    private final AtomicReference<WorkflowSnapshot> committed;
    private final AtomicReference<String> suspendRequest = new AtomicReference<>();

    public Workflow(WorkflowSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        this.id = snapshot.workflowId();
        this.committed = new AtomicReference<>(snapshot);
    }

    public String getId() {
        return id;
    }

    /// Returns the last snapshot accepted by the store.
    ///
    /// @return committed snapshot, never null
    public WorkflowSnapshot current() {
        return committed.get();
    }

    /// Replaces the committed snapshot. Call only after a successful store write.
    ///
    /// @param snapshot the newly persisted snapshot, not null
    public void commit(WorkflowSnapshot snapshot) {
        if (!id.equals(snapshot.workflowId())) {
            throw new IllegalArgumentException("snapshot belongs to " + snapshot.workflowId());
        }
        committed.set(snapshot);
    }

    /// Asks the executor to suspend at the next step boundary.
    ///
    /// @param reason recorded as the checkpoint reason, may be null
    public void requestSuspend(String reason) {
        suspendRequest.set(reason != null ? reason : "suspend-requested");
    }

    /// Returns the pending suspend reason without clearing it.
    ///
    /// @return the reason, or null if no suspend is pending
    public String peekSuspendReason() {
        return suspendRequest.get();
    }

    public boolean isSuspendRequested() {
        return suspendRequest.get() != null;
    }

    /// Clears the pending suspend request.
    ///
    /// @return the reason that was pending, or null if none
    public String takeSuspendRequest() {
        return suspendRequest.getAndSet(null);
    }
}

package io.agency.core.state;

import io.agency.core.workflow.WorkflowSnapshot;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/// Durable, append-only store of versioned workflow snapshots.
///
/// The only durable resource shared across workflows. Each write is keyed by
/// `(workflowId, version)` and lower versions are never overwritten.
///
/// ### Contracts
/// - **Atomicity**: a reader never observes a partially written snapshot
/// - **Versioning**: {@link #put} accepts version 1 for an unknown workflow and
///   otherwise only `last + 1`; anything else raises
///   {@link io.agency.core.exception.SnapshotVersionConflictException}
/// - **Failure**: I/O failures surface as {@link io.agency.core.exception.StorageException}
///
/// @implNote Implementations must be thread-safe. Different workflows write
/// concurrently; the per-key version check is the only cross-workflow
/// synchronization the engine relies on.
///
/// @see InMemorySnapshotStore
public interface SnapshotStore {

    /// Persists a snapshot atomically.
    ///
    /// @param snapshot the snapshot to append, not null
    /// @throws io.agency.core.exception.SnapshotVersionConflictException if the version
    ///     is not exactly one above the last persisted version
    /// @throws io.agency.core.exception.StorageException if the write fails
    void put(WorkflowSnapshot snapshot);

    /// Returns the highest persisted version of a workflow.
    ///
    /// @param workflowId workflow identifier, not null
    /// @return the latest snapshot, or empty if the workflow is unknown
    Optional<WorkflowSnapshot> getLatest(String workflowId);

    /// Returns one specific version.
    ///
    /// @param workflowId workflow identifier, not null
    /// @param version snapshot version
    /// @return the snapshot, or empty if absent
    Optional<WorkflowSnapshot> get(String workflowId, long version);

    /// Lists every persisted version, ordered by workflow id then version.
    ///
    /// @return summaries, never null
    List<SnapshotSummary> list();

    /// Returns the latest snapshot of every known workflow.
    ///
    /// @return latest snapshots ordered by workflow id, never null
    List<WorkflowSnapshot> listLatest();

    /// Removes every version of a workflow.
    ///
    /// @param workflowId workflow identifier, not null
    /// @return number of versions removed
    int delete(String workflowId);

    /// Removes workflows whose latest snapshot is terminal and older than the cutoff.
    ///
    /// @param cutoff workflows last updated before this instant are removed, not null
    /// @return number of workflows removed
    int deleteTerminalOlderThan(Instant cutoff);
}

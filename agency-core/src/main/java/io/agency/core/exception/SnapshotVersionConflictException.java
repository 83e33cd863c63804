package io.agency.core.exception;

import java.io.Serial;

/// Rejected snapshot write whose version is not exactly one above the last
/// persisted version of the same workflow.
public class SnapshotVersionConflictException extends StorageException {

    @Serial private static final long serialVersionUID = 7720465195203318349L;

    private final String workflowId;
    private final long expectedVersion;
    private final long actualVersion;

    public SnapshotVersionConflictException(
            String workflowId, long expectedVersion, long actualVersion) {
        super(
                "Snapshot version conflict for workflow '"
                        + workflowId
                        + "': expected version "
                        + expectedVersion
                        + " but got "
                        + actualVersion);
        this.workflowId = workflowId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}

package io.agency.core.state;

import io.agency.core.workflow.WorkflowStatus;
import java.time.Instant;
import java.util.Objects;

/// One row of the snapshot listing.
///
/// @param workflowId workflow identifier, not null
/// @param version snapshot version
/// @param status workflow status at that version, not null
/// @param timestamp when the version was written, not null
public record SnapshotSummary(
        String workflowId, long version, WorkflowStatus status, Instant timestamp) {

    public SnapshotSummary {
        Objects.requireNonNull(workflowId, "workflowId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }
}

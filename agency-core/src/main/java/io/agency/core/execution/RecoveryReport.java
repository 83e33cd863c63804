package io.agency.core.execution;

import java.util.List;

/// Workflows found unfinished in the snapshot store at startup.
///
/// @param suspended ids left suspended, awaiting an explicit resume
/// @param resumed interrupted ids resubmitted for execution
/// @param abandoned interrupted ids left as they are because suspend/resume is disabled
///     or startup resumption is off
public record RecoveryReport(List<String> suspended, List<String> resumed, List<String> abandoned) {

    public RecoveryReport {
        suspended = List.copyOf(suspended);
        resumed = List.copyOf(resumed);
        abandoned = List.copyOf(abandoned);
    }

    public int total() {
        return suspended.size() + resumed.size() + abandoned.size();
    }
}

package io.agency.core.execution;

import io.agency.core.exception.WorkflowBusyException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/// Per-workflow claim set that keeps a workflow to a single executor.
///
/// A claim is taken before any thread advances a workflow and released when
/// the run stops. A second claim for the same id is rejected instead of queued.
final class ExecutionGuard {

    private final Set<String> owners = ConcurrentHashMap.newKeySet();

    /// @throws WorkflowBusyException if another executor holds the workflow
    void claim(String workflowId) {
        if (!tryClaim(workflowId)) {
            throw new WorkflowBusyException(workflowId);
        }
    }

    boolean tryClaim(String workflowId) {
        return owners.add(workflowId);
    }

    void release(String workflowId) {
        owners.remove(workflowId);
    }

    boolean isClaimed(String workflowId) {
        return owners.contains(workflowId);
    }

    Set<String> claimed() {
        return Set.copyOf(owners);
    }
}

package io.agency.core.exception;

import java.io.Serial;

/// Another executor already owns the workflow.
public class WorkflowBusyException extends WorkflowConflictException {

    @Serial private static final long serialVersionUID = 1875036142290183557L;

    public WorkflowBusyException(String workflowId) {
        super("Workflow is already being executed: " + workflowId);
    }
}

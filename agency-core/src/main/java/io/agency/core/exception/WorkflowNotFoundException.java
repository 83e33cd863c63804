package io.agency.core.exception;

import java.io.Serial;

public class WorkflowNotFoundException extends AgencyException {

    @Serial private static final long serialVersionUID = 2209364816275401846L;

    public WorkflowNotFoundException(String workflowId) {
        super("Workflow not found: " + workflowId);
    }
}

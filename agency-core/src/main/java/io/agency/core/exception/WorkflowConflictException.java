package io.agency.core.exception;

import java.io.Serial;

/// The requested operation is not valid for the workflow's current status.
public class WorkflowConflictException extends AgencyException {

    @Serial private static final long serialVersionUID = -6632148057291934410L;

    public WorkflowConflictException(String message) {
        super(message);
    }
}

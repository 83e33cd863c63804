package io.agency.core.exception;

import java.io.Serial;

/// Permanent failure of a model or tool call.
///
/// Also produced when a transient failure exhausts its retry budget. Fails the
/// current step and starts compensation.
public class UnrecoverableException extends AgencyException {

    @Serial private static final long serialVersionUID = 3189654020173346115L;

    public UnrecoverableException(String message) {
        super(message);
    }

    public UnrecoverableException(String message, Throwable cause) {
        super(message, cause);
    }
}

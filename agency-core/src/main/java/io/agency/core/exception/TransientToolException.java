package io.agency.core.exception;

import java.io.Serial;

/// Retryable failure reported by a tool handler.
public class TransientToolException extends TransientException {

    @Serial private static final long serialVersionUID = -8450124937601128842L;

    public TransientToolException(String message) {
        super(message);
    }

    public TransientToolException(String message, Throwable cause) {
        super(message, cause);
    }
}

package io.agency.core.exception;

import java.io.Serial;

/// Retryable failure reported by a model provider.
public class TransientProviderException extends TransientException {

    @Serial private static final long serialVersionUID = 6021839475512309871L;

    public TransientProviderException(String message) {
        super(message);
    }

    public TransientProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}

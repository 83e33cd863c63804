package io.agency.core.exception;

import java.io.Serial;

/// A collaborator failure that may succeed if the same call is repeated.
///
/// Raised by model providers and tools for timeouts, rate limits and brief
/// outages. The reasoning loop retries these against its retry budget and never
/// lets them escape to the saga executor.
///
/// @see io.agency.core.reasoning.RetryPolicy
public abstract class TransientException extends AgencyException {

    @Serial private static final long serialVersionUID = -2739462508125480714L;

    protected TransientException(String message) {
        super(message);
    }

    protected TransientException(String message, Throwable cause) {
        super(message, cause);
    }
}

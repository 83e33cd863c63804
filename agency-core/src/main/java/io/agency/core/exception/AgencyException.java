package io.agency.core.exception;

import java.io.Serial;

/// Root of the engine's unchecked error taxonomy.
///
/// Every failure the engine reports to a caller is a subclass, which lets the
/// server map the whole hierarchy to HTTP responses in one place.
///
/// @see TransientException
/// @see UnrecoverableException
/// @see StorageException
/// @see ConfigurationException
/// @see CompensationFailedException
public class AgencyException extends RuntimeException {

    @Serial private static final long serialVersionUID = 4410250967130155032L;

    public AgencyException(String message) {
        super(message);
    }

    public AgencyException(String message, Throwable cause) {
        super(message, cause);
    }
}

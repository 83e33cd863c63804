package io.agency.server.persistence;

import io.agency.core.exception.StorageException;
import java.io.Serial;

/// Unchecked wrapper for JDBC failures in the snapshot store.
///
/// Extends {@link StorageException} so callers see the same failure type
/// regardless of the configured backend.
public class PersistenceException extends StorageException {

    @Serial private static final long serialVersionUID = 3158820417761552903L;

    public PersistenceException(String message, Throwable cause) {
        super(message + ": " + cause.getMessage(), cause);
    }
}

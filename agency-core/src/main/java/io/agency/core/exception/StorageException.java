package io.agency.core.exception;

import java.io.Serial;

/// A snapshot could not be written or read.
///
/// Surfaced to callers verbatim. When raised on a commit, the executor keeps
/// the workflow at its previous committed state and does not advance.
///
/// @see io.agency.core.state.SnapshotStore
public class StorageException extends AgencyException {

    @Serial private static final long serialVersionUID = -1167203954437190522L;

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}

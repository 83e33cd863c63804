package io.agency.core.reasoning;

/// Why a reasoning loop stopped.
public enum TerminationReason {
    /// The model produced an answer.
    FINAL_ANSWER,
    /// The iteration bound was reached; the output is a partial answer.
    STEP_LIMIT_REACHED,
    /// A permanent or retry-exhausted failure ended the loop.
    UNRECOVERABLE_ERROR
}

package io.agency.core.execution;

/// Result of a suspend call.
public enum SuspendOutcome {
    /// The workflow was idle and has been suspended immediately.
    SUSPENDED,
    /// An executor is running the workflow; it will suspend at the next step boundary.
    SUSPEND_REQUESTED,
    /// The workflow was already suspended.
    ALREADY_SUSPENDED
}

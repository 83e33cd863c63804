package io.agency.core.reasoning;

/// Counts retries consumed while running one action.
///
/// @implNote **Not thread-safe**. Owned by the thread running the action.
public final class RetryTracker {

    private int retries;

    public void recordRetry() {
        retries++;
    }

    public int retries() {
        return retries;
    }
}

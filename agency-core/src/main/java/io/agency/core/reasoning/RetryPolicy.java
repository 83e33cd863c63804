package io.agency.core.reasoning;

import io.agency.core.AgencyConfig;
import io.agency.core.exception.TransientException;
import io.agency.core.exception.UnrecoverableException;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Logger;

/// Bounded retry with exponential backoff for transient collaborator failures.
///
/// Attempt `n` that fails transiently is followed by a pause of
/// `baseDelay × 2^(n-1)` before attempt `n + 1`. When the last attempt fails the
/// transient error becomes an {@link UnrecoverableException}. Non-transient
/// exceptions are never retried.
///
/// @implNote Thread-safe. Holds no per-call state; retry counts are reported
/// through a caller-owned {@link RetryTracker}.
public final class RetryPolicy {

    private static final Logger logger = Logger.getLogger(RetryPolicy.class.getName());

    /// Pause between attempts. Replaced in tests to avoid real sleeps.
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Sleeper sleeper;

    /// Creates a policy.
    ///
    /// @param maxAttempts attempts per call including the first, at least 1
    /// @param baseDelay pause after the first failed attempt, not null
    /// @param sleeper pause implementation, not null
    public RetryPolicy(int maxAttempts, Duration baseDelay, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = Objects.requireNonNull(baseDelay, "baseDelay must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    public static RetryPolicy from(AgencyConfig config) {
        return new RetryPolicy(
                config.getRetryBudget(),
                config.getRetryBaseDelay(),
                duration -> Thread.sleep(duration.toMillis()));
    }

    /// Policy that retries without pausing.
    ///
    /// @param maxAttempts attempts per call including the first
    /// @return a policy whose sleeper returns immediately, never null
    public static RetryPolicy noDelay(int maxAttempts) {
        return new RetryPolicy(maxAttempts, Duration.ZERO, duration -> {});
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /// Returns the pause that follows failed attempt `attempt`.
    ///
    /// @param attempt 1-based attempt number
    /// @return `baseDelay × 2^(attempt-1)`, never null
    public Duration delayAfter(int attempt) {
        return baseDelay.multipliedBy(1L << Math.min(attempt - 1, 20));
    }

    /// Runs a call, retrying transient failures.
    ///
    /// @param operation label used in logs and error messages, not null
    /// @param call the call to run, not null
    /// @param tracker receives one notification per retry, not null
    /// @param <T> result type
    /// @return the call's result
    /// @throws UnrecoverableException if the budget is exhausted or the thread is interrupted
    public <T> T execute(String operation, Supplier<T> call, RetryTracker tracker) {
        for (int attempt = 1; ; attempt++) {
            try {
                return call.get();
            } catch (TransientException e) {
                if (attempt >= maxAttempts) {
                    throw new UnrecoverableException(
                            operation
                                    + " failed after "
                                    + attempt
                                    + " attempts: "
                                    + e.getMessage(),
                            e);
                }
                Duration delay = delayAfter(attempt);
                logger.warning(
                        operation
                                + " failed transiently (attempt "
                                + attempt
                                + "/"
                                + maxAttempts
                                + "), retrying in "
                                + delay.toMillis()
                                + "ms: "
                                + e.getMessage());
                tracker.recordRetry();
                pause(operation, delay);
            }
        }
    }

    private void pause(String operation, Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UnrecoverableException(operation + " interrupted during retry backoff", e);
        }
    }
}

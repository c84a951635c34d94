package io.tick4j.resilience;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry policy of a single {@link ResilientCall#execute} invocation.
 *
 * <p>Keep {@code maxRetries * maxDelay} well below the platform's maximum invocation time:
 * retries block the tick that issued the call.
 *
 * @param maxRetries        retries after the first attempt
 * @param initialDelay      delay before the first retry
 * @param maxDelay          cap of the exponential schedule
 * @param backoffMultiplier growth factor per attempt
 */
public record RetryOptions(int maxRetries, Duration initialDelay, Duration maxDelay, double backoffMultiplier) {

    public RetryOptions {
        Objects.requireNonNull(initialDelay, "initialDelay must not be null");
        Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        if (initialDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("delays must not be negative");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
        }
    }

    public static RetryOptions defaults() {
        return new RetryOptions(3, Duration.ofSeconds(1), Duration.ofSeconds(10), 2.0);
    }

    public static RetryOptions noRetry() {
        return new RetryOptions(0, Duration.ZERO, Duration.ZERO, 1.0);
    }

    public RetryOptions withMaxRetries(int maxRetries) {
        return new RetryOptions(maxRetries, initialDelay, maxDelay, backoffMultiplier);
    }

    /**
     * Exponential delay for a zero-based retry attempt: {@code min(initial * multiplier^attempt, max)}.
     */
    public Duration backoff(int attempt) {
        int exp = Math.max(0, Math.min(attempt, 30)); // avoid overflow
        double ms = initialDelay.toMillis() * Math.pow(backoffMultiplier, exp);
        long capped = (long) Math.min(ms, (double) maxDelay.toMillis());
        return Duration.ofMillis(capped);
    }
}

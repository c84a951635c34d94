package io.tick4j.breaker;

import io.tick4j.spi.StateSection;

import java.time.Instant;

/**
 * Persisted breaker state of one tenant. {@code open} implies {@code failureCount >= threshold}.
 *
 * @param lastFailureAt null until the first failure
 */
public record CircuitBreakerState(int failureCount, Instant lastFailureAt, boolean open) {

    public static final StateSection<CircuitBreakerState> SECTION =
            StateSection.of("breaker", CircuitBreakerState.class, CircuitBreakerState::closed);

    public static CircuitBreakerState closed() {
        return new CircuitBreakerState(0, null, false);
    }

    CircuitBreakerState failedAt(Instant at, int threshold) {
        int count = failureCount + 1;
        return new CircuitBreakerState(count, at, count >= threshold);
    }
}

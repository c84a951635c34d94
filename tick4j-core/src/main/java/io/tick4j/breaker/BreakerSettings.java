package io.tick4j.breaker;

import java.time.Duration;
import java.util.Objects;

/**
 * @param failureThreshold consecutive failures that open the breaker
 * @param cooldown         time after the last failure before a trial call is let through
 */
public record BreakerSettings(int failureThreshold, Duration cooldown) {

    public BreakerSettings {
        Objects.requireNonNull(cooldown, "cooldown must not be null");
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be a positive number");
        }
        if (cooldown.isNegative()) {
            throw new IllegalArgumentException("cooldown must not be negative");
        }
    }

    public static BreakerSettings defaults() {
        return new BreakerSettings(5, Duration.ofMinutes(5));
    }
}

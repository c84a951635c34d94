package io.tick4j.breaker;

public enum BreakerStatus {
    CLOSED,
    OPEN,
    HALF_OPEN
}

package io.tick4j.resilience;

import java.time.Duration;

/**
 * Failure taxonomy for upstream calls, in classification order.
 */
public enum ErrorKind {

    RATE_LIMITED(true, Duration.ofSeconds(30), MessageCategory.TRY_AGAIN_LATER),
    UNAUTHORIZED(false, Duration.ZERO, MessageCategory.REAUTHORIZE),
    NETWORK_UNAVAILABLE(true, Duration.ZERO, MessageCategory.CHECK_CONNECTION),
    DOMAIN_BOUNDARY_GONE(false, Duration.ZERO, MessageCategory.ITEM_GONE),
    GENERIC_UPSTREAM(true, Duration.ZERO, MessageCategory.SERVICE_ERROR),
    UNKNOWN(true, Duration.ZERO, MessageCategory.UNEXPECTED);

    private final boolean retryable;
    private final Duration delayFloor;
    private final MessageCategory messageCategory;

    ErrorKind(boolean retryable, Duration delayFloor, MessageCategory messageCategory) {
        this.retryable = retryable;
        this.delayFloor = delayFloor;
        this.messageCategory = messageCategory;
    }

    public boolean retryable() {
        return retryable;
    }

    /**
     * Minimum wait before the next attempt; overrides a shorter backoff.
     */
    public Duration delayFloor() {
        return delayFloor;
    }

    public MessageCategory messageCategory() {
        return messageCategory;
    }
}

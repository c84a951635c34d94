package io.tick4j.resilience;

/**
 * Rejection issued while the tenant's circuit breaker is open. No upstream call was attempted.
 */
public class ServiceTemporarilyUnavailableException extends RuntimeException {

    public ServiceTemporarilyUnavailableException(String message) {
        super(message);
    }

    public MessageCategory getMessageCategory() {
        return MessageCategory.TRY_AGAIN_SHORTLY;
    }
}

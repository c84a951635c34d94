package io.tick4j.resilience;

/**
 * The mailbox, thread or message a call was made for no longer exists. Never retried.
 */
public class DomainBoundaryGoneException extends RuntimeException {

    public DomainBoundaryGoneException(String message) {
        super(message);
    }

    public DomainBoundaryGoneException(String message, Throwable cause) {
        super(message, cause);
    }
}

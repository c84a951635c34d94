package io.tick4j.resilience;

import java.util.Objects;

/**
 * Final failure of a {@link ResilientCall}. The cause is the error raised by the last attempt.
 */
public class ClassifiedCallException extends RuntimeException {

    private final ErrorKind kind;
    private final int attempts;

    public ClassifiedCallException(ErrorKind kind, int attempts, Throwable cause) {
        super("upstream call failed kind=" + kind + " attempts=" + attempts
                + (cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : ""), cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.attempts = attempts;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public int getAttempts() {
        return attempts;
    }

    public MessageCategory getMessageCategory() {
        return kind.messageCategory();
    }
}

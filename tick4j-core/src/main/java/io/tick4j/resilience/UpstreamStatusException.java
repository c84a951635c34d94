package io.tick4j.resilience;

/**
 * Raised by callers of a remote service to expose the HTTP-like status of a failed response.
 */
public class UpstreamStatusException extends RuntimeException {

    private final int status;

    public UpstreamStatusException(int status, String message) {
        super(message);
        this.status = status;
    }

    public UpstreamStatusException(int status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }
}

package io.tick4j.cache;

/**
 * A checked failure of a cache computation, raised when no stale value could be served instead.
 */
public class CacheComputeException extends RuntimeException {

    public CacheComputeException(String message, Throwable cause) {
        super(message, cause);
    }
}

package io.tick4j.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * Options of an ad-hoc {@link BoundedCache#getOrCompute(String, Class, java.util.concurrent.Callable, ComputeOptions)}.
 *
 * @param allowStale return an expired value instead of recomputing synchronously
 */
public record ComputeOptions(Duration ttl, String kind, boolean allowStale) {

    public ComputeOptions {
        Objects.requireNonNull(ttl, "ttl must not be null");
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be a positive duration");
        }
        kind = (kind == null || kind.isBlank()) ? CacheProducer.DEFAULT_KIND : kind;
    }

    public static ComputeOptions of(Duration ttl) {
        return new ComputeOptions(ttl, null, false);
    }

    public ComputeOptions kind(String kind) {
        return new ComputeOptions(ttl, kind, allowStale);
    }

    public ComputeOptions allowingStale() {
        return new ComputeOptions(ttl, kind, true);
    }
}

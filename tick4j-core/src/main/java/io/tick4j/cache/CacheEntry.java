package io.tick4j.cache;

import java.time.Instant;

/**
 * Stored form of a cached value.
 *
 * <p>An entry past {@code expiresAt} is stale: it is only handed out through the
 * stale-while-revalidate paths and never counts as a fresh hit.
 *
 * @param value     JSON payload of the cached value
 * @param sizeBytes UTF-8 size of {@code value}
 * @param kind      grouping tag used by stats
 */
public record CacheEntry(
        String key,
        String value,
        Instant cachedAt,
        Instant expiresAt,
        long sizeBytes,
        String kind
) {

    public boolean isExpiredAt(Instant now) {
        return now.isAfter(expiresAt);
    }
}

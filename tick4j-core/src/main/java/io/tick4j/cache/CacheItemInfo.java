package io.tick4j.cache;

import java.time.Instant;

public record CacheItemInfo(String key, long sizeBytes, Instant cachedAt, String kind) {
}

package io.tick4j.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * Limits and maintenance policy of a tenant cache.
 *
 * @param staleRetention        how long past its ttl an entry stays readable as stale
 * @param revalidationBatchSize queue items drained per maintenance run
 * @param utilizationThreshold  utilization above which a tick triggers maintenance
 * @param maintenanceCeiling    maximum time between two maintenance runs
 */
public record CacheSettings(
        int maxItems,
        long maxItemSize,
        long maxTotalSize,
        Duration staleRetention,
        int revalidationBatchSize,
        double utilizationThreshold,
        Duration maintenanceCeiling
) {

    public CacheSettings {
        Objects.requireNonNull(staleRetention, "staleRetention must not be null");
        Objects.requireNonNull(maintenanceCeiling, "maintenanceCeiling must not be null");
        if (maxItems <= 0) {
            throw new IllegalArgumentException("maxItems must be a positive number");
        }
        if (maxItemSize <= 0 || maxTotalSize < maxItemSize) {
            throw new IllegalArgumentException("maxItemSize must be positive and not above maxTotalSize");
        }
        if (staleRetention.isNegative()) {
            throw new IllegalArgumentException("staleRetention must not be negative");
        }
        if (revalidationBatchSize < 0) {
            throw new IllegalArgumentException("revalidationBatchSize must not be negative");
        }
        if (utilizationThreshold <= 0 || utilizationThreshold > 1) {
            throw new IllegalArgumentException("utilizationThreshold must be in (0, 1]");
        }
    }

    public static CacheSettings defaults() {
        return new CacheSettings(100, 100 * 1024, 1024 * 1024, Duration.ofHours(1), 3, 0.8, Duration.ofHours(6));
    }

    public CacheSettings withMaxItems(int maxItems) {
        return new CacheSettings(maxItems, maxItemSize, maxTotalSize, staleRetention,
                revalidationBatchSize, utilizationThreshold, maintenanceCeiling);
    }

    public CacheSettings withMaxItemSize(long maxItemSize) {
        return new CacheSettings(maxItems, maxItemSize, maxTotalSize, staleRetention,
                revalidationBatchSize, utilizationThreshold, maintenanceCeiling);
    }
}

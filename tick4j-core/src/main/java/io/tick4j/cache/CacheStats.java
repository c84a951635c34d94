package io.tick4j.cache;

import java.util.Map;

/**
 * @param utilization the larger of item-count and byte utilization, in [0, 1]
 */
public record CacheStats(
        int itemCount,
        long totalSize,
        Map<String, Integer> countByKind,
        Map<String, Long> sizeByKind,
        double utilization,
        int queuedRevalidations
) {
}

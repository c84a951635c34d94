package io.tick4j.cache;

/**
 * Outcome of one {@link BoundedCache#maintain} run.
 *
 * @param swept               metadata entries whose value the store no longer returned
 * @param evicted             entries evicted to get back under the limits
 * @param revalidated         queue items recomputed and stored
 * @param revalidationFailed  queue items whose producer failed; dropped
 * @param revalidationSkipped true when the breaker was open and the queue was left untouched
 */
public record MaintenanceReport(
        int swept,
        int evicted,
        int revalidated,
        int revalidationFailed,
        boolean revalidationSkipped,
        int itemCount,
        long totalSize
) {
}

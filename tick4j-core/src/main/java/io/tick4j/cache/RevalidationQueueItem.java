package io.tick4j.cache;

import java.time.Instant;

/**
 * @param producerRef name of the {@link CacheProducer} that recomputes the value
 */
public record RevalidationQueueItem(String key, String producerRef, Instant queuedAt) {
}

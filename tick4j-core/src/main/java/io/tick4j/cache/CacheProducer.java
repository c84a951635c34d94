package io.tick4j.cache;

import java.time.Duration;

/**
 * Recomputes the value of a cache key. Registered once by name in a {@link CacheProducerRegistry};
 * the name is what revalidation queue items refer to.
 *
 * <p>{@link #produce(String)} should call the upstream service directly: the cache already invokes
 * it through the tenant's {@link io.tick4j.resilience.ResilientCall}.
 */
public interface CacheProducer<T> {

    String DEFAULT_KIND = "default";

    String name();

    Class<T> type();

    Duration ttl();

    default String kind() {
        return DEFAULT_KIND;
    }

    T produce(String key) throws Exception;
}

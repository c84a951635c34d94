package io.tick4j.spi;

import java.time.Duration;
import java.util.Collection;
import java.util.Optional;

/**
 * Tenant-isolated key/value store with per-key expiry.
 *
 * <p>Once a key's ttl has elapsed the store may stop returning it at any time; callers must not
 * rely on values surviving past their ttl.
 */
public interface KeyValueStore {

    Optional<String> get(String tenantId, String key);

    void put(String tenantId, String key, String value, Duration ttl);

    void remove(String tenantId, String key);

    default void removeAll(String tenantId, Collection<String> keys) {
        for (String key : keys) {
            remove(tenantId, key);
        }
    }
}

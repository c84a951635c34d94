package io.tick4j.internal.memory;

import io.tick4j.spi.KeyValueStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link KeyValueStore}. Expired values are dropped lazily on read.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private record Stored(String value, Instant expireAt) {
    }

    private final Clock clock;
    private final Map<String, Map<String, Stored>> tenants = new ConcurrentHashMap<>();

    public InMemoryKeyValueStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public Optional<String> get(String tenantId, String key) {
        Map<String, Stored> entries = tenants.get(tenantId);
        if (entries == null) {
            return Optional.empty();
        }
        Stored stored = entries.get(key);
        if (stored == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(stored.expireAt())) {
            entries.remove(key, stored);
            return Optional.empty();
        }
        return Optional.of(stored.value());
    }

    @Override
    public void put(String tenantId, String key, String value, Duration ttl) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(ttl, "ttl must not be null");
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be a positive duration");
        }
        tenants.computeIfAbsent(tenantId, id -> new ConcurrentHashMap<>())
                .put(key, new Stored(value, clock.instant().plus(ttl)));
    }

    @Override
    public void remove(String tenantId, String key) {
        Map<String, Stored> entries = tenants.get(tenantId);
        if (entries != null) {
            entries.remove(key);
        }
    }
}

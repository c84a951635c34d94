package io.tick4j.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.tick4j.breaker.CircuitBreaker;
import io.tick4j.resilience.ResilientCall;
import io.tick4j.spi.KeyValueStore;
import io.tick4j.spi.TenantStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Bounded per-tenant cache of re-derivable artifacts with stale-while-revalidate reads.
 *
 * <p>Core capabilities:
 * <ul>
 *   <li>Item-count, item-size and total-size limits; the oldest entry by {@code cachedAt} is evicted first</li>
 *   <li>Expired entries stay readable as stale for {@link CacheSettings#staleRetention()}</li>
 *   <li>Stale reads with a registered producer queue a background revalidation, drained by {@link #maintain}</li>
 * </ul>
 *
 * <p>Values are stored as JSON in the {@link KeyValueStore}; accounting lives in the tenant's
 * {@link CacheMetadata} section and is only changed by set, remove, eviction and maintenance.
 */
public class BoundedCache {
    private static final Logger log = LoggerFactory.getLogger(BoundedCache.class);

    private final String tenantId;
    private final KeyValueStore store;
    private final TenantStateStore stateStore;
    private final CacheProducerRegistry producers;
    private final ResilientCall resilientCall;
    private final CircuitBreaker breaker;
    private final ObjectMapper objectMapper;
    private final CacheSettings settings;
    private final Clock clock;

    public BoundedCache(String tenantId,
                        KeyValueStore store,
                        TenantStateStore stateStore,
                        CacheProducerRegistry producers,
                        ResilientCall resilientCall,
                        CircuitBreaker breaker,
                        ObjectMapper objectMapper,
                        CacheSettings settings,
                        Clock clock) {
        this.tenantId = Objects.requireNonNull(tenantId, "tenantId must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.stateStore = Objects.requireNonNull(stateStore, "stateStore must not be null");
        this.producers = Objects.requireNonNull(producers, "producers must not be null");
        this.resilientCall = Objects.requireNonNull(resilientCall, "resilientCall must not be null");
        this.breaker = Objects.requireNonNull(breaker, "breaker must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null")
                .copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public <T> CacheLookup<T> get(String key, Class<T> type) {
        return get(key, type, null, false);
    }

    /**
     * Read a value. Expired entries come back with {@code stale=true}; when {@code allowStale} is set
     * and {@code producerRef} names a registered producer, a revalidation is queued for the key.
     */
    public <T> CacheLookup<T> get(String key, Class<T> type, String producerRef, boolean allowStale) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(type, "type must not be null");

        Optional<CacheEntry> found = readEntry(key);
        if (found.isEmpty()) {
            return CacheLookup.miss();
        }

        CacheEntry entry = found.get();
        T value;
        try {
            value = objectMapper.readValue(entry.value(), type);
        } catch (JsonProcessingException e) {
            log.warn("cache value undecodable, dropping tenant={} key={} type={} msg={}",
                    tenantId, key, type.getSimpleName(), e.getOriginalMessage());
            remove(key);
            return CacheLookup.miss();
        }

        if (!entry.isExpiredAt(clock.instant())) {
            return CacheLookup.fresh(value);
        }
        if (allowStale && producerRef != null) {
            enqueueRevalidation(key, producerRef);
        }
        return CacheLookup.stale(value);
    }

    /**
     * Store a value.
     *
     * @return false when the value is not cached (too large or not serializable); callers proceed uncached
     */
    public boolean set(String key, Object value, Duration ttl, String kind) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(ttl, "ttl must not be null");
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be a positive duration");
        }
        String entryKind = (kind == null || kind.isBlank()) ? CacheProducer.DEFAULT_KIND : kind;

        String payload;
        String raw;
        Instant now = clock.instant();
        long size;
        try {
            payload = objectMapper.writeValueAsString(value);
            size = payload.getBytes(StandardCharsets.UTF_8).length;
            if (size > settings.maxItemSize()) {
                log.debug("cache value too large, not cached tenant={} key={} size={} max={}",
                        tenantId, key, size, settings.maxItemSize());
                return false;
            }
            raw = objectMapper.writeValueAsString(new CacheEntry(key, payload, now, now.plus(ttl), size, entryKind));
        } catch (JsonProcessingException e) {
            log.warn("cache value not serializable, not cached tenant={} key={} msg={}",
                    tenantId, key, e.getOriginalMessage());
            return false;
        }

        store.put(tenantId, key, raw, ttl.plus(settings.staleRetention()));

        List<String> evicted = new ArrayList<>();
        CacheItemInfo item = new CacheItemInfo(key, size, now, entryKind);
        stateStore.update(tenantId, CacheMetadata.SECTION, meta -> {
            evicted.clear();
            CacheMetadata next = meta.without(key);
            while (next.count() > 0
                    && (next.count() >= settings.maxItems()
                    || next.totalSize() + item.sizeBytes() > settings.maxTotalSize())) {
                CacheItemInfo oldest = next.oldest().orElseThrow();
                evicted.add(oldest.key());
                next = next.without(oldest.key());
            }
            return next.with(item);
        });

        if (!evicted.isEmpty()) {
            store.removeAll(tenantId, evicted);
            log.debug("cache evicted oldest entries tenant={} keys={}", tenantId, evicted);
        }
        return true;
    }

    public void remove(String key) {
        Objects.requireNonNull(key, "key must not be null");
        store.remove(tenantId, key);
        stateStore.update(tenantId, CacheMetadata.SECTION, meta -> meta.without(key));
        if (stateStore.read(tenantId, RevalidationQueue.SECTION).contains(key)) {
            stateStore.update(tenantId, RevalidationQueue.SECTION, q -> q.withoutKeys(List.of(key)));
        }
    }

    /**
     * Remove every entry of the tenant and drop pending revalidations.
     */
    public void clear() {
        CacheMetadata meta = stateStore.read(tenantId, CacheMetadata.SECTION);
        List<String> keys = meta.items().stream().map(CacheItemInfo::key).toList();
        store.removeAll(tenantId, keys);
        stateStore.update(tenantId, CacheMetadata.SECTION, m -> m.withoutAll(keys));
        stateStore.update(tenantId, RevalidationQueue.SECTION, q -> RevalidationQueue.empty());
        log.info("cache cleared tenant={} items={}", tenantId, keys.size());
    }

    /**
     * Read through a registered producer, which is invoked via the tenant's {@link ResilientCall}
     * and supplies ttl and kind. While the breaker is open the producer is not called: a cached
     * value is served stale, otherwise the rejection is raised.
     *
     * @throws io.tick4j.resilience.ServiceTemporarilyUnavailableException when the breaker is open and nothing is cached
     */
    public <T> T getOrCompute(String key, String producerRef, Class<T> type, boolean allowStale) {
        CacheProducer<T> producer = producers.getRequired(producerRef, type);
        return getOrCompute(key, type,
                () -> resilientCall.guarded(() -> producer.produce(key)),
                new ComputeOptions(producer.ttl(), producer.kind(), allowStale),
                producerRef);
    }

    /**
     * Read through an ad-hoc computation. Stale values can be served but never revalidated in the
     * background, since there is no producer to queue.
     */
    public <T> T getOrCompute(String key, Class<T> type, Callable<T> compute, ComputeOptions options) {
        return getOrCompute(key, type, compute, options, null);
    }

    private <T> T getOrCompute(String key, Class<T> type, Callable<T> compute, ComputeOptions options, String producerRef) {
        Objects.requireNonNull(compute, "compute must not be null");
        Objects.requireNonNull(options, "options must not be null");

        CacheLookup<T> cached = get(key, type, producerRef, options.allowStale());
        if (cached.found() && !cached.stale()) {
            return cached.value();
        }
        if (cached.found() && options.allowStale()) {
            log.debug("cache serving stale value tenant={} key={} revalidationQueued={}",
                    tenantId, key, producerRef != null);
            return cached.value();
        }

        T computed;
        try {
            computed = compute.call();
        } catch (Exception e) {
            if (cached.found()) {
                log.warn("cache compute failed, serving stale value tenant={} key={} msg={}",
                        tenantId, key, e.getMessage());
                return cached.value();
            }
            if (e instanceof RuntimeException re) {
                throw re;
            }
            throw new CacheComputeException("compute failed for key " + key, e);
        }

        set(key, computed, options.ttl(), options.kind());
        return computed;
    }

    /**
     * Queue a background recomputation of {@code key}; a key already queued is left as is.
     *
     * @return true when a new item was added
     */
    public boolean enqueueRevalidation(String key, String producerRef) {
        if (!producers.contains(producerRef)) {
            throw new IllegalArgumentException("No CacheProducer registered for name: " + producerRef);
        }
        if (stateStore.read(tenantId, RevalidationQueue.SECTION).contains(key)) {
            return false;
        }
        RevalidationQueueItem item = new RevalidationQueueItem(key, producerRef, clock.instant());
        stateStore.update(tenantId, RevalidationQueue.SECTION, q -> q.enqueue(item));
        log.debug("cache revalidation queued tenant={} key={} producer={}", tenantId, key, producerRef);
        return true;
    }

    /**
     * True when the revalidation queue is non-empty, utilization is above the threshold, or
     * maintenance has not run within {@link CacheSettings#maintenanceCeiling()}.
     */
    public boolean needsMaintenance(Instant now) {
        if (stateStore.read(tenantId, RevalidationQueue.SECTION).size() > 0) {
            return true;
        }
        if (utilization(stateStore.read(tenantId, CacheMetadata.SECTION)) > settings.utilizationThreshold()) {
            return true;
        }
        Instant last = stateStore.read(tenantId, MaintenanceState.SECTION).lastMaintenanceAt();
        return last == null || Duration.between(last, now).compareTo(settings.maintenanceCeiling()) >= 0;
    }

    /**
     * Sweep accounting for values the store no longer returns, evict down to the limits, then drain up
     * to {@link CacheSettings#revalidationBatchSize()} queued revalidations. An item leaves the queue
     * right before its attempt, whatever the outcome; items not yet attempted when the breaker opens
     * stay queued.
     */
    public MaintenanceReport maintain(Instant now) {
        int swept = sweep();
        int evicted = enforceLimits();

        int revalidated = 0;
        int failed = 0;
        boolean skipped = false;

        RevalidationQueue queue = stateStore.read(tenantId, RevalidationQueue.SECTION);
        if (queue.size() > 0) {
            if (breaker.isOpenNow()) {
                skipped = true;
                log.info("cache revalidation skipped, circuit breaker open tenant={} queued={}", tenantId, queue.size());
            } else {
                List<RevalidationQueueItem> batch = List.copyOf(queue.head(settings.revalidationBatchSize()));
                for (RevalidationQueueItem item : batch) {
                    if (breaker.isOpenNow()) {
                        log.info("cache revalidation stopped, circuit breaker opened tenant={} remaining={}",
                                tenantId, stateStore.read(tenantId, RevalidationQueue.SECTION).size());
                        break;
                    }
                    stateStore.update(tenantId, RevalidationQueue.SECTION, q -> q.withoutKeys(List.of(item.key())));
                    if (revalidate(item)) {
                        revalidated++;
                    } else {
                        failed++;
                    }
                }
            }
        }

        stateStore.update(tenantId, MaintenanceState.SECTION, s -> new MaintenanceState(now));
        CacheMetadata meta = stateStore.read(tenantId, CacheMetadata.SECTION);

        MaintenanceReport report = new MaintenanceReport(swept, evicted, revalidated, failed, skipped,
                meta.count(), meta.totalSize());
        log.info("cache maintenance done tenant={} swept={} evicted={} revalidated={} failed={} skipped={} items={} size={}",
                tenantId, swept, evicted, revalidated, failed, skipped, meta.count(), meta.totalSize());
        return report;
    }

    public CacheStats stats() {
        CacheMetadata meta = stateStore.read(tenantId, CacheMetadata.SECTION);
        Map<String, Integer> countByKind = new LinkedHashMap<>();
        Map<String, Long> sizeByKind = new LinkedHashMap<>();
        for (CacheItemInfo item : meta.items()) {
            countByKind.merge(item.kind(), 1, Integer::sum);
            sizeByKind.merge(item.kind(), item.sizeBytes(), Long::sum);
        }
        int queued = stateStore.read(tenantId, RevalidationQueue.SECTION).size();
        return new CacheStats(meta.count(), meta.totalSize(), Map.copyOf(countByKind), Map.copyOf(sizeByKind),
                utilization(meta), queued);
    }

    public CacheSettings settings() {
        return settings;
    }

    private boolean revalidate(RevalidationQueueItem item) {
        Optional<CacheProducer<?>> producer = producers.find(item.producerRef());
        if (producer.isEmpty()) {
            log.warn("cache revalidation dropped, unknown producer tenant={} key={} producer={}",
                    tenantId, item.key(), item.producerRef());
            return false;
        }
        CacheProducer<?> p = producer.get();
        try {
            Object value = resilientCall.execute(() -> p.produce(item.key()));
            set(item.key(), value, p.ttl(), p.kind());
            log.debug("cache revalidated tenant={} key={} producer={}", tenantId, item.key(), p.name());
            return true;
        } catch (RuntimeException e) {
            log.warn("cache revalidation failed, dropped tenant={} key={} producer={} msg={}",
                    tenantId, item.key(), p.name(), e.getMessage());
            return false;
        }
    }

    private int sweep() {
        CacheMetadata meta = stateStore.read(tenantId, CacheMetadata.SECTION);
        List<String> gone = new ArrayList<>();
        for (CacheItemInfo item : meta.items()) {
            if (store.get(tenantId, item.key()).isEmpty()) {
                gone.add(item.key());
            }
        }
        stateStore.update(tenantId, CacheMetadata.SECTION, m -> m.withoutAll(gone).reconciled());
        return gone.size();
    }

    private int enforceLimits() {
        List<String> evicted = new ArrayList<>();
        stateStore.update(tenantId, CacheMetadata.SECTION, meta -> {
            evicted.clear();
            CacheMetadata next = meta;
            while (next.count() > 0
                    && (next.count() > settings.maxItems() || next.totalSize() > settings.maxTotalSize())) {
                CacheItemInfo oldest = next.oldest().orElseThrow();
                evicted.add(oldest.key());
                next = next.without(oldest.key());
            }
            return next;
        });
        store.removeAll(tenantId, evicted);
        return evicted.size();
    }

    private Optional<CacheEntry> readEntry(String key) {
        Optional<String> raw = store.get(tenantId, key);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(raw.get(), CacheEntry.class));
        } catch (JsonProcessingException e) {
            log.warn("cache entry corrupt, dropping tenant={} key={} msg={}", tenantId, key, e.getOriginalMessage());
            remove(key);
            return Optional.empty();
        }
    }

    private double utilization(CacheMetadata meta) {
        double byCount = (double) meta.count() / settings.maxItems();
        double byBytes = (double) meta.totalSize() / settings.maxTotalSize();
        return Math.min(1.0, Math.max(byCount, byBytes));
    }
}

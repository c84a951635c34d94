package io.tick4j.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.tick4j.JobHandler;
import io.tick4j.breaker.CircuitBreaker;
import io.tick4j.cache.BoundedCache;
import io.tick4j.cache.CacheProducerRegistry;
import io.tick4j.core.JobHandlerRegistry;
import io.tick4j.resilience.ErrorClassifier;
import io.tick4j.resilience.ResilientCall;
import io.tick4j.resilience.Sleeper;
import io.tick4j.scheduler.DefaultTickScheduler;
import io.tick4j.scheduler.FeatureToggles;
import io.tick4j.spi.KeyValueStore;
import io.tick4j.spi.TenantStateStore;
import io.tick4j.spi.TriggerManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Creates and holds one {@link TenantRuntime} per tenant, wiring every registered
 * {@link JobHandler} into the tenant's scheduler.
 */
public class TenantRuntimes {
    private static final Logger log = LoggerFactory.getLogger(TenantRuntimes.class);

    private final KeyValueStore keyValueStore;
    private final TenantStateStore stateStore;
    private final TriggerManager triggerManager;
    private final JobHandlerRegistry handlers;
    private final CacheProducerRegistry producers;
    private final ObjectMapper objectMapper;
    private final RuntimeSettings settings;
    private final Clock clock;
    private final Sleeper sleeper;
    private final ErrorClassifier classifier = new ErrorClassifier();

    private final Map<String, TenantRuntime> runtimes = new ConcurrentHashMap<>();

    public TenantRuntimes(KeyValueStore keyValueStore,
                          TenantStateStore stateStore,
                          TriggerManager triggerManager,
                          JobHandlerRegistry handlers,
                          CacheProducerRegistry producers,
                          ObjectMapper objectMapper,
                          RuntimeSettings settings,
                          Clock clock,
                          Sleeper sleeper) {
        this.keyValueStore = Objects.requireNonNull(keyValueStore, "keyValueStore must not be null");
        this.stateStore = Objects.requireNonNull(stateStore, "stateStore must not be null");
        this.triggerManager = Objects.requireNonNull(triggerManager, "triggerManager must not be null");
        this.handlers = Objects.requireNonNull(handlers, "handlers must not be null");
        this.producers = Objects.requireNonNull(producers, "producers must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    public TenantRuntime forTenant(String tenantId) {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        if (tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be blank");
        }
        return runtimes.computeIfAbsent(tenantId, this::create);
    }

    public Collection<TenantRuntime> active() {
        return List.copyOf(runtimes.values());
    }

    /**
     * Ensure a trigger for every stored tenant with an enabled feature.
     *
     * @return number of tenants whose trigger was ensured
     */
    public int restoreTriggers() {
        int restored = 0;
        for (String tenantId : stateStore.tenantIds()) {
            if (stateStore.read(tenantId, FeatureToggles.SECTION).anyEnabled()) {
                forTenant(tenantId).scheduler().syncTrigger();
                restored++;
            }
        }
        log.info("tenant triggers restored count={}", restored);
        return restored;
    }

    /**
     * Retire the triggers of all live runtimes. Stored toggles are kept, so
     * {@link #restoreTriggers()} brings them back.
     */
    public void shutdown() {
        for (String tenantId : runtimes.keySet()) {
            triggerManager.retireTrigger(tenantId);
        }
        log.info("tenant triggers retired count={}", runtimes.size());
    }

    private TenantRuntime create(String tenantId) {
        CircuitBreaker breaker = new CircuitBreaker(tenantId, stateStore, settings.breaker(), clock);
        ResilientCall resilientCall = new ResilientCall(breaker, classifier, sleeper, settings.retry());
        BoundedCache cache = new BoundedCache(tenantId, keyValueStore, stateStore, producers,
                resilientCall, breaker, objectMapper, settings.cache(), clock);
        DefaultTickScheduler scheduler = new DefaultTickScheduler(tenantId, stateStore, triggerManager, cache, clock);

        TenantRuntime runtime = new TenantRuntime(tenantId, scheduler, resilientCall, breaker, cache);
        for (JobHandler handler : handlers.handlers()) {
            scheduler.registerJob(handler.name(), handler.cadence(), () -> handler.execute(runtime));
        }
        log.debug("tenant runtime created tenant={} jobs={}", tenantId, scheduler.jobNames());
        return runtime;
    }
}

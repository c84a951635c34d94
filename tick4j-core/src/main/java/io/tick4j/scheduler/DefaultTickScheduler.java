package io.tick4j.scheduler;

import io.tick4j.Cadence;
import io.tick4j.Job;
import io.tick4j.JobAction;
import io.tick4j.TickScheduler;
import io.tick4j.cache.BoundedCache;
import io.tick4j.cache.MaintenanceReport;
import io.tick4j.core.JobOutcome;
import io.tick4j.core.TickResult;
import io.tick4j.spi.TenantStateStore;
import io.tick4j.spi.TriggerManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiPredicate;
import java.util.function.BooleanSupplier;

/**
 * Tick scheduler of one tenant.
 *
 * <p>Core capabilities:
 * <ul>
 *   <li>Jobs evaluated sequentially in registration order on every tick</li>
 *   <li>Per-job idempotency markers, written only after a successful run</li>
 *   <li>Failure isolation: one job's exception never stops the rest of the tick</li>
 *   <li>One trigger per tenant, present exactly while some feature is enabled</li>
 * </ul>
 *
 * <p>Typical usage:
 * <pre>{@code
 * scheduler.registerJob("digest", Cadences.dailyAt(8, zone), digest::send);
 * scheduler.enableFeature("digest");   // ensures the tenant trigger
 * scheduler.tick(clock.instant());     // called by the trigger
 * }</pre>
 */
public class DefaultTickScheduler implements TickScheduler {
    private static final Logger log = LoggerFactory.getLogger(DefaultTickScheduler.class);

    private final String tenantId;
    private final TenantStateStore stateStore;
    private final TriggerManager triggerManager;
    private final BoundedCache cache;
    private final Clock clock;

    private final Map<String, Job> jobs = new LinkedHashMap<>();

    public DefaultTickScheduler(String tenantId,
                                TenantStateStore stateStore,
                                TriggerManager triggerManager,
                                BoundedCache cache,
                                Clock clock) {
        this.tenantId = Objects.requireNonNull(tenantId, "tenantId must not be null");
        this.stateStore = Objects.requireNonNull(stateStore, "stateStore must not be null");
        this.triggerManager = Objects.requireNonNull(triggerManager, "triggerManager must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public String tenantId() {
        return tenantId;
    }

    @Override
    public synchronized void registerJob(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        String name = Objects.requireNonNull(job.name(), "job name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("job name must not be blank");
        }
        if (jobs.putIfAbsent(name, job) != null) {
            throw new IllegalStateException("Duplicate job name: " + name);
        }
        log.debug("job registered tenant={} name={}", tenantId, name);
    }

    /**
     * The marker written after each successful run is the tick instant, so {@code shouldRunNow}
     * receives the last successful run time.
     */
    @Override
    public void registerJob(String name, BooleanSupplier isEnabled, BiPredicate<Instant, String> shouldRunNow, JobAction run) {
        registerJob(new FunctionalJob(name, isEnabled, shouldRunNow, Instant::toString, run));
    }

    @Override
    public void registerJob(String name, Cadence cadence, JobAction run) {
        Objects.requireNonNull(cadence, "cadence must not be null");
        registerJob(new FunctionalJob(name, () -> isFeatureEnabled(name), cadence::isDue, cadence::markerFor, run));
    }

    @Override
    public TickResult tick(Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        long startedAt = System.nanoTime();

        List<JobOutcome> outcomes = new ArrayList<>();
        for (Job job : snapshotJobs()) {
            outcomes.add(evaluate(job, now));
        }

        MaintenanceReport maintenance = null;
        try {
            if (cache.needsMaintenance(now)) {
                maintenance = cache.maintain(now);
            }
        } catch (Exception e) {
            log.error("cache maintenance failed tenant={} msg={}", tenantId, e.getMessage(), e);
        }

        TickResult result = new TickResult(tenantId, now, outcomes,
                Duration.ofNanos(System.nanoTime() - startedAt), maintenance);
        log.info("tick done tenant={} at={} ran={} errored={} took={}ms maintenance={}",
                tenantId, now,
                result.withStatus(JobOutcome.Status.RAN),
                result.withStatus(JobOutcome.Status.ERRORED),
                result.duration().toMillis(),
                maintenance != null);
        return result;
    }

    @Override
    public JobOutcome runNow(String name, Instant now) {
        Job job;
        synchronized (this) {
            job = jobs.get(name);
        }
        if (job == null) {
            throw new IllegalStateException("No job registered for name: " + name);
        }
        if (!job.isEnabled()) {
            log.info("manual run skipped, job disabled tenant={} name={}", tenantId, name);
            return JobOutcome.skippedDisabled(name);
        }
        log.info("manual run tenant={} name={} at={}", tenantId, name, now);
        return execute(job, now, false);
    }

    @Override
    public void enableFeature(String name) {
        Objects.requireNonNull(name, "feature name must not be null");
        stateStore.update(tenantId, FeatureToggles.SECTION, t -> t.with(name));
        triggerManager.ensureTrigger(tenantId, this::fire);
        log.info("feature enabled tenant={} feature={}", tenantId, name);
    }

    @Override
    public void disableFeature(String name) {
        Objects.requireNonNull(name, "feature name must not be null");
        FeatureToggles toggles = stateStore.update(tenantId, FeatureToggles.SECTION, t -> t.without(name));
        log.info("feature disabled tenant={} feature={}", tenantId, name);
        if (!toggles.anyEnabled()) {
            triggerManager.retireTrigger(tenantId);
            log.info("trigger retired, no feature enabled tenant={}", tenantId);
        }
    }

    @Override
    public boolean isFeatureEnabled(String name) {
        return stateStore.read(tenantId, FeatureToggles.SECTION).contains(name);
    }

    @Override
    public synchronized List<String> jobNames() {
        return List.copyOf(jobs.keySet());
    }

    @Override
    public void syncTrigger() {
        if (stateStore.read(tenantId, FeatureToggles.SECTION).anyEnabled()) {
            triggerManager.ensureTrigger(tenantId, this::fire);
        } else {
            triggerManager.retireTrigger(tenantId);
        }
    }

    private void fire() {
        tick(clock.instant());
    }

    private JobOutcome evaluate(Job job, Instant now) {
        String name = job.name();
        try {
            if (!job.isEnabled()) {
                log.debug("job skipped, disabled tenant={} name={}", tenantId, name);
                return JobOutcome.skippedDisabled(name);
            }
            String marker = stateStore.read(tenantId, JobMarkers.SECTION).valueOf(name);
            if (!job.shouldRunNow(now, marker)) {
                log.debug("job skipped, not due tenant={} name={} marker={}", tenantId, name, marker);
                return JobOutcome.skippedNotDue(name);
            }
        } catch (Exception | LinkageError | AssertionError e) {
            log.error("job evaluation failed tenant={} name={} msg={}", tenantId, name, e.getMessage(), e);
            return JobOutcome.errored(name, e);
        }
        return execute(job, now, true);
    }

    private JobOutcome execute(Job job, Instant now, boolean writeMarker) {
        String name = job.name();
        long startedAt = System.nanoTime();
        log.debug("job started tenant={} name={} at={}", tenantId, name, now);
        try {
            job.run();
        } catch (Exception | LinkageError | AssertionError e) {
            // errors a job can recover from count as its failure; VM errors still propagate
            log.error("job failed tenant={} name={} msg={}", tenantId, name, e.getMessage(), e);
            return JobOutcome.errored(name, e);
        }
        log.debug("job succeeded tenant={} name={} took={}ms",
                tenantId, name, Duration.ofNanos(System.nanoTime() - startedAt).toMillis());

        if (writeMarker) {
            try {
                String marker = job.markerAfterRun(now);
                if (marker != null) {
                    Instant writtenAt = clock.instant();
                    stateStore.update(tenantId, JobMarkers.SECTION, m -> m.with(name, marker, writtenAt));
                }
            } catch (Exception e) {
                log.error("job marker write failed tenant={} name={} msg={}", tenantId, name, e.getMessage(), e);
            }
        }
        return JobOutcome.ran(name);
    }

    private synchronized List<Job> snapshotJobs() {
        return List.copyOf(jobs.values());
    }
}

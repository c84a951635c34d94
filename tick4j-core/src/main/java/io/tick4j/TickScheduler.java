package io.tick4j;

import io.tick4j.core.JobOutcome;
import io.tick4j.core.TickResult;

import java.time.Instant;
import java.util.List;
import java.util.function.BiPredicate;
import java.util.function.BooleanSupplier;

/**
 * Main scheduler API of one tenant.
 *
 * <p>A single external trigger calls {@link #tick(Instant)} on a fixed, coarse cadence (e.g. hourly);
 * the scheduler makes that one cadence behave like one independent cadence per registered job.
 */
public interface TickScheduler {

    String tenantId();

    void registerJob(Job job);

    void registerJob(String name, BooleanSupplier isEnabled, BiPredicate<Instant, String> shouldRunNow, JobAction run);

    /**
     * Register a job enabled while the feature of the same name is enabled.
     */
    void registerJob(String name, Cadence cadence, JobAction run);

    /**
     * Evaluate every job in registration order, then run cache maintenance when it is due.
     * Never throws because of a job.
     */
    TickResult tick(Instant now);

    /**
     * Run one job immediately if it is enabled, ignoring its cadence. The marker is not written.
     */
    JobOutcome runNow(String name, Instant now);

    /**
     * Enable a feature and make sure the tenant's trigger exists.
     */
    void enableFeature(String name);

    /**
     * Disable a feature; the trigger is retired when no feature remains enabled.
     */
    void disableFeature(String name);

    boolean isFeatureEnabled(String name);

    /**
     * Ensure or retire the trigger according to the stored toggles, e.g. after a restart.
     */
    void syncTrigger();

    List<String> jobNames();
}

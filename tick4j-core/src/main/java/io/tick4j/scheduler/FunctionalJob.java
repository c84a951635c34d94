package io.tick4j.scheduler;

import io.tick4j.Job;
import io.tick4j.JobAction;

import java.time.Instant;
import java.util.Objects;
import java.util.function.BiPredicate;
import java.util.function.BooleanSupplier;
import java.util.function.Function;

/**
 * {@link Job} assembled from functions.
 */
final class FunctionalJob implements Job {

    private final String name;
    private final BooleanSupplier isEnabled;
    private final BiPredicate<Instant, String> shouldRunNow;
    private final Function<Instant, String> marker;
    private final JobAction action;

    FunctionalJob(String name,
                  BooleanSupplier isEnabled,
                  BiPredicate<Instant, String> shouldRunNow,
                  Function<Instant, String> marker,
                  JobAction action) {
        this.name = Objects.requireNonNull(name, "job name must not be null");
        this.isEnabled = Objects.requireNonNull(isEnabled, "isEnabled must not be null");
        this.shouldRunNow = Objects.requireNonNull(shouldRunNow, "shouldRunNow must not be null");
        this.marker = Objects.requireNonNull(marker, "marker must not be null");
        this.action = Objects.requireNonNull(action, "action must not be null");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean isEnabled() {
        return isEnabled.getAsBoolean();
    }

    @Override
    public boolean shouldRunNow(Instant tickTime, String lastRunMarker) {
        return shouldRunNow.test(tickTime, lastRunMarker);
    }

    @Override
    public String markerAfterRun(Instant tickTime) {
        return marker.apply(tickTime);
    }

    @Override
    public void run() throws Exception {
        action.run();
    }

    @Override
    public String toString() {
        return "Job[" + name + "]";
    }
}

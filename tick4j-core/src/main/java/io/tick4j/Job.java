package io.tick4j;

import java.time.Instant;

/**
 * Named unit of recurring work evaluated on every tick of its tenant.
 *
 * <p>{@link #run()} is called at most once per qualifying tick.
 */
public interface Job {

    String name();

    /**
     * Usually reads the tenant's feature toggle.
     */
    boolean isEnabled();

    /**
     * @param lastRunMarker marker written after the last successful run, or null
     */
    boolean shouldRunNow(Instant tickTime, String lastRunMarker);

    /**
     * Marker to persist after a successful run at {@code tickTime}; null when the job keeps no marker.
     */
    default String markerAfterRun(Instant tickTime) {
        return null;
    }

    void run() throws Exception;
}

package io.tick4j;

import java.time.Instant;

/**
 * When a job is due, expressed against the coarse tick and the job's idempotency marker.
 *
 * @see io.tick4j.core.Cadences
 */
public interface Cadence {

    boolean isDue(Instant tickTime, String lastRunMarker);

    /**
     * Marker recorded after a successful run, or null for stateless cadences.
     */
    String markerFor(Instant tickTime);
}

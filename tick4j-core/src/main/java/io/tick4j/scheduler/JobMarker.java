package io.tick4j.scheduler;

import java.time.Instant;

/**
 * Idempotency marker of one job, written only after a successful run.
 */
public record JobMarker(String job, String value, Instant writtenAt) {
}

package io.tick4j.core;

import io.tick4j.cache.MaintenanceReport;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Observability record of one tick. Not persisted.
 *
 * @param maintenance null when cache maintenance did not run on this tick
 */
public record TickResult(
        String tenantId,
        Instant tickTime,
        List<JobOutcome> outcomes,
        Duration duration,
        MaintenanceReport maintenance
) {

    public TickResult {
        outcomes = List.copyOf(outcomes);
    }

    /**
     * Names of the jobs whose {@code run()} was invoked, in order.
     */
    public List<String> attempted() {
        return outcomes.stream().filter(JobOutcome::attempted).map(JobOutcome::name).toList();
    }

    public Optional<JobOutcome> outcome(String name) {
        return outcomes.stream().filter(o -> o.name().equals(name)).findFirst();
    }

    public List<String> withStatus(JobOutcome.Status status) {
        return outcomes.stream().filter(o -> o.status() == status).map(JobOutcome::name).toList();
    }
}

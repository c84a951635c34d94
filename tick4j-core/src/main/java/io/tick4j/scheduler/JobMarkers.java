package io.tick4j.scheduler;

import io.tick4j.spi.StateSection;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public record JobMarkers(List<JobMarker> markers) {

    public static final StateSection<JobMarkers> SECTION =
            StateSection.of("markers", JobMarkers.class, JobMarkers::none);

    public JobMarkers {
        markers = markers == null ? List.of() : List.copyOf(markers);
    }

    public static JobMarkers none() {
        return new JobMarkers(List.of());
    }

    /**
     * Marker value of {@code job}, or null.
     */
    public String valueOf(String job) {
        for (JobMarker m : markers) {
            if (m.job().equals(job)) {
                return m.value();
            }
        }
        return null;
    }

    public JobMarkers with(String job, String value, Instant writtenAt) {
        List<JobMarker> next = new ArrayList<>(markers.size() + 1);
        for (JobMarker m : markers) {
            if (!m.job().equals(job)) {
                next.add(m);
            }
        }
        next.add(new JobMarker(job, value, writtenAt));
        return new JobMarkers(next);
    }
}

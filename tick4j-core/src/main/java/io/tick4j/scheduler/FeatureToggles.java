package io.tick4j.scheduler;

import io.tick4j.spi.StateSection;

import java.util.ArrayList;
import java.util.List;

/**
 * Features a tenant has switched on.
 */
public record FeatureToggles(List<String> enabled) {

    public static final StateSection<FeatureToggles> SECTION =
            StateSection.of("features", FeatureToggles.class, FeatureToggles::none);

    public FeatureToggles {
        enabled = enabled == null ? List.of() : List.copyOf(enabled);
    }

    public static FeatureToggles none() {
        return new FeatureToggles(List.of());
    }

    public boolean contains(String feature) {
        return enabled.contains(feature);
    }

    public boolean anyEnabled() {
        return !enabled.isEmpty();
    }

    public FeatureToggles with(String feature) {
        if (contains(feature)) {
            return this;
        }
        List<String> next = new ArrayList<>(enabled);
        next.add(feature);
        return new FeatureToggles(next);
    }

    public FeatureToggles without(String feature) {
        List<String> next = new ArrayList<>(enabled);
        next.remove(feature);
        return new FeatureToggles(next);
    }
}

package io.tick4j.cache;

import io.tick4j.spi.StateSection;

import java.time.Instant;

/**
 * @param lastMaintenanceAt null until maintenance first ran for the tenant
 */
public record MaintenanceState(Instant lastMaintenanceAt) {

    public static final StateSection<MaintenanceState> SECTION =
            StateSection.of("maintenance", MaintenanceState.class, () -> new MaintenanceState(null));
}

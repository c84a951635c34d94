package io.tick4j.core;

import io.tick4j.Cadence;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CadencesTest {

    @Test
    void dailyAtShouldUseLocalCalendarDay() {
        Cadence daily = Cadences.dailyAt(8, ZoneId.of("America/New_York"));
        Instant localSeven = Instant.parse("2026-03-02T12:00:00Z");
        Instant localEight = Instant.parse("2026-03-02T13:00:00Z");

        assertFalse(daily.isDue(localSeven, null));
        assertTrue(daily.isDue(localEight, null));
        assertEquals("2026-03-02", daily.markerFor(localEight));
        assertFalse(daily.isDue(localEight.plus(Duration.ofHours(3)), "2026-03-02"));
        assertTrue(daily.isDue(localEight.plus(Duration.ofDays(1)), "2026-03-02"));
    }

    @Test
    void dailyAtShouldRejectInvalidHour() {
        assertThrows(IllegalArgumentException.class, () -> Cadences.dailyAt(24, ZoneOffset.UTC));
    }

    @Test
    void everyShouldToleratePunctualJitter() {
        Cadence every = Cadences.every(Duration.ofHours(6));
        String marker = "2026-03-02T00:00:00Z";

        assertTrue(every.isDue(Instant.parse("2026-03-02T05:00:00Z"), null));
        assertFalse(every.isDue(Instant.parse("2026-03-02T05:58:00Z"), marker));
        assertTrue(every.isDue(Instant.parse("2026-03-02T05:59:00Z"), marker));
        assertTrue(every.isDue(Instant.parse("2026-03-02T07:00:00Z"), "not-an-instant"));
    }

    @Test
    void cronShouldFireOncePerMatchingTime() {
        Cadence cron = Cadences.cron("0 8 * * *", ZoneOffset.UTC, Duration.ofHours(1));
        Instant eight = Instant.parse("2026-03-02T08:00:00Z");

        assertFalse(cron.isDue(Instant.parse("2026-03-02T07:00:00Z"), null));
        assertTrue(cron.isDue(eight, null));
        assertFalse(cron.isDue(Instant.parse("2026-03-02T09:00:00Z"), cron.markerFor(eight)));
        assertTrue(cron.isDue(Instant.parse("2026-03-03T08:00:00Z"), cron.markerFor(eight)));
    }

    @Test
    void everyTickShouldAlwaysBeDueWithoutMarker() {
        Cadence tick = Cadences.everyTick();

        assertTrue(tick.isDue(Instant.EPOCH, "anything"));
        assertNull(tick.markerFor(Instant.EPOCH));
    }
}

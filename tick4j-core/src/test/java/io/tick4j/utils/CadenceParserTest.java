package io.tick4j.utils;

import io.tick4j.Cadence;
import io.tick4j.core.Cadences;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CadenceParserTest {

    private static final ZoneId ZONE = ZoneId.of("Europe/Berlin");
    private static final Duration TICK = Duration.ofHours(1);

    @Test
    void parseHumanDurationShouldWork() {
        assertEquals(Duration.ofMinutes(5), CadenceParser.parseHumanDuration("5 minutes"));
        assertEquals(Duration.ofMinutes(30), CadenceParser.parseHumanDuration("30m"));
        assertEquals(Duration.ofHours(36), CadenceParser.parseHumanDuration("1 day 12 hours"));
        assertEquals(Duration.ofSeconds(90), CadenceParser.parseHumanDuration("90"));
    }

    @Test
    void parseHumanDurationShouldRejectGarbage() {
        assertThrows(IllegalArgumentException.class, () -> CadenceParser.parseHumanDuration("soon"));
        assertThrows(IllegalArgumentException.class, () -> CadenceParser.parseHumanDuration("5 fortnights"));
        assertThrows(IllegalArgumentException.class, () -> CadenceParser.parseHumanDuration("0"));
        assertThrows(IllegalArgumentException.class, () -> CadenceParser.parseHumanDuration(" "));
    }

    @Test
    void everyTickSpecsShouldParse() {
        assertSame(Cadences.everyTick(), CadenceParser.parse("every tick", ZONE, TICK));
        assertSame(Cadences.everyTick(), CadenceParser.parse("*", ZONE, TICK));
    }

    @Test
    void dailySpecsShouldUseTheHour() {
        assertEquals(new Cadences.DailyAt(8, ZONE), CadenceParser.parse("AT 08:00", ZONE, TICK));
        assertEquals(new Cadences.DailyAt(17, ZONE), CadenceParser.parse("daily at 17", ZONE, TICK));
    }

    @Test
    void cronSpecShouldParse() {
        Cadence cadence = CadenceParser.parse("0 8 * * MON-FRI", ZONE, TICK);

        Cadences.Cron cron = assertInstanceOf(Cadences.Cron.class, cadence);
        assertEquals("0 0 8 ? * MON-FRI", cron.expression());
    }

    @Test
    void intervalSpecShouldParse() {
        assertEquals(new Cadences.Every(Duration.ofHours(6)), CadenceParser.parse("6 hours", ZoneOffset.UTC, TICK));
    }

    @Test
    void normalizeCronShouldSupportFiveFieldCron() {
        assertEquals("0 */5 * * * ?", CadenceParser.normalizeCron("*/5 * * * *"));
        assertEquals("0 0 8 1 * ?", CadenceParser.normalizeCron("0 8 1 * *"));
        assertEquals("0 0 9 ? * MON", CadenceParser.normalizeCron("0 9 * * MON"));
    }

    @Test
    void looksLikeCronShouldRecognizeValidSpec() {
        assertTrue(CadenceParser.looksLikeCron("0 */10 * * * *"));
        assertFalse(CadenceParser.looksLikeCron("6 hours"));
    }
}

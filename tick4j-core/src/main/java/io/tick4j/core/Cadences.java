package io.tick4j.core;

import io.tick4j.Cadence;
import io.tick4j.utils.CadenceParser;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Date;
import java.util.Objects;
import java.util.TimeZone;

/**
 * Built-in {@link Cadence} implementations.
 *
 * <ul>
 *   <li>{@link #everyTick()}: due on every tick, no marker</li>
 *   <li>{@link #dailyAt(int, ZoneId)}: once per local calendar day, on the first tick at or after the hour</li>
 *   <li>{@link #every(Duration)}: at least {@code interval} after the last successful run</li>
 *   <li>{@link #cron(String, ZoneId, Duration)}: when a cron fire time passed since the last run</li>
 * </ul>
 */
public final class Cadences {

    // Ticks fire a little early or late; interval cadences accept this much slack.
    static final Duration TICK_JITTER = Duration.ofMinutes(1);

    private Cadences() {
    }

    public static Cadence everyTick() {
        return EveryTick.INSTANCE;
    }

    public static Cadence dailyAt(int hour, ZoneId zone) {
        return new DailyAt(hour, zone);
    }

    public static Cadence every(Duration interval) {
        return new Every(interval);
    }

    /**
     * @param lookback how far back the first evaluation (no marker yet) looks for a fire time;
     *                 normally the tick interval
     */
    public static Cadence cron(String expression, ZoneId zone, Duration lookback) {
        return new Cron(CadenceParser.normalizeCron(expression), zone, lookback);
    }

    enum EveryTick implements Cadence {
        INSTANCE;

        @Override
        public boolean isDue(Instant tickTime, String lastRunMarker) {
            return true;
        }

        @Override
        public String markerFor(Instant tickTime) {
            return null;
        }

        @Override
        public String toString() {
            return "every tick";
        }
    }

    /**
     * The marker is the ISO local date in {@code zone}. A tick delayed past midnight counts for the
     * day it actually ran on.
     */
    public record DailyAt(int hour, ZoneId zone) implements Cadence {

        public DailyAt {
            Objects.requireNonNull(zone, "zone must not be null");
            if (hour < 0 || hour > 23) {
                throw new IllegalArgumentException("hour must be in 0..23: " + hour);
            }
        }

        @Override
        public boolean isDue(Instant tickTime, String lastRunMarker) {
            ZonedDateTime local = tickTime.atZone(zone);
            return local.getHour() >= hour && !local.toLocalDate().toString().equals(lastRunMarker);
        }

        @Override
        public String markerFor(Instant tickTime) {
            return tickTime.atZone(zone).toLocalDate().toString();
        }
    }

    public record Every(Duration interval) implements Cadence {

        public Every {
            Objects.requireNonNull(interval, "interval must not be null");
            if (interval.isZero() || interval.isNegative()) {
                throw new IllegalArgumentException("interval must be a positive duration");
            }
        }

        @Override
        public boolean isDue(Instant tickTime, String lastRunMarker) {
            Instant last = parseInstant(lastRunMarker);
            if (last == null) {
                return true;
            }
            return !tickTime.isBefore(last.plus(interval).minus(TICK_JITTER));
        }

        @Override
        public String markerFor(Instant tickTime) {
            return tickTime.toString();
        }
    }

    public record Cron(String expression, ZoneId zone, Duration lookback) implements Cadence {

        public Cron {
            Objects.requireNonNull(expression, "expression must not be null");
            Objects.requireNonNull(zone, "zone must not be null");
            Objects.requireNonNull(lookback, "lookback must not be null");
            if (!CronExpression.isValidExpression(expression)) {
                throw new IllegalArgumentException("Invalid cron expression: " + expression);
            }
        }

        @Override
        public boolean isDue(Instant tickTime, String lastRunMarker) {
            Instant last = parseInstant(lastRunMarker);
            Instant from = last != null ? last : tickTime.minus(lookback);

            Date next = compile().getNextValidTimeAfter(Date.from(from));
            return next != null && !next.toInstant().isAfter(tickTime);
        }

        @Override
        public String markerFor(Instant tickTime) {
            return tickTime.toString();
        }

        private CronExpression compile() {
            try {
                CronExpression exp = new CronExpression(expression);
                exp.setTimeZone(TimeZone.getTimeZone(zone));
                return exp;
            } catch (ParseException e) {
                throw new IllegalStateException("Invalid cron expression: " + expression, e);
            }
        }
    }

    private static Instant parseInstant(String marker) {
        if (marker == null || marker.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(marker);
        } catch (DateTimeException e) {
            return null;
        }
    }
}

package io.tick4j.utils;

import io.tick4j.Cadence;
import io.tick4j.core.Cadences;
import org.quartz.CronExpression;

import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses cadence expressions as found in configuration.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>{@code "every tick"} (also {@code "tick"}, {@code "*"})</li>
 *   <li>Daily: {@code "AT 08:00"}, {@code "daily at 8"}; minutes are ignored, ticks are hourly at best</li>
 *   <li>Cron expressions, 5 or 6 fields: {@code "0 8 * * MON-FRI"}</li>
 *   <li>Human-readable intervals: {@code "6 hours"}, {@code "1 day 12 hours"}, {@code "30m"}, numeric seconds</li>
 * </ul>
 */
public final class CadenceParser {

    private static final Pattern DAILY_AT = Pattern.compile("^daily at (\\d{1,2})(?::00)?$");
    private static final Pattern DURATION_PART = Pattern.compile("(\\d+)\\s*([a-z]+)");

    private static final Map<String, Duration> UNITS = Map.ofEntries(
            Map.entry("s", Duration.ofSeconds(1)),
            Map.entry("sec", Duration.ofSeconds(1)),
            Map.entry("second", Duration.ofSeconds(1)),
            Map.entry("m", Duration.ofMinutes(1)),
            Map.entry("min", Duration.ofMinutes(1)),
            Map.entry("minute", Duration.ofMinutes(1)),
            Map.entry("h", Duration.ofHours(1)),
            Map.entry("hour", Duration.ofHours(1)),
            Map.entry("d", Duration.ofDays(1)),
            Map.entry("day", Duration.ofDays(1)),
            Map.entry("w", Duration.ofDays(7)),
            Map.entry("week", Duration.ofDays(7))
    );

    private CadenceParser() {
    }

    /**
     * @param zone         zone of daily and cron cadences
     * @param tickInterval lookback of a cron cadence's first evaluation
     */
    public static Cadence parse(String spec, ZoneId zone, Duration tickInterval) {
        if (spec == null || spec.isBlank()) {
            throw new IllegalArgumentException("cadence must not be empty");
        }
        Objects.requireNonNull(zone, "zone must not be null");
        Objects.requireNonNull(tickInterval, "tickInterval must not be null");

        String s = spec.trim();
        String lower = s.toLowerCase(Locale.ROOT);

        if (lower.equals("every tick") || lower.equals("tick") || lower.equals("*")) {
            return Cadences.everyTick();
        }

        if (lower.startsWith("at ")) {
            try {
                LocalTime lt = LocalTime.parse(s.substring(3).trim());
                return Cadences.dailyAt(lt.getHour(), zone);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Invalid time of day: " + spec, e);
            }
        }

        Matcher daily = DAILY_AT.matcher(lower);
        if (daily.matches()) {
            return Cadences.dailyAt(Integer.parseInt(daily.group(1)), zone);
        }

        if (looksLikeCron(s)) {
            return Cadences.cron(s, zone, tickInterval);
        }

        return Cadences.every(parseHumanDuration(s));
    }

    /**
     * Normalize cron expressions to Quartz syntax:
     * - Accepts 6-field Spring cron.
     * - Accepts 5-field cron by prepending seconds "0".
     * - Quartz wants '?' in day-of-month or day-of-week; a '*' there is replaced.
     */
    public static String normalizeCron(String spec) {
        if (spec == null || spec.isBlank()) {
            throw new IllegalArgumentException("cron expression must not be empty");
        }
        String[] parts = spec.trim().split("\\s+");
        if (parts.length != 5 && parts.length != 6) {
            return spec.trim();
        }
        String[] fields = parts.length == 5
                ? new String[]{"0", parts[0], parts[1], parts[2], parts[3], parts[4]}
                : parts.clone();

        if (!"?".equals(fields[3]) && !"?".equals(fields[5])) {
            if ("*".equals(fields[5])) {
                fields[5] = "?";
            } else if ("*".equals(fields[3])) {
                fields[3] = "?";
            }
        }
        return String.join(" ", fields);
    }

    public static boolean looksLikeCron(String spec) {
        try {
            return CronExpression.isValidExpression(normalizeCron(spec));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * Parse {@code "90"}, {@code "30m"}, {@code "6 hours"} or {@code "1 day 12 hours"}.
     */
    public static Duration parseHumanDuration(String input) {
        Objects.requireNonNull(input, "input must not be null");
        String s = input.trim().toLowerCase(Locale.ROOT);
        if (s.isEmpty()) {
            throw new IllegalArgumentException("Interval string must not be empty");
        }

        if (s.matches("^\\d+$")) {
            long seconds;
            try {
                seconds = Long.parseLong(s);
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Interval seconds out of range: " + input);
            }
            if (seconds <= 0) {
                throw new IllegalArgumentException("Interval seconds must be positive: " + input);
            }
            return Duration.ofSeconds(seconds);
        }

        Matcher m = DURATION_PART.matcher(s);
        Duration total = Duration.ZERO;
        int consumed = 0;
        while (m.find()) {
            if (!s.substring(consumed, m.start()).isBlank()) {
                throw new IllegalArgumentException("Invalid interval format: " + input);
            }
            String unit = m.group(2);
            Duration perUnit = UNITS.get(unit);
            if (perUnit == null && unit.endsWith("s")) {
                perUnit = UNITS.get(unit.substring(0, unit.length() - 1));
            }
            if (perUnit == null) {
                throw new IllegalArgumentException("Unsupported interval unit: " + unit);
            }
            total = total.plus(perUnit.multipliedBy(Long.parseLong(m.group(1))));
            consumed = m.end();
        }
        if (consumed == 0 || !s.substring(consumed).isBlank()) {
            throw new IllegalArgumentException("Invalid interval format: " + input);
        }
        if (total.isZero()) {
            throw new IllegalArgumentException("Interval must be positive: " + input);
        }
        return total;
    }
}

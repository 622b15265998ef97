package com.sitecrawler.scheduler.cron;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Five-field cron expressions: parsing, validation, instant matching and
 * next-run computation.
 *
 * <p>
 * Grammar per field, checked in this order: {@code *}, {@code a-b},
 * {@code a,b,c}, {@code base/step} (base is {@code *} or an integer), bare
 * integer. Seconds, month/day names and {@code @}-macros are not supported.
 *
 * <p>
 * Expressions are evaluated in the engine's zone (the server's local zone by
 * default); the instants going in and out are zone-free.
 *
 * <p>
 * {@link #computeNextRun(CronSpec, Instant)} is an approximation rather than a
 * full scan: it is exact for {@code *}{@code /N} minutes and for a concrete
 * hour and minute, and falls back to the top of the next hour for everything
 * else.
 */
@Slf4j
public class CronExpressionEngine {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern INTEGER = Pattern.compile("\\d+");

    private static final Map<String, String> DESCRIPTIONS = Map.of(
            "0 0 * * *", "Daily at midnight",
            "0 9 * * *", "Daily at 9:00 AM",
            "0 0 * * 0", "Weekly on Sunday at midnight",
            "0 0 1 * *", "Monthly on the 1st at midnight",
            "*/15 * * * *", "Every 15 minutes",
            "0 */6 * * *", "Every 6 hours");

    private final Clock clock;
    private final ZoneId zone;

    public CronExpressionEngine() {
        this(Clock.systemUTC(), ZoneId.systemDefault());
    }

    public CronExpressionEngine(Clock clock, ZoneId zone) {
        this.clock = clock;
        this.zone = zone;
    }

    public ZoneId getZone() {
        return zone;
    }

    // --- Parsing & validation ---

    /**
     * Split an expression into its five fields.
     *
     * @return the fields, or null unless exactly five whitespace-separated tokens
     *         are present
     */
    public CronSpec parse(String expr) {
        if (expr == null || expr.isBlank())
            return null;
        String[] parts = WHITESPACE.split(expr.trim());
        if (parts.length != 5)
            return null;
        return new CronSpec(parts[0], parts[1], parts[2], parts[3], parts[4]);
    }

    /**
     * Validate every field against its domain. Never throws; the first failing
     * field short-circuits with a message naming the field and the token.
     */
    public CronValidation validate(String expr) {
        try {
            CronSpec spec = parse(expr);
            if (spec == null) {
                return CronValidation.invalid(
                        "Invalid cron expression format. Expected: \"minute hour day month dayOfWeek\"");
            }
            CronField[] fields = CronField.values();
            for (int i = 0; i < fields.length; i++) {
                CronValidation result = validateField(spec.fields().get(i), fields[i]);
                if (!result.valid())
                    return result;
            }
            return CronValidation.ok(computeNextRun(spec, clock.instant()));
        } catch (RuntimeException e) {
            return CronValidation.invalid("Invalid cron expression: " + e.getMessage());
        }
    }

    private static CronValidation validateField(String token, CronField field) {
        if ("*".equals(token))
            return CronValidation.ok();

        if (token.contains("-")) {
            String[] bounds = token.split("-", -1);
            if (bounds.length != 2 || !isInteger(bounds[0]) || !isInteger(bounds[1])) {
                return CronValidation.invalid("Invalid range in " + field.label + ": " + token);
            }
            int start = Integer.parseInt(bounds[0]);
            int end = Integer.parseInt(bounds[1]);
            if (!field.inRange(start) || !field.inRange(end) || start > end) {
                return CronValidation.invalid("Invalid range in " + field.label + ": " + token);
            }
            return CronValidation.ok();
        }

        if (token.contains(",")) {
            for (String value : token.split(",", -1)) {
                if (!isInteger(value) || !field.inRange(Integer.parseInt(value))) {
                    return CronValidation.invalid(
                            "Invalid value in " + field.label + ": " + value + " (" + token + ")");
                }
            }
            return CronValidation.ok();
        }

        if (token.contains("/")) {
            String[] parts = token.split("/", -1);
            boolean baseOk = parts.length == 2
                    && ("*".equals(parts[0]) || isInteger(parts[0]) && field.inRange(Integer.parseInt(parts[0])));
            if (!baseOk || !isInteger(parts[1]) || Integer.parseInt(parts[1]) <= 0) {
                return CronValidation.invalid("Invalid step value in " + field.label + ": " + token);
            }
            return CronValidation.ok();
        }

        if (!isInteger(token) || !field.inRange(Integer.parseInt(token))) {
            return CronValidation.invalid("Invalid value in " + field.label + ": " + token);
        }
        return CronValidation.ok();
    }

    private static boolean isInteger(String s) {
        // bounded length keeps Integer.parseInt from overflowing
        return s.length() <= 9 && INTEGER.matcher(s).matches();
    }

    // --- Matching ---

    /**
     * Whether every field matches the corresponding component of
     * {@code instant} in the engine's zone. Unparseable expressions never match.
     */
    public boolean shouldRun(String expr, Instant instant) {
        CronSpec spec = parse(expr);
        if (spec == null)
            return false;
        ZonedDateTime t = instant.atZone(zone);
        return matchesField(spec.minute(), t.getMinute())
                && matchesField(spec.hour(), t.getHour())
                && matchesField(spec.dayOfMonth(), t.getDayOfMonth())
                && matchesField(spec.month(), t.getMonthValue())
                // java.time counts Monday=1..Sunday=7, cron counts Sunday=0
                && matchesField(spec.dayOfWeek(), t.getDayOfWeek().getValue() % 7);
    }

    static boolean matchesField(String token, int value) {
        try {
            if ("*".equals(token))
                return true;

            if (token.contains("-")) {
                String[] bounds = token.split("-", -1);
                return value >= Integer.parseInt(bounds[0]) && value <= Integer.parseInt(bounds[1]);
            }

            if (token.contains(",")) {
                for (String v : token.split(",")) {
                    if (Integer.parseInt(v) == value)
                        return true;
                }
                return false;
            }

            if (token.contains("/")) {
                String[] parts = token.split("/", -1);
                int step = Integer.parseInt(parts[1]);
                if (step <= 0)
                    return false;
                if ("*".equals(parts[0]))
                    return value % step == 0;
                int base = Integer.parseInt(parts[0]);
                return value >= base && (value - base) % step == 0;
            }

            return Integer.parseInt(token) == value;
        } catch (NumberFormatException | ArrayIndexOutOfBoundsException e) {
            return false;
        }
    }

    // --- Next run ---

    public Instant computeNextRun(CronSpec spec) {
        return computeNextRun(spec, clock.instant());
    }

    /**
     * Next run strictly after {@code from}, with seconds zeroed. Never throws;
     * any failure yields the top of the hour following {@code from}.
     */
    public Instant computeNextRun(CronSpec spec, Instant from) {
        if (from == null)
            from = clock.instant();
        ZonedDateTime now = from.atZone(zone);
        try {
            ZonedDateTime next;
            if (spec.minute().contains("/")) {
                next = nextStepMinute(spec.minute(), now);
            } else if (isInteger(spec.minute()) && isInteger(spec.hour())) {
                next = now.truncatedTo(ChronoUnit.DAYS)
                        .withHour(Integer.parseInt(spec.hour()))
                        .withMinute(Integer.parseInt(spec.minute()));
                if (!next.isAfter(now)) {
                    next = next.plusDays(1);
                }
            } else {
                next = topOfNextHour(now);
            }
            return next.truncatedTo(ChronoUnit.MINUTES).toInstant();
        } catch (RuntimeException e) {
            log.debug("Falling back to next hour for cron {}: {}", spec, e.getMessage());
            return fallbackNextRun(from);
        }
    }

    /**
     * The fallback next run: the top of the hour following {@code from}.
     */
    public Instant fallbackNextRun(Instant from) {
        return topOfNextHour(from.atZone(zone)).toInstant();
    }

    private static ZonedDateTime nextStepMinute(String minuteToken, ZonedDateTime now) {
        String[] parts = minuteToken.split("/", -1);
        int step = Integer.parseInt(parts[1]);
        if (step <= 0) {
            throw new IllegalArgumentException("Invalid step value: " + parts[1]);
        }
        if (!"*".equals(parts[0])) {
            return topOfNextHour(now);
        }
        int current = now.getMinute();
        int nextMinute = ((current + 1 + step - 1) / step) * step;
        if (nextMinute >= 60) {
            return topOfNextHour(now);
        }
        return now.truncatedTo(ChronoUnit.HOURS).withMinute(nextMinute);
    }

    private static ZonedDateTime topOfNextHour(ZonedDateTime now) {
        return now.truncatedTo(ChronoUnit.HOURS).plusHours(1);
    }

    // --- Description ---

    /**
     * Human-readable label for a handful of well-known expressions.
     */
    public String getDescription(String expr) {
        CronSpec spec = parse(expr);
        if (spec == null)
            return "Invalid cron expression";
        String known = DESCRIPTIONS.get(spec.toString());
        return known != null ? known : "Custom schedule: " + expr;
    }
}

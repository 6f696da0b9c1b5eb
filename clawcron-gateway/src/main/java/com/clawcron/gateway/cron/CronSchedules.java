package com.clawcron.gateway.cron;

import com.clawcron.gateway.cron.CronTypes.CronSchedule;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.scheduling.support.CronExpression;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * Next-run computation for the three schedule kinds. Stateless apart from a
 * bounded cache of parsed cron expressions.
 * <p>
 * Cron expressions use the standard five fields (minute, hour, day-of-month,
 * month, day-of-week) and are evaluated by Spring's {@link CronExpression} with
 * the seconds field pinned to 0. When both day-of-month and day-of-week are
 * restricted, a day matching either one fires, as in classic cron; this is
 * evaluated as two expressions, each with one of the day fields set to
 * {@code ?}, taking the earlier result.
 */
public final class CronSchedules {

    private CronSchedules() {
    }

    private static final Cache<String, List<CronExpression>> EXPRESSIONS = Caffeine.newBuilder()
            .maximumSize(512)
            .build();

    /**
     * Compute the next run instant.
     *
     * @param schedule        schedule to evaluate
     * @param nowMs           current time
     * @param lastRunAtMs     start of the previous run, null if never run
     * @param defaultAnchorMs anchor for "every" schedules without one (the job's
     *                        creation time)
     * @return epoch ms of the next run, or null if the schedule will not fire
     *         again
     */
    public static Long computeNextRunAtMs(CronSchedule schedule, long nowMs, Long lastRunAtMs, long defaultAnchorMs) {
        if (schedule == null || schedule.getKind() == null) {
            return null;
        }
        return switch (schedule.getKind()) {
            case AT -> lastRunAtMs == null ? schedule.getAtMs() : null;
            case EVERY -> nextEvery(schedule, nowMs, lastRunAtMs, defaultAnchorMs);
            case CRON -> nextCron(schedule, lastRunAtMs != null ? Math.max(nowMs, lastRunAtMs) : nowMs);
        };
    }

    private static Long nextEvery(CronSchedule schedule, long nowMs, Long lastRunAtMs, long defaultAnchorMs) {
        Long everyMs = schedule.getEveryMs();
        if (everyMs == null || everyMs <= 0) {
            return null;
        }
        long anchor = schedule.getAnchorMs() != null ? schedule.getAnchorMs() : defaultAnchorMs;
        long lower = lastRunAtMs != null ? Math.max(nowMs, lastRunAtMs + 1) : nowMs;
        if (lower <= anchor) {
            return anchor;
        }
        long steps = (lower - anchor - 1) / everyMs + 1;
        try {
            return Math.addExact(anchor, Math.multiplyExact(steps, everyMs));
        } catch (ArithmeticException e) {
            // Next slot lies past the representable range
            return null;
        }
    }

    private static Long nextCron(CronSchedule schedule, long afterMs) {
        ZoneId zone = resolveZone(schedule.getTz());
        ZonedDateTime after = Instant.ofEpochMilli(afterMs).atZone(zone);
        ZonedDateTime earliest = null;
        for (CronExpression expression : parseExpression(schedule.getExpr())) {
            ZonedDateTime next = expression.next(after);
            if (next != null && (earliest == null || next.isBefore(earliest))) {
                earliest = next;
            }
        }
        return earliest != null ? earliest.toInstant().toEpochMilli() : null;
    }

    /**
     * Check that the schedule can be evaluated.
     *
     * @throws CronValidationException describing the first problem found
     */
    public static void validate(CronSchedule schedule) {
        if (schedule == null || schedule.getKind() == null) {
            throw new CronValidationException("schedule.kind is required (at, every or cron)");
        }
        switch (schedule.getKind()) {
            case AT -> {
                if (schedule.getAtMs() == null || schedule.getAtMs() <= 0) {
                    throw new CronValidationException("schedule.kind=\"at\" requires a positive atMs");
                }
            }
            case EVERY -> {
                if (schedule.getEveryMs() == null || schedule.getEveryMs() <= 0) {
                    throw new CronValidationException("schedule.kind=\"every\" requires a positive everyMs");
                }
                if (schedule.getAnchorMs() != null && schedule.getAnchorMs() < 0) {
                    throw new CronValidationException("schedule.anchorMs must not be negative");
                }
            }
            case CRON -> {
                try {
                    parseExpression(schedule.getExpr());
                    resolveZone(schedule.getTz());
                } catch (IllegalArgumentException e) {
                    throw new CronValidationException(e.getMessage(), e);
                }
            }
        }
    }

    static List<CronExpression> parseExpression(String expr) {
        if (expr == null || expr.isBlank()) {
            throw new IllegalArgumentException("schedule.kind=\"cron\" requires expr");
        }
        String normalized = expr.trim().replaceAll("\\s+", " ");
        String[] parts = normalized.split(" ");
        int fields = parts.length;
        if (fields != 5) {
            throw new IllegalArgumentException(
                    "invalid cron expr \"" + expr + "\": expected 5 fields, got " + fields);
        }
        return EXPRESSIONS.get(normalized, key -> {
            try {
                if (isRestricted(parts[2]) && isRestricted(parts[4])) {
                    String prefix = "0 " + parts[0] + " " + parts[1] + " ";
                    return List.of(
                            CronExpression.parse(prefix + parts[2] + " " + parts[3] + " ?"),
                            CronExpression.parse(prefix + "? " + parts[3] + " " + parts[4]));
                }
                return List.of(CronExpression.parse("0 " + key));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("invalid cron expr \"" + expr + "\": " + e.getMessage(), e);
            }
        });
    }

    /**
     * A day field counts as restricted unless it starts with {@code *} or is
     * {@code ?}.
     */
    private static boolean isRestricted(String field) {
        return !field.startsWith("*") && !field.equals("?");
    }

    static ZoneId resolveZone(String tz) {
        if (tz == null || tz.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(tz.trim());
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("unknown time zone: " + tz, e);
        }
    }
}

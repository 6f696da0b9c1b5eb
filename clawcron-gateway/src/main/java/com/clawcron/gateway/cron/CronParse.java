package com.clawcron.gateway.cron;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Absolute time parsing for one-shot schedules.
 */
public final class CronParse {

    private CronParse() {
    }

    private static final Pattern NUMERIC_RE = Pattern.compile("^\\d+$");
    private static final Pattern DATE_ONLY_RE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern ZONE_SUFFIX_RE = Pattern.compile("(Z|[+-]\\d{2}:?\\d{2})$", Pattern.CASE_INSENSITIVE);
    private static final Pattern COMPACT_OFFSET_RE = Pattern.compile("([+-]\\d{2})(\\d{2})$");

    /**
     * Parse an absolute time and return epoch milliseconds.
     * Accepts:
     * <ul>
     * <li>numeric strings, read as epoch ms</li>
     * <li>ISO-8601 dates ({@code 2026-01-01}, midnight UTC)</li>
     * <li>ISO-8601 date-times with or without offset (UTC when absent)</li>
     * </ul>
     *
     * @return epoch milliseconds, or null if the input is not a valid time
     */
    public static Long parseAbsoluteTimeMs(String input) {
        if (input == null)
            return null;
        String raw = input.trim();
        if (raw.isEmpty())
            return null;

        if (NUMERIC_RE.matcher(raw).matches()) {
            try {
                long n = Long.parseLong(raw);
                return n > 0 ? n : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }

        try {
            if (DATE_ONLY_RE.matcher(raw).matches()) {
                return LocalDate.parse(raw).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
            }
            if (ZONE_SUFFIX_RE.matcher(raw).find()) {
                return OffsetDateTime.parse(withColonOffset(raw.toUpperCase())).toInstant().toEpochMilli();
            }
            return LocalDateTime.parse(raw).toInstant(ZoneOffset.UTC).toEpochMilli();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /** {@code +0200} becomes {@code +02:00}. */
    static String withColonOffset(String raw) {
        Matcher m = COMPACT_OFFSET_RE.matcher(raw);
        if (raw.endsWith("Z") || !m.find()) {
            return raw;
        }
        return raw.substring(0, m.start()) + m.group(1) + ":" + m.group(2);
    }
}

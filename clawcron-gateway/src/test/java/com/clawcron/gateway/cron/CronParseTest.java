package com.clawcron.gateway.cron;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link CronParse}.
 */
class CronParseTest {

    private static final long JAN_1_2024_NOON_UTC = 1704110400000L;

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = { "   " })
    void parseAbsoluteTimeMs_blank_returnsNull(String input) {
        assertNull(CronParse.parseAbsoluteTimeMs(input));
    }

    @Test
    void parseAbsoluteTimeMs_numericEpochMs() {
        assertEquals(1704067200000L, CronParse.parseAbsoluteTimeMs("1704067200000"));
    }

    @Test
    void parseAbsoluteTimeMs_zeroReturnsNull() {
        assertNull(CronParse.parseAbsoluteTimeMs("0"));
    }

    @Test
    void parseAbsoluteTimeMs_dateOnly_isMidnightUtc() {
        assertEquals(1704067200000L, CronParse.parseAbsoluteTimeMs("2024-01-01"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "2024-01-01T12:00:00Z",
            "2024-01-01T12:00:00z",
            "2024-01-01T14:00:00+02:00",
            "2024-01-01T14:00:00+0200",
            "2024-01-01T07:00:00-05:00",
            "2024-01-01T12:00:00",
            "  2024-01-01T12:00:00Z  "
    })
    void parseAbsoluteTimeMs_isoDateTime(String input) {
        assertEquals(JAN_1_2024_NOON_UTC, CronParse.parseAbsoluteTimeMs(input));
    }

    @ParameterizedTest
    @ValueSource(strings = { "tomorrow", "2024-13-01", "2024-01-01T25:00:00Z", "12:00" })
    void parseAbsoluteTimeMs_invalid_returnsNull(String input) {
        assertNull(CronParse.parseAbsoluteTimeMs(input));
    }

    @Test
    void withColonOffset_insertsColon() {
        assertEquals("2024-01-01T14:00:00+02:00", CronParse.withColonOffset("2024-01-01T14:00:00+0200"));
        assertEquals("2024-01-01T14:00:00Z", CronParse.withColonOffset("2024-01-01T14:00:00Z"));
    }
}

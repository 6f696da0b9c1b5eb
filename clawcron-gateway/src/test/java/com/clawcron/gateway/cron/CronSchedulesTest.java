package com.clawcron.gateway.cron;

import com.clawcron.gateway.cron.CronTypes.CronSchedule;
import com.clawcron.gateway.cron.CronTypes.ScheduleKind;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link CronSchedules}.
 */
class CronSchedulesTest {

    private static final long NOON_UTC = Instant.parse("2024-01-01T12:00:00Z").toEpochMilli();

    @Nested
    class At {

        @Test
        void neverRun_returnsAtMs() {
            assertEquals(5_000L, CronSchedules.computeNextRunAtMs(CronSchedule.at(5_000L), 1_000, null, 0));
        }

        @Test
        void pastAtMs_isStillReturnedUntilItRuns() {
            assertEquals(5_000L, CronSchedules.computeNextRunAtMs(CronSchedule.at(5_000L), 9_000, null, 0));
        }

        @Test
        void alreadyRun_returnsNull() {
            assertNull(CronSchedules.computeNextRunAtMs(CronSchedule.at(5_000L), 1_000, 5_000L, 0));
        }
    }

    @Nested
    class Every {

        @Test
        void beforeAnchor_returnsAnchor() {
            assertEquals(100_000L, CronSchedules.computeNextRunAtMs(CronSchedule.every(60_000L, 100_000L), 0, null, 0));
        }

        @Test
        void atAnchor_returnsAnchor() {
            assertEquals(1_000L, CronSchedules.computeNextRunAtMs(CronSchedule.every(60_000L, 1_000L), 1_000, null, 0));
        }

        @Test
        void betweenSteps_roundsUpToNextAlignedInstant() {
            assertEquals(61_000L, CronSchedules.computeNextRunAtMs(CronSchedule.every(60_000L, 1_000L), 1_001, null, 0));
            assertEquals(61_000L, CronSchedules.computeNextRunAtMs(CronSchedule.every(60_000L, 1_000L), 61_000, null, 0));
        }

        @Test
        void afterRun_movesStrictlyPastLastRun() {
            assertEquals(121_000L,
                    CronSchedules.computeNextRunAtMs(CronSchedule.every(60_000L, 1_000L), 61_000, 61_000L, 0));
        }

        @Test
        void withoutAnchor_usesDefaultAnchor() {
            assertEquals(3_500L, CronSchedules.computeNextRunAtMs(CronSchedule.every(1_000L, null), 2_600, null, 500));
        }

        @Test
        void successiveRuns_stayAligned() {
            CronSchedule schedule = CronSchedule.every(7_000L, 3_000L);
            long now = 3_001;
            Long previous = null;
            for (int i = 0; i < 5; i++) {
                Long next = CronSchedules.computeNextRunAtMs(schedule, now, previous, 0);
                assertNotNull(next);
                assertEquals(0, (next - 3_000L) % 7_000L);
                if (previous != null) {
                    assertEquals(7_000L, next - previous);
                }
                previous = next;
                now = next;
            }
        }
    }

    @Nested
    class EveryOverflow {

        @Test
        void hugeInterval_returnsFirstSlot() {
            Long next = CronSchedules.computeNextRunAtMs(CronSchedule.every(Long.MAX_VALUE, 0L), NOON_UTC, null, 0);
            assertEquals(Long.MAX_VALUE, next);
        }

        @Test
        void slotPastRange_neverFires() {
            Long next = CronSchedules.computeNextRunAtMs(CronSchedule.every(Long.MAX_VALUE, 5L), NOON_UTC, null, 0);
            assertNull(next);
        }
    }

    @Nested
    class Cron {

        @Test
        void dailyUtc_returnsNextDay() {
            Long next = CronSchedules.computeNextRunAtMs(CronSchedule.cron("0 9 * * *", "UTC"), NOON_UTC, null, 0);
            assertEquals(Instant.parse("2024-01-02T09:00:00Z").toEpochMilli(), next);
        }

        @Test
        void evaluatesInTimeZone() {
            Long next = CronSchedules.computeNextRunAtMs(
                    CronSchedule.cron("0 9 * * *", "America/New_York"), NOON_UTC, null, 0);
            assertEquals(Instant.parse("2024-01-01T14:00:00Z").toEpochMilli(), next);
        }

        @Test
        void noTimeZone_usesSystemZone() {
            Long next = CronSchedules.computeNextRunAtMs(CronSchedule.cron("30 6 * * *", null), NOON_UTC, null, 0);
            ZonedDateTime local = Instant.ofEpochMilli(next).atZone(ZoneId.systemDefault());
            assertEquals(6, local.getHour());
            assertEquals(30, local.getMinute());
            assertTrue(next > NOON_UTC);
        }

        @Test
        void resultIsStrictlyAfterLastRun() {
            long nine = Instant.parse("2024-01-01T09:00:00Z").toEpochMilli();
            Long next = CronSchedules.computeNextRunAtMs(CronSchedule.cron("0 9 * * *", "UTC"), nine, nine, 0);
            assertEquals(Instant.parse("2024-01-02T09:00:00Z").toEpochMilli(), next);
        }

        @Test
        void extraWhitespaceIsAccepted() {
            Long next = CronSchedules.computeNextRunAtMs(CronSchedule.cron("  0   9 * *  * ", "UTC"), NOON_UTC, null, 0);
            assertEquals(Instant.parse("2024-01-02T09:00:00Z").toEpochMilli(), next);
        }

        @Test
        void dayOfMonthOrDayOfWeek_eitherMatches() {
            long tuesday = Instant.parse("2025-12-02T00:00:00Z").toEpochMilli();
            Long next = CronSchedules.computeNextRunAtMs(CronSchedule.cron("0 0 1 * 1", "UTC"), tuesday, null, 0);
            ZonedDateTime at = Instant.ofEpochMilli(next).atZone(ZoneOffset.UTC);
            assertEquals(DayOfWeek.MONDAY, at.getDayOfWeek());
            assertEquals(Instant.parse("2025-12-08T00:00:00Z").toEpochMilli(), next);
        }

        @Test
        void dayOfMonthOrDayOfWeek_dayOfMonthComesFirst() {
            long lateDecember = Instant.parse("2025-12-30T00:00:00Z").toEpochMilli();
            Long next = CronSchedules.computeNextRunAtMs(CronSchedule.cron("0 0 1 * 1", "UTC"), lateDecember, null, 0);
            // Thursday the 1st, before the next Monday (the 5th)
            assertEquals(Instant.parse("2026-01-01T00:00:00Z").toEpochMilli(), next);
        }

        @Test
        void fridayOrThirteenth_firesOnNextFriday() {
            Long next = CronSchedules.computeNextRunAtMs(CronSchedule.cron("0 0 13 * 5", "UTC"), NOON_UTC, null, 0);
            assertEquals(Instant.parse("2024-01-05T00:00:00Z").toEpochMilli(), next);
        }

        @Test
        void steppedDayOfWeek_countsAsUnrestricted() {
            Long next = CronSchedules.computeNextRunAtMs(CronSchedule.cron("0 0 13 * */2", "UTC"), NOON_UTC, null, 0);
            assertEquals(Instant.parse("2024-01-13T00:00:00Z").toEpochMilli(), next);
        }
    }

    @Nested
    class Validate {

        @Test
        void acceptsWellFormedSchedules() {
            assertDoesNotThrow(() -> CronSchedules.validate(CronSchedule.at(1L)));
            assertDoesNotThrow(() -> CronSchedules.validate(CronSchedule.every(1_000L, null)));
            assertDoesNotThrow(() -> CronSchedules.validate(CronSchedule.cron("*/5 * * * *", "Europe/Berlin")));
        }

        @Test
        void rejectsMissingKind() {
            assertThrows(CronValidationException.class, () -> CronSchedules.validate(new CronSchedule()));
        }

        @Test
        void rejectsAtWithoutAtMs() {
            var e = assertThrows(CronValidationException.class, () -> CronSchedules.validate(CronSchedule.builder().kind(ScheduleKind.AT).build()));
            assertTrue(e.getMessage().contains("atMs"));
        }

        @Test
        void rejectsNonPositiveEvery() {
            var e = assertThrows(CronValidationException.class,
                    () -> CronSchedules.validate(CronSchedule.every(0L, null)));
            assertTrue(e.getMessage().contains("everyMs"));
        }

        @Test
        void rejectsSixFieldExpression() {
            var e = assertThrows(CronValidationException.class,
                    () -> CronSchedules.validate(CronSchedule.cron("0 0 9 * * *", null)));
            assertTrue(e.getMessage().contains("expected 5 fields, got 6"), e.getMessage());
        }

        @Test
        void rejectsGarbageExpression() {
            assertThrows(CronValidationException.class,
                    () -> CronSchedules.validate(CronSchedule.cron("a b c d e", null)));
        }

        @Test
        void rejectsUnknownTimeZone() {
            var e = assertThrows(CronValidationException.class,
                    () -> CronSchedules.validate(CronSchedule.cron("0 9 * * *", "Mars/Olympus")));
            assertTrue(e.getMessage().contains("unknown time zone"), e.getMessage());
        }
    }
}

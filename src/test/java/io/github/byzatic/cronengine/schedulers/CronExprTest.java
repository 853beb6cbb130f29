package io.github.byzatic.cronengine.schedulers;

import org.junit.jupiter.api.Test;

import java.time.*;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CronExprTest {

    private static final ZoneId UTC = ZoneId.of("UTC");

    @Test
    void parsesFiveFields_defaultsSecondsToZero_andFindsNextMinute() {
        CronExpr expr = CronExpr.parse("* * * * *");
        Optional<Instant> next = expr.next(Instant.parse("2025-08-08T11:23:20Z"), UTC);
        assertEquals(Instant.parse("2025-08-08T11:24:00Z"), next.orElseThrow());
    }

    @Test
    void parsesSixFields_secondsStepEvery10s() {
        CronExpr expr = CronExpr.parse("*/10 * * * * *");
        Optional<Instant> next = expr.next(Instant.parse("2025-08-08T11:23:25Z"), UTC);
        assertEquals(Instant.parse("2025-08-08T11:23:30Z"), next.orElseThrow());
    }

    @Test
    void nextIsStrictlyAfterFrom() {
        CronExpr expr = CronExpr.parse("0 9 * * *");
        Instant nine = Instant.parse("2025-08-08T09:00:00Z");
        assertEquals(Instant.parse("2025-08-09T09:00:00Z"), expr.next(nine, UTC).orElseThrow());
    }

    @Test
    void weekdayStandup_skipsWeekend() {
        CronExpr expr = CronExpr.parse("0 9 * * 1-5");
        // 2025-08-08 is a Friday
        Instant afterFridayRun = Instant.parse("2025-08-08T09:30:00Z");
        assertEquals(Instant.parse("2025-08-11T09:00:00Z"), expr.next(afterFridayRun, UTC).orElseThrow());
    }

    @Test
    void respectsMonthDayHourMinuteSecondFilters() {
        CronExpr expr = CronExpr.parse("0 0 12 12 8 *");
        Optional<Instant> next = expr.next(Instant.parse("2025-08-08T00:00:00Z"), UTC);
        assertEquals(Instant.parse("2025-08-12T12:00:00Z"), next.orElseThrow());
    }

    @Test
    void restrictedDayOfMonthAndDayOfWeek_matchEither() {
        // the 1st of the month or any Monday
        CronExpr expr = CronExpr.parse("0 8 1 * 1");
        Instant friday = Instant.parse("2025-08-08T12:00:00Z");
        assertEquals(Instant.parse("2025-08-11T08:00:00Z"), expr.next(friday, UTC).orElseThrow());

        Instant lateAugust = Instant.parse("2025-08-26T12:00:00Z");
        assertEquals(Instant.parse("2025-09-01T08:00:00Z"), expr.next(lateAugust, UTC).orElseThrow());
    }

    @Test
    void dayOfWeekSeven_isSunday() {
        CronExpr seven = CronExpr.parse("0 10 * * 7");
        CronExpr zero = CronExpr.parse("0 10 * * 0");
        Instant from = Instant.parse("2025-08-08T00:00:00Z");
        assertEquals(Instant.parse("2025-08-10T10:00:00Z"), seven.next(from, UTC).orElseThrow());
        assertEquals(zero.next(from, UTC), seven.next(from, UTC));
    }

    @Test
    void listsRangesAndOffsetSteps() {
        CronExpr expr = CronExpr.parse("5/20 9,17 * * *");
        Instant from = Instant.parse("2025-08-08T09:30:00Z");
        assertEquals(Instant.parse("2025-08-08T09:45:00Z"), expr.next(from, UTC).orElseThrow());
        assertEquals(Instant.parse("2025-08-08T17:05:00Z"),
                expr.next(Instant.parse("2025-08-08T09:45:00Z"), UTC).orElseThrow());
    }

    @Test
    void evaluatesInTheJobTimezone() {
        CronExpr expr = CronExpr.parse("0 9 * * *");
        Instant from = Instant.parse("2025-08-08T00:00:00Z");
        // 09:00 in New York during daylight saving time is 13:00 UTC
        assertEquals(Instant.parse("2025-08-08T13:00:00Z"),
                expr.next(from, ZoneId.of("America/New_York")).orElseThrow());
    }

    @Test
    void clocksGoBack_repeatedHourFiresOnce() {
        ZoneId ny = ZoneId.of("America/New_York");
        CronExpr expr = CronExpr.parse("30 1 * * *");
        Instant firstPass = OffsetDateTime.parse("2024-11-03T01:30-04:00").toInstant();

        assertEquals(OffsetDateTime.parse("2024-11-04T01:30-05:00").toInstant(),
                expr.next(firstPass, ny).orElseThrow());
        // starting inside the repeated hour before the slot still waits for the next day
        Instant repeatedHour = OffsetDateTime.parse("2024-11-03T01:10-05:00").toInstant();
        assertEquals(OffsetDateTime.parse("2024-11-04T01:30-05:00").toInstant(),
                expr.next(repeatedHour, ny).orElseThrow());
    }

    @Test
    void clocksGoForward_slotInSkippedHourFiresShifted() {
        ZoneId ny = ZoneId.of("America/New_York");
        CronExpr expr = CronExpr.parse("30 2 * * *");
        Instant from = OffsetDateTime.parse("2024-03-09T12:00-05:00").toInstant();

        Instant gapDay = expr.next(from, ny).orElseThrow();
        assertEquals(OffsetDateTime.parse("2024-03-10T03:30-04:00").toInstant(), gapDay);
        assertEquals(OffsetDateTime.parse("2024-03-11T02:30-04:00").toInstant(),
                expr.next(gapDay, ny).orElseThrow());
    }

    @Test
    void impossibleDate_hasNoFutureFireTime() {
        CronExpr expr = CronExpr.parse("0 0 30 2 *");
        assertTrue(expr.next(Instant.parse("2025-01-01T00:00:00Z"), UTC).isEmpty());
    }

    @Test
    void malformedExpressions_areRejected() {
        assertThrows(IllegalArgumentException.class, () -> CronExpr.parse("* * * *"));
        assertThrows(IllegalArgumentException.class, () -> CronExpr.parse("* * * * * * *"));
        assertThrows(IllegalArgumentException.class, () -> CronExpr.parse("61 * * * *"));
        assertThrows(IllegalArgumentException.class, () -> CronExpr.parse("*/0 * * * *"));
        assertThrows(IllegalArgumentException.class, () -> CronExpr.parse("5-1 * * * *"));
        assertThrows(IllegalArgumentException.class, () -> CronExpr.parse("a * * * *"));
        assertThrows(IllegalArgumentException.class, () -> CronExpr.parse("0 0 0 * *"));
    }

    @Test
    void toString_returnsSourceExpression() {
        assertEquals("0 9 * * 1-5", CronExpr.parse("  0 9 * * 1-5 ").toString());
    }
}

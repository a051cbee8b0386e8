package com.taskdeck.scheduler.schedule;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class CronSchedulesTest {

    @Test
    void nextRun_isStrictlyAfterReference() {
        Instant at = Instant.parse("2025-03-03T09:00:00Z");

        assertEquals(Instant.parse("2025-03-04T09:00:00Z"), CronSchedules.nextRun("0 9 * * *", "UTC", at));
        assertEquals(Instant.parse("2025-03-03T09:00:00Z"),
                CronSchedules.nextRun("0 9 * * *", "UTC", at.minusSeconds(1)));
    }

    @Test
    void nextRun_followsJobTimezone() {
        Instant at = Instant.parse("2025-03-03T00:00:00Z");

        // 09:00 in New York (EST, UTC-5)
        assertEquals(Instant.parse("2025-03-03T14:00:00Z"),
                CronSchedules.nextRun("0 9 * * *", "America/New_York", at));
    }

    @Test
    void unknownTimezone_fallsBackToUtc() {
        Instant at = Instant.parse("2025-03-03T00:00:00Z");

        assertEquals(Instant.parse("2025-03-03T09:00:00Z"), CronSchedules.nextRun("0 9 * * *", "Mars/Olympus", at));
    }

    @ParameterizedTest
    @ValueSource(strings = { "", "not a cron", "61 * * * *", "* * * *" })
    void invalidExpressions_areRejected(String expression) {
        assertFalse(CronSchedules.isValid(expression));
        assertThrows(IllegalArgumentException.class, () -> CronSchedules.parse(expression));
    }

    @Test
    void weekdayExpression_isValid() {
        assertTrue(CronSchedules.isValid("30 8 * * 1-5"));
    }
}

package com.taskdeck.scheduler.schedule;

import com.taskdeck.scheduler.model.JobTypes.ScheduleType;
import com.taskdeck.scheduler.model.ScheduledJob;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleTimesTest {

    @Test
    void parseAbsoluteTime_acceptsIsoAndEpochMillis() {
        assertEquals(Instant.parse("2025-03-01T10:00:00Z"), ScheduleTimes.parseAbsoluteTime("2025-03-01T10:00:00Z"));
        assertEquals(Instant.parse("2025-03-01T09:00:00Z"),
                ScheduleTimes.parseAbsoluteTime("2025-03-01T10:00:00+01:00"));
        assertEquals(Instant.parse("2025-03-01T10:00:00Z"), ScheduleTimes.parseAbsoluteTime("2025-03-01T10:00:00"));
        assertEquals(Instant.parse("2025-03-01T00:00:00Z"), ScheduleTimes.parseAbsoluteTime("2025-03-01"));
        assertEquals(Instant.ofEpochMilli(1740823200000L), ScheduleTimes.parseAbsoluteTime("1740823200000"));
    }

    @Test
    void parseAbsoluteTime_returnsNullOnGarbage() {
        assertNull(ScheduleTimes.parseAbsoluteTime(null));
        assertNull(ScheduleTimes.parseAbsoluteTime("  "));
        assertNull(ScheduleTimes.parseAbsoluteTime("tomorrow at nine"));
        assertNull(ScheduleTimes.parseAbsoluteTime("0"));
    }

    @Test
    void advanceCron_skipsMissedSlots() {
        ScheduledJob job = ScheduledJob.builder()
                .scheduleType(ScheduleType.CRON)
                .cronExpression("0 * * * *")
                .timezone("UTC")
                .nextRunAt(Instant.parse("2025-03-01T06:00:00Z"))
                .build();

        Instant next = ScheduleTimes.advanceCron(job, Instant.parse("2025-03-01T09:30:00Z"));

        assertEquals(Instant.parse("2025-03-01T10:00:00Z"), next);
    }

    @Test
    void initialNextRun_usesRunAtForOnceJobs() {
        Instant runAt = Instant.parse("2025-04-01T12:00:00Z");
        ScheduledJob job = ScheduledJob.builder().scheduleType(ScheduleType.ONCE).runAt(runAt).build();

        assertEquals(runAt, ScheduleTimes.initialNextRun(job, Instant.parse("2025-03-01T00:00:00Z")));
    }
}

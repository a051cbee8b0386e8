package com.taskdeck.scheduler.schedule;

import com.taskdeck.scheduler.model.JobTypes.ScheduleType;
import com.taskdeck.scheduler.model.ScheduledJob;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * Absolute-time parsing and due-time arithmetic for scheduled jobs.
 */
public final class ScheduleTimes {

    private ScheduleTimes() {
    }

    private static final Pattern ISO_TZ_RE = Pattern.compile("(Z|[+-]\\d{2}:\\d{2})$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ISO_DATE_RE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern ISO_DATE_TIME_RE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}T");
    private static final Pattern NUMERIC_RE = Pattern.compile("^\\d+$");

    /**
     * Normalize a date string to a UTC ISO-8601 string.
     * Date-only input becomes midnight UTC; a date-time without offset is
     * read as UTC.
     */
    static String normalizeUtcIso(String raw) {
        if (ISO_TZ_RE.matcher(raw).find())
            return raw;
        if (ISO_DATE_RE.matcher(raw).matches())
            return raw + "T00:00:00Z";
        if (ISO_DATE_TIME_RE.matcher(raw).find())
            return raw + "Z";
        return raw;
    }

    /**
     * Parse an absolute time: epoch milliseconds or an ISO-8601 date/date-time.
     *
     * @return the instant, or null if parsing fails
     */
    public static Instant parseAbsoluteTime(String input) {
        if (input == null)
            return null;
        String raw = input.trim();
        if (raw.isEmpty())
            return null;

        if (NUMERIC_RE.matcher(raw).matches()) {
            try {
                long n = Long.parseLong(raw);
                return n > 0 ? Instant.ofEpochMilli(n) : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }

        try {
            return OffsetDateTime.parse(normalizeUtcIso(raw)).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * Initial due time of a job: {@code runAt} for once jobs, the first cron
     * occurrence after {@code now} otherwise.
     */
    public static Instant initialNextRun(ScheduledJob job, Instant now) {
        if (job.getScheduleType() == ScheduleType.CRON) {
            return CronSchedules.nextRun(job.getCronExpression(), job.getTimezone(), now);
        }
        return job.getRunAt();
    }

    /**
     * Next due time of a cron job after an execution that happened at
     * {@code now}. Slots missed while the job was not running are skipped.
     */
    public static Instant advanceCron(ScheduledJob job, Instant now) {
        Instant from = job.getNextRunAt() != null && job.getNextRunAt().isAfter(now) ? job.getNextRunAt() : now;
        return CronSchedules.nextRun(job.getCronExpression(), job.getTimezone(), from);
    }
}

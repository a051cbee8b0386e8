package com.taskdeck.scheduler.schedule;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Next-occurrence math for five-field UNIX cron descriptors.
 */
public final class CronSchedules {

    private static final CronParser PARSER = new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    private CronSchedules() {
    }

    /**
     * Parse and validate a cron descriptor.
     *
     * @throws IllegalArgumentException when the expression is invalid
     */
    public static Cron parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Cron expression is required");
        }
        try {
            Cron cron = PARSER.parse(expression.trim());
            cron.validate();
            return cron;
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid cron expression '" + expression + "': " + e.getMessage(), e);
        }
    }

    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * First occurrence strictly after {@code after}, evaluated in the given
     * IANA zone (UTC when null or unknown).
     */
    public static Instant nextRun(String expression, String timezone, Instant after) {
        ZonedDateTime from = after.atZone(resolveZone(timezone));
        Optional<ZonedDateTime> next = ExecutionTime.forCron(parse(expression)).nextExecution(from);
        return next.map(ZonedDateTime::toInstant)
                .orElseThrow(() -> new IllegalArgumentException("Cron expression has no future run: " + expression));
    }

    static ZoneId resolveZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            return ZoneOffset.UTC;
        }
    }
}

package com.taskdeck.scheduler.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Enumerations shared by scheduled jobs and their executions.
 *
 * <p>
 * Every enum persists as its lowercase key ({@code "follow_up"},
 * {@code "agent_task"}) and parses case-insensitively.
 * </p>
 */
public final class JobTypes {

    private JobTypes() {
    }

    // =========================================================================
    // Job classification
    // =========================================================================

    public enum JobType {
        REMINDER, FOLLOW_UP, RECURRING, ONE_TIME;

        @JsonValue
        public String key() {
            return name().toLowerCase();
        }

        @JsonCreator
        public static JobType fromKey(String key) {
            return parse(JobType.class, key);
        }
    }

    public enum ScheduleType {
        ONCE, CRON;

        @JsonValue
        public String key() {
            return name().toLowerCase();
        }

        @JsonCreator
        public static ScheduleType fromKey(String key) {
            return parse(ScheduleType.class, key);
        }
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    public enum JobStatus {
        ACTIVE, PAUSED, COMPLETED, CANCELLED;

        @JsonValue
        public String key() {
            return name().toLowerCase();
        }

        @JsonCreator
        public static JobStatus fromKey(String key) {
            return parse(JobStatus.class, key);
        }
    }

    /** In-flight state mirrored on the job row while a runner holds it. */
    public enum AgentRunState {
        IDLE, RUNNING, FAILED;

        @JsonValue
        public String key() {
            return name().toLowerCase();
        }

        @JsonCreator
        public static AgentRunState fromKey(String key) {
            return parse(AgentRunState.class, key);
        }
    }

    public enum ExecutionStatus {
        RUNNING, SUCCESS, FAILED;

        @JsonValue
        public String key() {
            return name().toLowerCase();
        }

        @JsonCreator
        public static ExecutionStatus fromKey(String key) {
            return parse(ExecutionStatus.class, key);
        }
    }

    /** Selection priority. A job without one sorts as {@link #MEDIUM}. */
    public enum Priority {
        HIGH, MEDIUM, LOW;

        @JsonValue
        public String key() {
            return name().toLowerCase();
        }

        @JsonCreator
        public static Priority fromKey(String key) {
            return parse(Priority.class, key);
        }

        public static int rank(Priority priority) {
            return (priority != null ? priority : MEDIUM).ordinal();
        }
    }

    /**
     * Parse a lowercase key into an enum constant.
     *
     * @return the constant, or null for a null, blank or unknown key
     */
    static <E extends Enum<E>> E parse(Class<E> type, String key) {
        if (key == null || key.isBlank())
            return null;
        String normalized = key.trim().toUpperCase().replace('-', '_');
        for (E value : type.getEnumConstants()) {
            if (value.name().equals(normalized))
                return value;
        }
        return null;
    }
}

package com.taskdeck.scheduler.model;

import com.taskdeck.scheduler.model.JobTypes.AgentRunState;
import com.taskdeck.scheduler.model.JobTypes.JobStatus;
import com.taskdeck.scheduler.model.JobTypes.JobType;
import com.taskdeck.scheduler.model.JobTypes.Priority;
import com.taskdeck.scheduler.model.JobTypes.ScheduleType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A unit of deferred or recurring work owned by one agent.
 *
 * <p>
 * {@code nextRunAt} is the authoritative due time. {@code lockExpiresAt} is
 * the lease: while it lies in the future exactly one workflow runner owns the
 * job.
 * </p>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledJob {
    private String id;
    private String agentId;
    private String title;
    private String description;

    private JobType jobType;
    /** "notify" | "agent_task" | "webhook"; unknown values fail at dispatch. */
    private String actionType;
    @Builder.Default
    private Map<String, Object> actionPayload = new LinkedHashMap<>();

    // --- Schedule ---
    private ScheduleType scheduleType;
    private Instant runAt;
    private String cronExpression;
    private Instant nextRunAt;
    private String timezone;

    // --- Lease ---
    private Instant lockExpiresAt;
    private Instant lastLockAt;
    @Builder.Default
    private AgentRunState agentRunState = AgentRunState.IDLE;

    // --- Lifecycle ---
    @Builder.Default
    private JobStatus status = JobStatus.ACTIVE;
    private int consecutiveFailures;
    private String failureReason;
    private String lastExecutionId;

    // --- Links ---
    private String taskId;
    private String projectId;
    private String conversationId;
    private Priority priority;

    // --- Run limits ---
    private Integer maxRuns;
    private int runCount;
    private Instant lastRunAt;

    private Instant createdAt;
    private Instant updatedAt;

    /** Lease is free when unset or expired. */
    public boolean isLeaseFree(Instant now) {
        return lockExpiresAt == null || !lockExpiresAt.isAfter(now);
    }

    /** Active, scheduled at or before {@code now}, and not leased. */
    public boolean isDueAt(Instant now) {
        return status == JobStatus.ACTIVE
                && nextRunAt != null
                && !nextRunAt.isAfter(now)
                && isLeaseFree(now);
    }

    public ScheduledJob copy() {
        return toBuilder()
                .actionPayload(actionPayload != null ? new LinkedHashMap<>(actionPayload) : new LinkedHashMap<>())
                .build();
    }
}

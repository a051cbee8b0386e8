package com.taskdeck.scheduler;

import com.taskdeck.scheduler.action.ActionKind;
import com.taskdeck.scheduler.action.ActionPayload;
import com.taskdeck.scheduler.model.JobExecution;
import com.taskdeck.scheduler.model.JobTypes.AgentRunState;
import com.taskdeck.scheduler.model.JobTypes.JobStatus;
import com.taskdeck.scheduler.model.JobTypes.JobType;
import com.taskdeck.scheduler.model.JobTypes.ScheduleType;
import com.taskdeck.scheduler.model.ScheduledJob;
import com.taskdeck.scheduler.schedule.CronSchedules;
import com.taskdeck.scheduler.schedule.ScheduleTimes;
import com.taskdeck.scheduler.store.JobStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Creates and manages scheduled jobs on behalf of users and agent tools.
 *
 * <p>
 * Validation failures throw {@link IllegalArgumentException}; transitions not
 * allowed from the job's current status throw {@link IllegalStateException}.
 * Lookups of unknown jobs return empty.
 * </p>
 */
@Slf4j
public class ScheduledJobService {

    private final JobStore store;
    private final String defaultTimezone;
    private final Clock clock;

    public ScheduledJobService(JobStore store, String defaultTimezone, Clock clock) {
        this.store = store;
        this.defaultTimezone = defaultTimezone != null ? defaultTimezone : "UTC";
        this.clock = clock;
    }

    // --- Create ---

    public ScheduledJob createJob(JobRequest request) {
        require(request.getAgentId(), "agentId");
        require(request.getTitle(), "title");
        ActionKind kind = ActionKind.fromKey(request.getActionType());
        if (kind == null) {
            throw new IllegalArgumentException("Unknown action type: " + request.getActionType());
        }
        if (kind == ActionKind.WEBHOOK
                && ((ActionPayload.WebhookPayload) ActionPayload.from(kind, request.getActionPayload())).url() == null) {
            throw new IllegalArgumentException("No webhook URL specified");
        }

        boolean hasRunAt = request.getRunAt() != null;
        boolean hasCron = request.getCronExpression() != null && !request.getCronExpression().isBlank();
        if (hasRunAt == hasCron) {
            throw new IllegalArgumentException(hasRunAt
                    ? "Provide only one of 'runAt' or 'cronExpression'"
                    : "Must provide either 'runAt' for one-time or 'cronExpression' for recurring jobs");
        }
        if (hasCron) {
            CronSchedules.parse(request.getCronExpression());
        }
        if (request.getMaxRuns() != null && request.getMaxRuns() < 1) {
            throw new IllegalArgumentException("maxRuns must be at least 1");
        }

        Instant now = clock.instant();
        ScheduledJob job = ScheduledJob.builder()
                .agentId(request.getAgentId())
                .title(request.getTitle().trim())
                .description(request.getDescription())
                .jobType(request.getJobType() != null ? request.getJobType()
                        : hasCron ? JobType.RECURRING : JobType.ONE_TIME)
                .actionType(kind.key())
                .actionPayload(request.getActionPayload() != null
                        ? new LinkedHashMap<>(request.getActionPayload())
                        : new LinkedHashMap<>())
                .scheduleType(hasCron ? ScheduleType.CRON : ScheduleType.ONCE)
                .runAt(request.getRunAt())
                .cronExpression(hasCron ? request.getCronExpression().trim() : null)
                .timezone(request.getTimezone() != null ? request.getTimezone() : defaultTimezone)
                .taskId(request.getTaskId())
                .projectId(request.getProjectId())
                .conversationId(request.getConversationId())
                .priority(request.getPriority())
                .maxRuns(request.getMaxRuns())
                .status(JobStatus.ACTIVE)
                .agentRunState(AgentRunState.IDLE)
                .createdAt(now)
                .updatedAt(now)
                .build();
        job.setNextRunAt(ScheduleTimes.initialNextRun(job, now));

        ScheduledJob created = store.createJob(job);
        log.info("Scheduled {} job {} '{}' for agent {} (next run {})",
                created.getActionType(), created.getId(), created.getTitle(), created.getAgentId(),
                created.getNextRunAt());
        return created;
    }

    public ScheduledJob scheduleReminder(String agentId, String title, String message, Instant runAt,
            String cronExpression, String taskId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("message", message);
        if (taskId != null)
            payload.put("taskId", taskId);
        return createJob(JobRequest.builder()
                .agentId(agentId)
                .title(title)
                .description(message)
                .jobType(taskId != null ? JobType.FOLLOW_UP : null)
                .actionType(ActionKind.NOTIFY.key())
                .actionPayload(payload)
                .runAt(runAt)
                .cronExpression(cronExpression)
                .taskId(taskId)
                .build());
    }

    public ScheduledJob scheduleAgentTask(String agentId, String title, String instruction, Instant runAt,
            String cronExpression, String taskId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("instruction", instruction);
        if (taskId != null)
            payload.put("taskId", taskId);
        return createJob(JobRequest.builder()
                .agentId(agentId)
                .title(title)
                .description(instruction)
                .actionType(ActionKind.AGENT_TASK.key())
                .actionPayload(payload)
                .runAt(runAt)
                .cronExpression(cronExpression)
                .taskId(taskId)
                .build());
    }

    // --- Read ---

    public Optional<ScheduledJob> getJob(String jobId) {
        return store.getJob(jobId);
    }

    public List<ScheduledJob> listJobs(String agentId, JobStatus status, JobType jobType) {
        return store.listJobs(agentId, status, jobType);
    }

    public List<JobExecution> listExecutions(String jobId, int limit) {
        return store.listExecutions(jobId, limit);
    }

    // --- Lifecycle ---

    public Optional<ScheduledJob> cancel(String jobId) {
        return transition(jobId, "cancel", job -> job.getStatus() == JobStatus.ACTIVE
                || job.getStatus() == JobStatus.PAUSED,
                job -> job.setStatus(JobStatus.CANCELLED));
    }

    public Optional<ScheduledJob> pause(String jobId) {
        return transition(jobId, "pause", job -> job.getStatus() == JobStatus.ACTIVE,
                job -> job.setStatus(JobStatus.PAUSED));
    }

    /**
     * Put a paused job back into rotation with a clean failure record. A cron
     * job whose slot has passed moves to its next slot.
     */
    public Optional<ScheduledJob> reactivate(String jobId) {
        Instant now = clock.instant();
        return transition(jobId, "reactivate", job -> job.getStatus() == JobStatus.PAUSED, job -> {
            job.setStatus(JobStatus.ACTIVE);
            job.setConsecutiveFailures(0);
            job.setFailureReason(null);
            job.setAgentRunState(AgentRunState.IDLE);
            if (job.getScheduleType() == ScheduleType.CRON
                    && (job.getNextRunAt() == null || job.getNextRunAt().isBefore(now))) {
                job.setNextRunAt(CronSchedules.nextRun(job.getCronExpression(), job.getTimezone(), now));
            }
        });
    }

    /**
     * Change title, schedule or active/paused status of a job.
     */
    public Optional<ScheduledJob> update(String jobId, JobUpdate update) {
        if (update.getRunAt() != null && update.getCronExpression() != null) {
            throw new IllegalArgumentException("Provide only one of 'runAt' or 'cronExpression'");
        }
        if (update.getCronExpression() != null) {
            CronSchedules.parse(update.getCronExpression());
        }
        if (update.getStatus() != null && update.getStatus() != JobStatus.ACTIVE
                && update.getStatus() != JobStatus.PAUSED) {
            throw new IllegalArgumentException("Status can only be set to active or paused");
        }
        Instant now = clock.instant();
        return transition(jobId, "update", job -> job.getStatus() == JobStatus.ACTIVE
                || job.getStatus() == JobStatus.PAUSED, job -> {
                    if (update.getTitle() != null && !update.getTitle().isBlank()) {
                        job.setTitle(update.getTitle().trim());
                    }
                    if (update.getRunAt() != null) {
                        job.setScheduleType(ScheduleType.ONCE);
                        job.setRunAt(update.getRunAt());
                        job.setCronExpression(null);
                        job.setNextRunAt(update.getRunAt());
                    }
                    if (update.getCronExpression() != null) {
                        job.setScheduleType(ScheduleType.CRON);
                        job.setCronExpression(update.getCronExpression().trim());
                        job.setRunAt(null);
                        job.setNextRunAt(CronSchedules.nextRun(job.getCronExpression(), job.getTimezone(), now));
                    }
                    if (update.getStatus() == JobStatus.ACTIVE && job.getStatus() == JobStatus.PAUSED) {
                        job.setConsecutiveFailures(0);
                        job.setFailureReason(null);
                    }
                    if (update.getStatus() != null) {
                        job.setStatus(update.getStatus());
                    }
                });
    }

    private Optional<ScheduledJob> transition(String jobId, String action,
            Predicate<ScheduledJob> allowed, Consumer<ScheduledJob> mutation) {
        Optional<ScheduledJob> current = store.getJob(jobId);
        if (current.isEmpty()) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        Optional<ScheduledJob> updated = store.compareAndUpdate(jobId, allowed, job -> {
            mutation.accept(job);
            job.setUpdatedAt(now);
        });
        if (updated.isEmpty()) {
            ScheduledJob latest = store.getJob(jobId).orElse(current.get());
            throw new IllegalStateException("Cannot " + action + " job " + jobId + " in status "
                    + latest.getStatus().key());
        }
        log.info("Job {}: {} -> {}", jobId, action, updated.get().getStatus().key());
        return updated;
    }

    private static void require(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " required");
        }
    }
}

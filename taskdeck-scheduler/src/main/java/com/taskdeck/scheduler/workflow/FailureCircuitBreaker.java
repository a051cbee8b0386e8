package com.taskdeck.scheduler.workflow;

import com.taskdeck.scheduler.model.JobTypes.JobStatus;
import com.taskdeck.scheduler.model.JobTypes.ScheduleType;
import com.taskdeck.scheduler.model.ScheduledJob;
import com.taskdeck.scheduler.schedule.ScheduleTimes;
import com.taskdeck.scheduler.store.JobStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Counts consecutive failed executions per job and pauses the job once the
 * count reaches the threshold.
 */
@Slf4j
public class FailureCircuitBreaker {

    public static final int DEFAULT_THRESHOLD = 3;

    private final JobStore store;
    private final int threshold;
    private final Clock clock;

    public FailureCircuitBreaker(JobStore store, int threshold, Clock clock) {
        if (threshold < 1) {
            throw new IllegalArgumentException("Failure threshold must be at least 1");
        }
        this.store = store;
        this.threshold = threshold;
        this.clock = clock;
    }

    public int getThreshold() {
        return threshold;
    }

    /**
     * Record a failed execution. Applied at most once per execution id.
     *
     * <p>
     * Below the threshold an active cron job moves on to its next slot and a
     * once job keeps its due time, so the next cycle retries it. At the
     * threshold the job is paused and keeps its due time.
     * </p>
     */
    public BreakerOutcome recordFailure(String jobId, String executionId, String error) {
        Instant now = clock.instant();
        Optional<ScheduledJob> updated = store.compareAndUpdate(jobId,
                job -> !executionId.equals(job.getLastExecutionId()),
                job -> {
                    int failures = job.getConsecutiveFailures() + 1;
                    job.setConsecutiveFailures(failures);
                    job.setFailureReason(error);
                    job.setLastExecutionId(executionId);
                    job.setUpdatedAt(now);
                    if (job.getStatus() != JobStatus.ACTIVE) {
                        return;
                    }
                    if (failures >= threshold) {
                        job.setStatus(JobStatus.PAUSED);
                    } else if (job.getScheduleType() == ScheduleType.CRON) {
                        advance(job, now);
                    }
                });

        if (updated.isEmpty()) {
            log.debug("Failure of execution {} already recorded on job {}", executionId, jobId);
            return new BreakerOutcome(false, currentFailures(jobId), false);
        }
        ScheduledJob job = updated.get();
        boolean paused = job.getStatus() == JobStatus.PAUSED && job.getConsecutiveFailures() >= threshold;
        if (paused) {
            log.info("Job {} paused after {} consecutive failures: {}", jobId, job.getConsecutiveFailures(), error);
        } else {
            log.info("Job {} failed ({}/{}): {}", jobId, job.getConsecutiveFailures(), threshold, error);
        }
        return new BreakerOutcome(true, job.getConsecutiveFailures(), paused);
    }

    private static void advance(ScheduledJob job, Instant now) {
        try {
            job.setNextRunAt(ScheduleTimes.advanceCron(job, now));
        } catch (IllegalArgumentException e) {
            job.setStatus(JobStatus.PAUSED);
            job.setFailureReason(e.getMessage());
        }
    }

    private int currentFailures(String jobId) {
        return store.getJob(jobId).map(ScheduledJob::getConsecutiveFailures).orElse(0);
    }

    /**
     * @param applied             false when this execution was already counted
     * @param consecutiveFailures counter after the call
     * @param paused              true when this call tripped the breaker
     */
    public record BreakerOutcome(boolean applied, int consecutiveFailures, boolean paused) {
    }
}

package com.taskdeck.scheduler.store;

import com.taskdeck.scheduler.model.JobExecution;
import com.taskdeck.scheduler.model.JobTypes.AgentRunState;
import com.taskdeck.scheduler.model.JobTypes.JobStatus;
import com.taskdeck.scheduler.model.JobTypes.JobType;
import com.taskdeck.scheduler.model.JobTypes.Priority;
import com.taskdeck.scheduler.model.ScheduledJob;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Persistent table of scheduled jobs and their executions.
 *
 * <p>
 * Pure data access. Every change to lease, status or failure fields goes
 * through {@link #compareAndUpdate}, which tests and mutates one job row as a
 * single atomic step. Implementations return copies; mutating a returned
 * object never changes stored state.
 * </p>
 *
 * <p>
 * All methods may throw {@link JobStoreException}.
 * </p>
 */
public interface JobStore {

    /** Selection order for due jobs: priority high to low, then oldest first. */
    Comparator<ScheduledJob> DUE_ORDER = Comparator
            .comparingInt((ScheduledJob j) -> Priority.rank(j.getPriority()))
            .thenComparing(ScheduledJob::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()));

    // --- Jobs ---

    ScheduledJob createJob(ScheduledJob job);

    Optional<ScheduledJob> getJob(String jobId);

    /**
     * List jobs, newest first. Null filters match everything.
     */
    List<ScheduledJob> listJobs(String agentId, JobStatus status, JobType jobType);

    /**
     * Up to {@code limit} jobs due at {@code now}, in {@link #DUE_ORDER}.
     */
    List<ScheduledJob> listDueJobs(int limit, Instant now);

    /**
     * Apply {@code mutation} to the job if, and only if, its current state
     * satisfies {@code expectation}. Test and write are one atomic step.
     *
     * @return the updated job, or empty when the job is missing or the
     *         expectation failed
     */
    Optional<ScheduledJob> compareAndUpdate(String jobId, Predicate<ScheduledJob> expectation,
            Consumer<ScheduledJob> mutation);

    default Optional<ScheduledJob> updateJob(String jobId, Consumer<ScheduledJob> mutation) {
        return compareAndUpdate(jobId, job -> true, mutation);
    }

    /**
     * Claim the lease on a due job.
     *
     * @return the claimed job, or empty when the job is not due or another
     *         runner holds an unexpired lease
     */
    default Optional<ScheduledJob> claimLease(String jobId, Duration leaseDuration, Instant now) {
        return compareAndUpdate(jobId, job -> job.isDueAt(now), job -> {
            job.setLockExpiresAt(now.plus(leaseDuration));
            job.setLastLockAt(now);
            job.setAgentRunState(AgentRunState.RUNNING);
            job.setUpdatedAt(now);
        });
    }

    /**
     * Release a lease taken at {@code claimedAt}. A lease that has since been
     * re-claimed by another runner is left alone.
     */
    default boolean releaseLease(String jobId, Instant claimedAt, AgentRunState state, Instant now) {
        return compareAndUpdate(jobId, job -> claimedAt.equals(job.getLastLockAt()), job -> {
            job.setLockExpiresAt(null);
            job.setAgentRunState(state);
            job.setUpdatedAt(now);
        }).isPresent();
    }

    /**
     * Record that a job could not be handed to a runner. A job whose lease
     * another runner holds meanwhile is left alone.
     *
     * @return true when the job was marked
     */
    default boolean markDispatchFailed(String jobId, String reason, Instant now) {
        return compareAndUpdate(jobId, job -> job.isLeaseFree(now), job -> {
            job.setAgentRunState(AgentRunState.FAILED);
            job.setFailureReason(reason);
            job.setUpdatedAt(now);
        }).isPresent();
    }

    // --- Executions ---

    JobExecution createExecution(JobExecution execution);

    Optional<JobExecution> getExecution(String executionId);

    JobExecution updateExecution(JobExecution execution);

    /**
     * The latest execution of a job whose workflow has not applied its
     * outcome to the job yet.
     */
    Optional<JobExecution> findUnfinishedExecution(String jobId, String outcomeStep);

    /** Executions of a job, newest first. */
    List<JobExecution> listExecutions(String jobId, int limit);
}

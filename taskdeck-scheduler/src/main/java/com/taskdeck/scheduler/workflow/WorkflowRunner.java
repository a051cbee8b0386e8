package com.taskdeck.scheduler.workflow;

import com.taskdeck.scheduler.action.ActionContext;
import com.taskdeck.scheduler.action.ActionDispatcher;
import com.taskdeck.scheduler.action.ActionResult;
import com.taskdeck.scheduler.model.JobExecution;
import com.taskdeck.scheduler.model.JobTypes.AgentRunState;
import com.taskdeck.scheduler.model.JobTypes.ExecutionStatus;
import com.taskdeck.scheduler.model.JobTypes.JobStatus;
import com.taskdeck.scheduler.model.JobTypes.ScheduleType;
import com.taskdeck.scheduler.model.ScheduledJob;
import com.taskdeck.scheduler.schedule.ScheduleTimes;
import com.taskdeck.scheduler.store.JobStore;
import com.taskdeck.scheduler.store.JobStoreException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Executes one job as a sequence of checkpointed steps.
 *
 * <ol>
 * <li>claim the lease and open the execution record</li>
 * <li>{@value #STEP_DISPATCH}: run the action, memoizing its result</li>
 * <li>{@value #STEP_RECORD}: move the execution to its terminal status</li>
 * <li>{@value #STEP_OUTCOME}: mark the job executed, or hand the failure to
 * the circuit breaker</li>
 * </ol>
 *
 * <p>
 * Each step is recorded in {@link JobExecution#getCompletedSteps()} once its
 * effect is durable. A runner entering a job whose last execution never
 * reached {@value #STEP_OUTCOME} resumes that execution and skips the
 * completed steps.
 * </p>
 */
@Slf4j
public class WorkflowRunner {

    public static final String STEP_CREATE = "create-execution";
    public static final String STEP_DISPATCH = "dispatch-action";
    public static final String STEP_RECORD = "record-result";
    public static final String STEP_OUTCOME = "apply-outcome";

    public static final Duration DEFAULT_LEASE = Duration.ofMinutes(30);

    private final JobStore store;
    private final ActionDispatcher dispatcher;
    private final FailureCircuitBreaker breaker;
    private final Duration leaseDuration;
    private final Clock clock;

    public WorkflowRunner(JobStore store, ActionDispatcher dispatcher, FailureCircuitBreaker breaker,
            Duration leaseDuration, Clock clock) {
        this.store = store;
        this.dispatcher = dispatcher;
        this.breaker = breaker;
        this.leaseDuration = leaseDuration;
        this.clock = clock;
    }

    /**
     * Run a job if it is due and unleased.
     *
     * @throws JobStoreException when the store fails outside the action
     */
    public WorkflowResult run(String jobId) {
        Optional<ScheduledJob> claimed = store.claimLease(jobId, leaseDuration, clock.instant());
        if (claimed.isEmpty()) {
            log.debug("Job {} not claimed: not due or leased by another runner", jobId);
            return WorkflowResult.notClaimed(jobId);
        }
        ScheduledJob job = claimed.get();
        Instant claimedAt = job.getLastLockAt();

        boolean success = false;
        try {
            JobExecution execution = openExecution(job);
            ActionResult result = dispatchStep(job, execution.getId());
            recordResultStep(execution.getId(), result);
            applyOutcomeStep(job, execution.getId(), result);
            success = result.isSuccess();
            return new WorkflowResult(jobId, execution.getId(), true, result.isSuccess(),
                    result.getError(), result.getData());
        } finally {
            release(job.getId(), claimedAt, success);
        }
    }

    // --- Steps ---

    private JobExecution openExecution(ScheduledJob job) {
        Instant now = clock.instant();
        Optional<JobExecution> unfinished = store.findUnfinishedExecution(job.getId(), STEP_OUTCOME);
        if (unfinished.isPresent() && unfinished.get().getId().equals(job.getLastExecutionId())) {
            // outcome reached the job before the crash; only the marker is missing
            JobExecution stale = unfinished.get();
            stale.getCompletedSteps().add(STEP_OUTCOME);
            store.updateExecution(stale);
            unfinished = Optional.empty();
        }
        if (unfinished.isPresent()) {
            JobExecution execution = unfinished.get();
            execution.setAttempts(execution.getAttempts() + 1);
            log.info("Resuming execution {} of job {} (attempt {}, completed {})",
                    execution.getId(), job.getId(), execution.getAttempts(), execution.getCompletedSteps());
            return store.updateExecution(execution);
        }

        JobExecution execution = JobExecution.builder()
                .jobId(job.getId())
                .agentId(job.getAgentId())
                .status(ExecutionStatus.RUNNING)
                .startedAt(now)
                .attempts(1)
                .build();
        execution.getCompletedSteps().add(STEP_CREATE);
        execution = store.createExecution(execution);
        log.debug("Created execution {} for job {}", execution.getId(), job.getId());
        return execution;
    }

    private ActionResult dispatchStep(ScheduledJob job, String executionId) {
        JobExecution before = loadExecution(executionId);
        if (before.hasCompleted(STEP_DISPATCH)) {
            log.debug("Execution {}: {} already done, replaying result", executionId, STEP_DISPATCH);
            return fromStepOutput(before.getStepOutputs().get(STEP_DISPATCH));
        }

        ActionResult result;
        try {
            result = dispatcher.dispatch(job, new ActionContext(executionId,
                    new ExecutionToolJournal(store, executionId)));
            if (result == null) {
                result = ActionResult.fail("Action returned no result");
            }
        } catch (RuntimeException e) {
            log.error("Action {} of job {} threw during execution {}: {}",
                    job.getActionType(), job.getId(), executionId, e.getMessage(), e);
            result = ActionResult.fail(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }

        // reload: the action may have journaled tool steps meanwhile
        JobExecution execution = loadExecution(executionId);
        execution.getStepOutputs().put(STEP_DISPATCH, toStepOutput(result));
        execution.getCompletedSteps().add(STEP_DISPATCH);
        store.updateExecution(execution);
        return result;
    }

    private void recordResultStep(String executionId, ActionResult result) {
        JobExecution execution = loadExecution(executionId);
        if (execution.hasCompleted(STEP_RECORD) || execution.isTerminal()) {
            return;
        }
        execution.setStatus(result.isSuccess() ? ExecutionStatus.SUCCESS : ExecutionStatus.FAILED);
        execution.setResultData(result.getData());
        execution.setErrorMessage(result.getError());
        execution.setFinishedAt(clock.instant());
        execution.getCompletedSteps().add(STEP_RECORD);
        store.updateExecution(execution);
        log.info("Execution {} of job {} finished: {}", executionId, execution.getJobId(),
                result.isSuccess() ? "success" : "failed - " + result.getError());
    }

    private void applyOutcomeStep(ScheduledJob job, String executionId, ActionResult result) {
        if (result.isSuccess()) {
            markExecuted(job.getId(), executionId);
        } else {
            breaker.recordFailure(job.getId(), executionId, result.getError());
        }
        JobExecution execution = loadExecution(executionId);
        if (!execution.hasCompleted(STEP_OUTCOME)) {
            execution.getCompletedSteps().add(STEP_OUTCOME);
            store.updateExecution(execution);
        }
    }

    /**
     * Advance a job after a successful execution. Applied at most once per
     * execution id: a repeated call leaves the job unchanged.
     *
     * @return true when this call changed the job
     */
    public boolean markExecuted(String jobId, String executionId) {
        Instant now = clock.instant();
        Optional<ScheduledJob> updated = store.compareAndUpdate(jobId,
                job -> !executionId.equals(job.getLastExecutionId()),
                job -> {
                    job.setLastExecutionId(executionId);
                    job.setRunCount(job.getRunCount() + 1);
                    job.setLastRunAt(now);
                    job.setConsecutiveFailures(0);
                    job.setFailureReason(null);
                    job.setUpdatedAt(now);

                    if (job.getScheduleType() != ScheduleType.CRON) {
                        job.setNextRunAt(null);
                        complete(job);
                        return;
                    }
                    if (job.getMaxRuns() != null && job.getRunCount() >= job.getMaxRuns()) {
                        job.setNextRunAt(null);
                        complete(job);
                        return;
                    }
                    try {
                        job.setNextRunAt(ScheduleTimes.advanceCron(job, now));
                    } catch (IllegalArgumentException e) {
                        job.setStatus(JobStatus.PAUSED);
                        job.setFailureReason(e.getMessage());
                    }
                });
        updated.ifPresent(job -> log.debug("Job {} marked executed by {} (status {}, next run {})",
                jobId, executionId, job.getStatus().key(), job.getNextRunAt()));
        return updated.isPresent();
    }

    private static void complete(ScheduledJob job) {
        if (job.getStatus() == JobStatus.ACTIVE) {
            job.setStatus(JobStatus.COMPLETED);
        }
    }

    private void release(String jobId, Instant claimedAt, boolean success) {
        try {
            store.releaseLease(jobId, claimedAt, success ? AgentRunState.IDLE : AgentRunState.FAILED,
                    clock.instant());
        } catch (JobStoreException e) {
            // the lease expires on its own
            log.warn("Could not release lease on job {}: {}", jobId, e.getMessage());
        }
    }

    private JobExecution loadExecution(String executionId) {
        return store.getExecution(executionId)
                .orElseThrow(() -> new JobStoreException("Execution not found: " + executionId));
    }

    // --- Step output codec ---

    static Map<String, Object> toStepOutput(ActionResult result) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("success", result.isSuccess());
        out.put("data", result.getData());
        out.put("error", result.getError());
        return out;
    }

    @SuppressWarnings("unchecked")
    static ActionResult fromStepOutput(Object stored) {
        if (!(stored instanceof Map)) {
            return ActionResult.fail("Checkpointed result is unreadable");
        }
        Map<String, Object> map = (Map<String, Object>) stored;
        Object data = map.get("data");
        return ActionResult.builder()
                .success(Boolean.TRUE.equals(map.get("success")))
                .data(data instanceof Map ? new LinkedHashMap<>((Map<String, Object>) data) : null)
                .error(map.get("error") != null ? String.valueOf(map.get("error")) : null)
                .build();
    }

    /**
     * Outcome of {@link #run(String)}.
     *
     * @param claimed false when the job was not due or already leased; no
     *                execution was created
     */
    public record WorkflowResult(String jobId, String executionId, boolean claimed, boolean success,
            String error, Map<String, Object> data) {

        static WorkflowResult notClaimed(String jobId) {
            return new WorkflowResult(jobId, null, false, false, "Job not claimed", null);
        }
    }
}

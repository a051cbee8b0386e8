package com.taskdeck.scheduler.store;

import com.taskdeck.scheduler.model.JobExecution;
import com.taskdeck.scheduler.model.JobTypes.JobStatus;
import com.taskdeck.scheduler.model.JobTypes.JobType;
import com.taskdeck.scheduler.model.ScheduledJob;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Thread-safe job store held in memory.
 *
 * <p>
 * Row-level atomicity comes from {@link ConcurrentHashMap#computeIfPresent}:
 * expectation and mutation of one job run while its bin is locked.
 * </p>
 */
public class InMemoryJobStore implements JobStore {

    protected final Map<String, ScheduledJob> jobs = new ConcurrentHashMap<>();
    protected final Map<String, JobExecution> executions = new ConcurrentHashMap<>();

    @Override
    public ScheduledJob createJob(ScheduledJob job) {
        ScheduledJob stored = job.copy();
        if (stored.getId() == null) {
            stored.setId(UUID.randomUUID().toString());
        }
        if (jobs.putIfAbsent(stored.getId(), stored) != null) {
            throw new JobStoreException("Job already exists: " + stored.getId());
        }
        changed();
        return stored.copy();
    }

    @Override
    public Optional<ScheduledJob> getJob(String jobId) {
        ScheduledJob job = jobs.get(jobId);
        return Optional.ofNullable(job != null ? job.copy() : null);
    }

    @Override
    public List<ScheduledJob> listJobs(String agentId, JobStatus status, JobType jobType) {
        return jobs.values().stream()
                .filter(j -> agentId == null || agentId.equals(j.getAgentId()))
                .filter(j -> status == null || status == j.getStatus())
                .filter(j -> jobType == null || jobType == j.getJobType())
                .sorted(Comparator.comparing(ScheduledJob::getCreatedAt,
                        Comparator.nullsLast(Comparator.<Instant>naturalOrder())).reversed())
                .map(ScheduledJob::copy)
                .collect(Collectors.toList());
    }

    @Override
    public List<ScheduledJob> listDueJobs(int limit, Instant now) {
        return jobs.values().stream()
                .filter(j -> j.isDueAt(now))
                .sorted(DUE_ORDER)
                .limit(Math.max(0, limit))
                .map(ScheduledJob::copy)
                .collect(Collectors.toList());
    }

    @Override
    public Optional<ScheduledJob> compareAndUpdate(String jobId, Predicate<ScheduledJob> expectation,
            Consumer<ScheduledJob> mutation) {
        ScheduledJob[] updated = new ScheduledJob[1];
        jobs.computeIfPresent(jobId, (id, current) -> {
            if (!expectation.test(current.copy())) {
                return current;
            }
            ScheduledJob next = current.copy();
            mutation.accept(next);
            next.setId(id);
            updated[0] = next;
            return next;
        });
        if (updated[0] == null) {
            return Optional.empty();
        }
        changed();
        return Optional.of(updated[0].copy());
    }

    @Override
    public JobExecution createExecution(JobExecution execution) {
        JobExecution stored = execution.copy();
        if (stored.getId() == null) {
            stored.setId(UUID.randomUUID().toString());
        }
        executions.put(stored.getId(), stored);
        changed();
        return stored.copy();
    }

    @Override
    public Optional<JobExecution> getExecution(String executionId) {
        JobExecution execution = executions.get(executionId);
        return Optional.ofNullable(execution != null ? execution.copy() : null);
    }

    @Override
    public JobExecution updateExecution(JobExecution execution) {
        if (!executions.containsKey(execution.getId())) {
            throw new JobStoreException("Execution not found: " + execution.getId());
        }
        JobExecution stored = execution.copy();
        executions.put(stored.getId(), stored);
        changed();
        return stored.copy();
    }

    @Override
    public Optional<JobExecution> findUnfinishedExecution(String jobId, String outcomeStep) {
        return byJob(jobId).stream()
                .filter(e -> !e.hasCompleted(outcomeStep))
                .findFirst()
                .map(JobExecution::copy);
    }

    @Override
    public List<JobExecution> listExecutions(String jobId, int limit) {
        return byJob(jobId).stream()
                .limit(Math.max(0, limit))
                .map(JobExecution::copy)
                .collect(Collectors.toList());
    }

    private List<JobExecution> byJob(String jobId) {
        return executions.values().stream()
                .filter(e -> jobId.equals(e.getJobId()))
                .sorted(Comparator.comparing(JobExecution::getStartedAt,
                        Comparator.nullsLast(Comparator.<Instant>naturalOrder())).reversed())
                .collect(Collectors.toList());
    }

    protected Collection<ScheduledJob> jobRows() {
        return jobs.values();
    }

    protected Collection<JobExecution> executionRows() {
        return executions.values();
    }

    /** Called after every successful write. */
    protected void changed() {
    }
}

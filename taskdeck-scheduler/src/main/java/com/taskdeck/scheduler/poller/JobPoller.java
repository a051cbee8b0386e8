package com.taskdeck.scheduler.poller;

import com.taskdeck.scheduler.model.ScheduledJob;
import com.taskdeck.scheduler.store.JobStore;
import com.taskdeck.scheduler.store.JobStoreException;
import com.taskdeck.scheduler.workflow.WorkflowLauncher;
import com.taskdeck.scheduler.workspace.ActivityLog;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Selects due jobs and hands each to a workflow runner.
 *
 * <p>
 * The poller takes no lease itself: the runner claims it atomically at
 * execution start, so overlapping poll cycles may launch the same job and
 * only one launch executes it.
 * </p>
 */
@Slf4j
public class JobPoller {

    public static final int DEFAULT_BATCH_SIZE = 5;

    private final JobStore store;
    private final WorkflowLauncher launcher;
    private final ActivityLog activity;
    private final int batchSize;
    private final Clock clock;

    public JobPoller(JobStore store, WorkflowLauncher launcher, ActivityLog activity, int batchSize, Clock clock) {
        this.store = store;
        this.launcher = launcher;
        this.activity = activity;
        this.batchSize = batchSize > 0 ? batchSize : DEFAULT_BATCH_SIZE;
        this.clock = clock;
    }

    /**
     * Run one poll cycle.
     *
     * @throws JobStoreException when due jobs cannot be read; no job is
     *                           touched in that case
     */
    public PollReport pollOnce() {
        Instant now = clock.instant();
        List<ScheduledJob> due = store.listDueJobs(batchSize, now);

        if (due.isEmpty()) {
            log.debug("No due jobs");
            return PollReport.builder()
                    .message("No jobs to process")
                    .processedCount(0)
                    .successCount(0)
                    .timestamp(now)
                    .build();
        }

        List<PollReport.JobDispatch> results = new ArrayList<>();
        int started = 0;
        for (ScheduledJob job : due) {
            try {
                launcher.launch(job);
            } catch (RuntimeException e) {
                String reason = "Dispatch failed: " + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
                log.warn("Could not hand job {} to a runner: {}", job.getId(), reason);
                if (!store.markDispatchFailed(job.getId(), reason, clock.instant())) {
                    log.debug("Job {} was claimed by another runner meanwhile, not marking it failed", job.getId());
                }
                results.add(new PollReport.JobDispatch(job.getId(), job.getTitle(), false, reason));
                continue;
            }
            started++;
            results.add(new PollReport.JobDispatch(job.getId(), job.getTitle(), true, null));
            logDispatch(job);
        }

        log.info("Processed {} due jobs, {} started", due.size(), started);
        return PollReport.builder()
                .message("Processed " + due.size() + " jobs")
                .processedCount(due.size())
                .successCount(started)
                .results(results)
                .timestamp(now)
                .build();
    }

    private void logDispatch(ScheduledJob job) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("jobId", job.getId());
        metadata.put("actionType", job.getActionType());
        metadata.put("status", "started");
        try {
            activity.record(job.getAgentId(), "cron_execution", "Started: " + job.getTitle(), metadata);
        } catch (RuntimeException e) {
            log.warn("Could not record activity for job {}: {}", job.getId(), e.getMessage());
        }
    }
}

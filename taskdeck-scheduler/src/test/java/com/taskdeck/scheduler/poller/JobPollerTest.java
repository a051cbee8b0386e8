package com.taskdeck.scheduler.poller;

import com.taskdeck.scheduler.SchedulerFixture;
import com.taskdeck.scheduler.model.JobTypes.AgentRunState;
import com.taskdeck.scheduler.model.JobTypes.JobStatus;
import com.taskdeck.scheduler.model.ScheduledJob;
import com.taskdeck.scheduler.store.InMemoryJobStore;
import com.taskdeck.scheduler.store.JobStoreException;
import com.taskdeck.scheduler.workflow.ExecutorWorkflowLauncher;
import com.taskdeck.scheduler.workspace.inmemory.InMemoryActivityLog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class JobPollerTest {

    private SchedulerFixture fx;

    @BeforeEach
    void setUp() {
        fx = new SchedulerFixture();
    }

    @Test
    void noDueJobs_reportsNothingToDo() {
        JobPoller poller = new JobPoller(fx.store, job -> fail("nothing should launch"), fx.activity, 5, fx.clock);

        PollReport report = poller.pollOnce();

        assertEquals("No jobs to process", report.getMessage());
        assertEquals(0, report.getProcessedCount());
    }

    @Test
    void launchesAtMostBatchSizeJobs() {
        for (int i = 0; i < 4; i++) {
            fx.dueJob("notify", Map.of("message", "m" + i));
        }
        List<String> launched = new ArrayList<>();
        JobPoller poller = new JobPoller(fx.store, job -> launched.add(job.getId()), fx.activity, 3, fx.clock);

        PollReport report = poller.pollOnce();

        assertEquals(3, launched.size());
        assertEquals("Processed 3 jobs", report.getMessage());
        assertEquals(3, report.getSuccessCount());
        assertEquals(3, fx.activity.list(SchedulerFixture.AGENT_ID).size());
    }

    @Test
    void dispatchFailure_marksJobAndContinuesWithSiblings() {
        ScheduledJob broken = fx.dueJob("notify", Map.of("message", "broken"));
        fx.clock.advance(Duration.ofSeconds(1));
        ScheduledJob healthy = fx.dueJob("notify", Map.of("message", "healthy"));
        List<String> launched = new ArrayList<>();
        JobPoller poller = new JobPoller(fx.store, job -> {
            if (job.getId().equals(broken.getId()))
                throw new RejectedExecutionException("queue full");
            launched.add(job.getId());
        }, fx.activity, 5, fx.clock);

        PollReport report = poller.pollOnce();

        assertEquals(List.of(healthy.getId()), launched);
        assertEquals(2, report.getProcessedCount());
        assertEquals(1, report.getSuccessCount());
        ScheduledJob after = fx.store.getJob(broken.getId()).orElseThrow();
        assertEquals(AgentRunState.FAILED, after.getAgentRunState());
        assertEquals("Dispatch failed: queue full", after.getFailureReason());
        assertEquals(JobStatus.ACTIVE, after.getStatus());
    }

    @Test
    void storeFailure_abortsCycleWithoutTouchingJobs() {
        InMemoryJobStore failing = new InMemoryJobStore() {
            @Override
            public List<ScheduledJob> listDueJobs(int limit, Instant now) {
                throw new JobStoreException("store unreachable");
            }
        };
        List<String> launched = new ArrayList<>();
        JobPoller poller = new JobPoller(failing, job -> launched.add(job.getId()), fx.activity, 5, fx.clock);

        assertThrows(JobStoreException.class, poller::pollOnce);
        assertTrue(launched.isEmpty());
    }

    @Test
    void activityLogFailure_doesNotStopDispatch() {
        fx.dueJob("notify", Map.of("message", "x"));
        List<String> launched = new ArrayList<>();
        JobPoller poller = new JobPoller(fx.store, job -> launched.add(job.getId()),
                new InMemoryActivityLog() {
                    @Override
                    public void record(String agentId, String type, String description, Map<String, Object> metadata) {
                        throw new IllegalStateException("activity table locked");
                    }
                }, 5, fx.clock);

        PollReport report = poller.pollOnce();

        assertEquals(1, launched.size());
        assertEquals(1, report.getSuccessCount());
    }

    @Test
    void overlappingCycles_runEachJobOnce() {
        ScheduledJob job = fx.dueJob("notify", Map.of("message", "Only once"));
        ExecutorWorkflowLauncher launcher = new ExecutorWorkflowLauncher(fx.runner, 4, 16);
        try {
            JobPoller poller = new JobPoller(fx.store, launcher, fx.activity, 5, fx.clock);
            poller.pollOnce();
            poller.pollOnce();
            poller.pollOnce();
        } finally {
            launcher.close();
        }

        assertEquals(1, fx.notifications.listNotifications(SchedulerFixture.AGENT_ID).size());
        assertEquals(1, fx.store.listExecutions(job.getId(), 10).size());
        assertEquals(JobStatus.COMPLETED, fx.store.getJob(job.getId()).orElseThrow().getStatus());
    }
}

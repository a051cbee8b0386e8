package com.taskdeck.scheduler.store;

import com.taskdeck.scheduler.model.JobExecution;
import com.taskdeck.scheduler.model.JobTypes.AgentRunState;
import com.taskdeck.scheduler.model.JobTypes.JobStatus;
import com.taskdeck.scheduler.model.JobTypes.Priority;
import com.taskdeck.scheduler.model.JobTypes.ScheduleType;
import com.taskdeck.scheduler.model.ScheduledJob;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryJobStoreTest {

    private static final Instant NOW = Instant.parse("2025-03-01T09:00:00Z");
    private static final Duration LEASE = Duration.ofMinutes(30);

    private InMemoryJobStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryJobStore();
    }

    @Test
    void concurrentClaims_exactlyOneWins() throws Exception {
        ScheduledJob job = store.createJob(dueJob("race", Priority.MEDIUM, NOW.minusSeconds(60)));
        int contenders = 16;
        ExecutorService pool = Executors.newFixedThreadPool(contenders);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Optional<ScheduledJob>>> futures = new ArrayList<>();
            for (int i = 0; i < contenders; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return store.claimLease(job.getId(), LEASE, NOW);
                }));
            }
            start.countDown();

            int winners = 0;
            for (Future<Optional<ScheduledJob>> f : futures) {
                if (f.get(5, TimeUnit.SECONDS).isPresent())
                    winners++;
            }
            assertEquals(1, winners);
        } finally {
            pool.shutdownNow();
        }

        ScheduledJob claimed = store.getJob(job.getId()).orElseThrow();
        assertEquals(AgentRunState.RUNNING, claimed.getAgentRunState());
        assertEquals(NOW.plus(LEASE), claimed.getLockExpiresAt());
    }

    @Test
    void expiredLease_canBeReclaimed() {
        ScheduledJob job = store.createJob(dueJob("stale", Priority.MEDIUM, NOW.minusSeconds(60)));
        assertTrue(store.claimLease(job.getId(), LEASE, NOW).isPresent());

        assertTrue(store.claimLease(job.getId(), LEASE, NOW.plus(Duration.ofMinutes(10))).isEmpty());
        assertTrue(store.claimLease(job.getId(), LEASE, NOW.plus(LEASE)).isPresent());
    }

    @Test
    void releaseLease_ignoresLeaseTakenBySomeoneElse() {
        ScheduledJob job = store.createJob(dueJob("release", Priority.MEDIUM, NOW.minusSeconds(60)));
        Instant first = store.claimLease(job.getId(), LEASE, NOW).orElseThrow().getLastLockAt();
        Instant later = NOW.plus(LEASE).plusSeconds(1);
        store.claimLease(job.getId(), LEASE, later).orElseThrow();

        assertFalse(store.releaseLease(job.getId(), first, AgentRunState.IDLE, later));
        assertNotNull(store.getJob(job.getId()).orElseThrow().getLockExpiresAt());

        assertTrue(store.releaseLease(job.getId(), later, AgentRunState.IDLE, later));
        assertNull(store.getJob(job.getId()).orElseThrow().getLockExpiresAt());
    }

    @Test
    void listDueJobs_ordersByPriorityThenAgeAndHonorsLimit() {
        store.createJob(dueJob("low-old", Priority.LOW, NOW.minusSeconds(600)));
        store.createJob(dueJob("high-new", Priority.HIGH, NOW.minusSeconds(10)));
        store.createJob(dueJob("medium-old", Priority.MEDIUM, NOW.minusSeconds(500)));
        store.createJob(dueJob("medium-new", null, NOW.minusSeconds(100)));
        ScheduledJob future = dueJob("future", Priority.HIGH, NOW.minusSeconds(700));
        future.setNextRunAt(NOW.plusSeconds(60));
        store.createJob(future);
        ScheduledJob paused = dueJob("paused", Priority.HIGH, NOW.minusSeconds(700));
        paused.setStatus(JobStatus.PAUSED);
        store.createJob(paused);

        List<ScheduledJob> due = store.listDueJobs(3, NOW);

        assertEquals(List.of("high-new", "medium-old", "medium-new"),
                due.stream().map(ScheduledJob::getTitle).toList());
    }

    @Test
    void returnedJobsAreCopies() {
        ScheduledJob job = store.createJob(dueJob("copy", Priority.MEDIUM, NOW));
        job.setStatus(JobStatus.CANCELLED);
        job.getActionPayload().put("message", "changed");

        ScheduledJob stored = store.getJob(job.getId()).orElseThrow();
        assertEquals(JobStatus.ACTIVE, stored.getStatus());
        assertEquals("hi", stored.getActionPayload().get("message"));
    }

    @Test
    void findUnfinishedExecution_returnsLatestWithoutOutcome() {
        ScheduledJob job = store.createJob(dueJob("exec", Priority.MEDIUM, NOW));
        JobExecution done = JobExecution.builder().jobId(job.getId()).startedAt(NOW.minusSeconds(100)).build();
        done.getCompletedSteps().add("apply-outcome");
        store.createExecution(done);
        JobExecution open = store.createExecution(
                JobExecution.builder().jobId(job.getId()).startedAt(NOW.minusSeconds(10)).build());

        Optional<JobExecution> unfinished = store.findUnfinishedExecution(job.getId(), "apply-outcome");

        assertEquals(open.getId(), unfinished.map(JobExecution::getId).orElse(null));
        assertEquals(2, store.listExecutions(job.getId(), 10).size());
        assertEquals(open.getId(), store.listExecutions(job.getId(), 1).get(0).getId());
    }

    @Test
    void markDispatchFailed_recordsReason() {
        ScheduledJob job = store.createJob(dueJob("dispatch", Priority.MEDIUM, NOW));

        assertTrue(store.markDispatchFailed(job.getId(), "Dispatch failed: queue full", NOW));

        ScheduledJob stored = store.getJob(job.getId()).orElseThrow();
        assertEquals(AgentRunState.FAILED, stored.getAgentRunState());
        assertEquals("Dispatch failed: queue full", stored.getFailureReason());
        assertEquals(JobStatus.ACTIVE, stored.getStatus());
    }

    @Test
    void markDispatchFailed_leavesLeasedJobToItsRunner() {
        ScheduledJob job = store.createJob(dueJob("claimed", Priority.MEDIUM, NOW));
        store.claimLease(job.getId(), Duration.ofMinutes(30), NOW).orElseThrow();

        assertFalse(store.markDispatchFailed(job.getId(), "Dispatch failed: queue full", NOW.plusSeconds(1)));

        ScheduledJob stored = store.getJob(job.getId()).orElseThrow();
        assertEquals(AgentRunState.RUNNING, stored.getAgentRunState());
        assertNull(stored.getFailureReason());
    }

    static ScheduledJob dueJob(String title, Priority priority, Instant createdAt) {
        ScheduledJob job = ScheduledJob.builder()
                .agentId("agent-1")
                .title(title)
                .actionType("notify")
                .scheduleType(ScheduleType.ONCE)
                .runAt(createdAt)
                .nextRunAt(createdAt)
                .priority(priority)
                .createdAt(createdAt)
                .build();
        job.getActionPayload().put("message", "hi");
        return job;
    }
}

package com.taskdeck.scheduler.workflow;

import com.taskdeck.scheduler.model.ScheduledJob;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs workflows on a fixed pool of worker threads. A full queue rejects the
 * launch, which the poller records as a dispatch failure.
 */
@Slf4j
public class ExecutorWorkflowLauncher implements WorkflowLauncher, AutoCloseable {

    private final WorkflowRunner runner;
    private final ThreadPoolExecutor executor;

    public ExecutorWorkflowLauncher(WorkflowRunner runner, int workerThreads, int queueCapacity) {
        this.runner = runner;
        AtomicInteger counter = new AtomicInteger();
        int threads = Math.max(1, workerThreads);
        this.executor = new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(Math.max(1, queueCapacity)),
                r -> {
                    Thread t = new Thread(r, "workflow-worker-" + counter.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy());
    }

    @Override
    public void launch(ScheduledJob job) {
        CompletableFuture.runAsync(() -> runner.run(job.getId()), executor)
                .exceptionally(e -> {
                    log.error("Workflow for job {} crashed: {}", job.getId(), e.getMessage(), e);
                    return null;
                });
    }

    public int activeCount() {
        return executor.getActiveCount();
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}

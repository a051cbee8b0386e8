package com.taskdeck.app.dispatch;

import com.taskdeck.scheduler.poller.JobPoller;
import com.taskdeck.scheduler.poller.PollReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs poll cycles for both triggers and keeps counters for /health.
 */
@Slf4j
@Service
public class DispatchService {

    private final JobPoller poller;
    private final AtomicLong cycles = new AtomicLong();
    private final AtomicLong failedCycles = new AtomicLong();
    private final AtomicReference<PollReport> lastReport = new AtomicReference<>();

    public DispatchService(JobPoller poller) {
        this.poller = poller;
    }

    /**
     * @throws com.taskdeck.scheduler.store.JobStoreException when due jobs
     *         cannot be read
     */
    public PollReport runCycle(String trigger) {
        cycles.incrementAndGet();
        try {
            PollReport report = poller.pollOnce();
            lastReport.set(report);
            log.debug("Poll cycle ({}) done: {}", trigger, report.getMessage());
            return report;
        } catch (RuntimeException e) {
            failedCycles.incrementAndGet();
            throw e;
        }
    }

    public long getCycles() {
        return cycles.get();
    }

    public long getFailedCycles() {
        return failedCycles.get();
    }

    public PollReport getLastReport() {
        return lastReport.get();
    }
}

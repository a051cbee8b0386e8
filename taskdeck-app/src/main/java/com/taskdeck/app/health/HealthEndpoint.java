package com.taskdeck.app.health;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskdeck.app.dispatch.DispatchService;
import com.taskdeck.scheduler.model.JobTypes.JobStatus;
import com.taskdeck.scheduler.model.ScheduledJob;
import com.taskdeck.scheduler.poller.PollReport;
import com.taskdeck.scheduler.store.JobStore;
import com.taskdeck.scheduler.workflow.ExecutorWorkflowLauncher;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.lang.management.ManagementFactory;
import java.util.List;

/**
 * Liveness endpoint with JVM and scheduler stats.
 */
@RestController
public class HealthEndpoint {

    private final ObjectMapper mapper = new ObjectMapper();
    private final JobStore jobStore;
    private final DispatchService dispatchService;
    private final ExecutorWorkflowLauncher launcher;

    public HealthEndpoint(JobStore jobStore, DispatchService dispatchService, ExecutorWorkflowLauncher launcher) {
        this.jobStore = jobStore;
        this.dispatchService = dispatchService;
        this.launcher = launcher;
    }

    @GetMapping("/health")
    public ObjectNode health() {
        var node = mapper.createObjectNode();
        node.put("status", "ok");
        node.put("uptime", ManagementFactory.getRuntimeMXBean().getUptime());

        var memory = node.putObject("memory");
        Runtime rt = Runtime.getRuntime();
        memory.put("total_mb", rt.totalMemory() / (1024 * 1024));
        memory.put("free_mb", rt.freeMemory() / (1024 * 1024));
        memory.put("used_mb", (rt.totalMemory() - rt.freeMemory()) / (1024 * 1024));
        memory.put("max_mb", rt.maxMemory() / (1024 * 1024));

        var scheduler = node.putObject("scheduler");
        scheduler.put("cycles", dispatchService.getCycles());
        scheduler.put("failedCycles", dispatchService.getFailedCycles());
        scheduler.put("activeWorkflows", launcher.activeCount());
        PollReport last = dispatchService.getLastReport();
        if (last != null) {
            scheduler.put("lastPollAt", String.valueOf(last.getTimestamp()));
            scheduler.put("lastProcessed", last.getProcessedCount());
        }

        var jobs = scheduler.putObject("jobs");
        List<ScheduledJob> all = jobStore.listJobs(null, null, null);
        for (JobStatus status : JobStatus.values()) {
            jobs.put(status.key(), all.stream().filter(j -> j.getStatus() == status).count());
        }
        return node;
    }
}

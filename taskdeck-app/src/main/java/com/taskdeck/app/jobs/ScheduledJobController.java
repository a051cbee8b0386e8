package com.taskdeck.app.jobs;

import com.taskdeck.scheduler.ScheduledJobService;
import com.taskdeck.scheduler.model.JobExecution;
import com.taskdeck.scheduler.model.JobTypes.JobStatus;
import com.taskdeck.scheduler.model.JobTypes.JobType;
import com.taskdeck.scheduler.model.ScheduledJob;
import com.taskdeck.scheduler.store.JobStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Job administration: list and inspect jobs, pause, cancel and reactivate.
 */
@Slf4j
@RestController
@RequestMapping("/api/jobs")
public class ScheduledJobController {

    private final ScheduledJobService jobs;

    public ScheduledJobController(ScheduledJobService jobs) {
        this.jobs = jobs;
    }

    @GetMapping
    public ResponseEntity<?> list(@RequestParam(name = "agentId", required = false) String agentId,
            @RequestParam(name = "status", required = false) String status,
            @RequestParam(name = "jobType", required = false) String jobType) {
        JobStatus statusFilter = status != null ? JobStatus.fromKey(status) : null;
        if (status != null && statusFilter == null) {
            return error(HttpStatus.BAD_REQUEST, "Invalid status: " + status);
        }
        JobType typeFilter = jobType != null ? JobType.fromKey(jobType) : null;
        if (jobType != null && typeFilter == null) {
            return error(HttpStatus.BAD_REQUEST, "Invalid jobType: " + jobType);
        }
        List<ScheduledJob> result = jobs.listJobs(agentId, statusFilter, typeFilter);
        return ResponseEntity.ok(Map.of("jobs", result, "count", result.size()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> get(@PathVariable("id") String id) {
        return respond(id, jobs.getJob(id));
    }

    @GetMapping("/{id}/executions")
    public ResponseEntity<?> executions(@PathVariable("id") String id,
            @RequestParam(name = "limit", defaultValue = "20") int limit) {
        if (jobs.getJob(id).isEmpty()) {
            return error(HttpStatus.NOT_FOUND, "Job not found: " + id);
        }
        List<JobExecution> result = jobs.listExecutions(id, limit);
        return ResponseEntity.ok(Map.of("executions", result, "count", result.size()));
    }

    @PostMapping("/{id}/reactivate")
    public ResponseEntity<?> reactivate(@PathVariable("id") String id) {
        return respond(id, jobs.reactivate(id));
    }

    @PostMapping("/{id}/pause")
    public ResponseEntity<?> pause(@PathVariable("id") String id) {
        return respond(id, jobs.pause(id));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<?> cancel(@PathVariable("id") String id) {
        return respond(id, jobs.cancel(id));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<?> conflict(IllegalStateException e) {
        return error(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler(JobStoreException.class)
    public ResponseEntity<?> storeFailure(JobStoreException e) {
        log.error("Job store failure: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    private static ResponseEntity<?> respond(String id, Optional<ScheduledJob> job) {
        return job.<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> error(HttpStatus.NOT_FOUND, "Job not found: " + id));
    }

    private static ResponseEntity<?> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message));
    }
}

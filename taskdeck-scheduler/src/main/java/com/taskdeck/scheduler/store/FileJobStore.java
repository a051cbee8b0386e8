package com.taskdeck.scheduler.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.taskdeck.scheduler.model.JobExecution;
import com.taskdeck.scheduler.model.ScheduledJob;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Job store persisted as a single versioned JSON file.
 *
 * <p>
 * File layout: {@code {"version": "1", "savedAt": ..., "jobs": {id: job},
 * "executions": {id: execution}}}. The whole file is rewritten after every
 * change through a temp file and an atomic move, so leases and open
 * executions survive a process restart.
 * </p>
 *
 * <p>
 * Writes are serialized. A write whose save fails is rolled back in memory
 * before the {@link JobStoreException} reaches the caller, so a failed
 * create or lease claim leaves no trace.
 * </p>
 */
@Slf4j
public class FileJobStore extends InMemoryJobStore {

    static final String VERSION = "1";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(SerializationFeature.INDENT_OUTPUT, true)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final Path storePath;
    private final Object saveLock = new Object();

    public FileJobStore(Path storePath) {
        this.storePath = storePath;
        load();
    }

    public Path getStorePath() {
        return storePath;
    }

    private void load() {
        if (!Files.exists(storePath)) {
            log.debug("Job store file not found: {}", storePath);
            return;
        }
        try {
            String content = Files.readString(storePath);
            if (content.isBlank()) {
                return;
            }
            Map<String, Object> raw = MAPPER.readValue(content, new TypeReference<Map<String, Object>>() {
            });
            Object jobsRaw = raw.get("jobs");
            if (jobsRaw instanceof Map) {
                for (Object value : ((Map<?, ?>) jobsRaw).values()) {
                    ScheduledJob job = MAPPER.convertValue(value, ScheduledJob.class);
                    if (job != null && job.getId() != null) {
                        jobs.put(job.getId(), job);
                    }
                }
            }
            Object executionsRaw = raw.get("executions");
            if (executionsRaw instanceof Map) {
                for (Object value : ((Map<?, ?>) executionsRaw).values()) {
                    JobExecution execution = MAPPER.convertValue(value, JobExecution.class);
                    if (execution != null && execution.getId() != null) {
                        executions.put(execution.getId(), execution);
                    }
                }
            }
            log.info("Loaded {} jobs and {} executions from {}", jobs.size(), executions.size(), storePath);
        } catch (IOException | IllegalArgumentException e) {
            throw new JobStoreException("Failed to load job store from " + storePath + ": " + e.getMessage(), e);
        }
    }

    @Override
    public ScheduledJob createJob(ScheduledJob job) {
        ScheduledJob withId = job.copy();
        if (withId.getId() == null) {
            withId.setId(UUID.randomUUID().toString());
        }
        synchronized (saveLock) {
            ScheduledJob previous = jobs.get(withId.getId());
            return rollbackOnFailure(() -> super.createJob(withId),
                    () -> restore(jobs, withId.getId(), previous));
        }
    }

    @Override
    public Optional<ScheduledJob> compareAndUpdate(String jobId, Predicate<ScheduledJob> expectation,
            Consumer<ScheduledJob> mutation) {
        synchronized (saveLock) {
            ScheduledJob previous = jobs.get(jobId);
            return rollbackOnFailure(() -> super.compareAndUpdate(jobId, expectation, mutation),
                    () -> restore(jobs, jobId, previous));
        }
    }

    @Override
    public JobExecution createExecution(JobExecution execution) {
        JobExecution withId = execution.copy();
        if (withId.getId() == null) {
            withId.setId(UUID.randomUUID().toString());
        }
        synchronized (saveLock) {
            JobExecution previous = executions.get(withId.getId());
            return rollbackOnFailure(() -> super.createExecution(withId),
                    () -> restore(executions, withId.getId(), previous));
        }
    }

    @Override
    public JobExecution updateExecution(JobExecution execution) {
        synchronized (saveLock) {
            JobExecution previous = executions.get(execution.getId());
            return rollbackOnFailure(() -> super.updateExecution(execution),
                    () -> restore(executions, execution.getId(), previous));
        }
    }

    private static <T> T rollbackOnFailure(Supplier<T> write, Runnable rollback) {
        try {
            return write.get();
        } catch (JobStoreException e) {
            rollback.run();
            throw e;
        }
    }

    private static <T> void restore(Map<String, T> rows, String id, T previous) {
        if (previous == null) {
            rows.remove(id);
        } else {
            rows.put(id, previous);
        }
    }

    @Override
    protected void changed() {
        synchronized (saveLock) {
            try {
                Path parent = storePath.toAbsolutePath().getParent();
                if (parent != null && !Files.exists(parent)) {
                    Files.createDirectories(parent);
                }

                Map<String, Object> output = new LinkedHashMap<>();
                output.put("version", VERSION);
                output.put("savedAt", Instant.now().toString());
                Map<String, ScheduledJob> jobSnapshot = new LinkedHashMap<>();
                for (ScheduledJob job : jobRows()) {
                    jobSnapshot.put(job.getId(), job.copy());
                }
                Map<String, JobExecution> executionSnapshot = new LinkedHashMap<>();
                for (JobExecution execution : executionRows()) {
                    executionSnapshot.put(execution.getId(), execution.copy());
                }
                output.put("jobs", jobSnapshot);
                output.put("executions", executionSnapshot);

                Path tmp = storePath.resolveSibling(storePath.getFileName() + ".tmp");
                Files.writeString(tmp, MAPPER.writeValueAsString(output));
                Files.move(tmp, storePath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                log.debug("Saved job store to {} ({} jobs)", storePath, jobSnapshot.size());
            } catch (IOException e) {
                log.warn("Could not save job store to {}, rolling back: {}", storePath, e.getMessage());
                throw new JobStoreException("Failed to save job store to " + storePath + ": " + e.getMessage(), e);
            }
        }
    }
}

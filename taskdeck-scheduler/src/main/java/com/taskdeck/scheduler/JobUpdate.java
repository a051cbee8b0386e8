package com.taskdeck.scheduler;

import com.taskdeck.scheduler.model.JobTypes.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Partial update of a job; null fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobUpdate {
    private String title;
    private Instant runAt;
    private String cronExpression;
    /** Only {@code active} and {@code paused} are accepted. */
    private JobStatus status;
}

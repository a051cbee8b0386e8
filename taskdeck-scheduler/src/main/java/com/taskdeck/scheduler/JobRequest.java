package com.taskdeck.scheduler;

import com.taskdeck.scheduler.model.JobTypes.JobType;
import com.taskdeck.scheduler.model.JobTypes.Priority;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Input for creating a scheduled job. Exactly one of {@code runAt} and
 * {@code cronExpression} must be set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobRequest {
    private String agentId;
    private String title;
    private String description;
    /** Derived from the schedule when null. */
    private JobType jobType;
    private String actionType;
    @Builder.Default
    private Map<String, Object> actionPayload = new LinkedHashMap<>();
    private Instant runAt;
    private String cronExpression;
    private String timezone;
    private String taskId;
    private String projectId;
    private String conversationId;
    private Priority priority;
    private Integer maxRuns;
}

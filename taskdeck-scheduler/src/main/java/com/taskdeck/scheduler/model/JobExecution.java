package com.taskdeck.scheduler.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.taskdeck.scheduler.model.JobTypes.ExecutionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One attempt to run a job, doubling as the checkpoint record of its workflow.
 *
 * <p>
 * {@code completedSteps} lists the workflow steps whose side effects are
 * durable, in order; {@code stepOutputs} holds the memoized result of each.
 * </p>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class JobExecution {
    private String id;
    private String jobId;
    private String agentId;
    @Builder.Default
    private ExecutionStatus status = ExecutionStatus.RUNNING;
    private Map<String, Object> resultData;
    private String errorMessage;

    @Builder.Default
    private List<String> completedSteps = new ArrayList<>();
    @Builder.Default
    private Map<String, Object> stepOutputs = new LinkedHashMap<>();

    private Instant startedAt;
    private Instant finishedAt;
    private int attempts;

    public boolean hasCompleted(String step) {
        return completedSteps != null && completedSteps.contains(step);
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status != ExecutionStatus.RUNNING;
    }

    public JobExecution copy() {
        return toBuilder()
                .resultData(resultData != null ? new LinkedHashMap<>(resultData) : null)
                .completedSteps(completedSteps != null ? new ArrayList<>(completedSteps) : new ArrayList<>())
                .stepOutputs(stepOutputs != null ? new LinkedHashMap<>(stepOutputs) : new LinkedHashMap<>())
                .build();
    }
}

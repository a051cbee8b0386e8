package com.taskdeck.scheduler.workflow;

import com.taskdeck.agent.runtime.ToolStepJournal;
import com.taskdeck.agent.tools.AgentTool;
import com.taskdeck.scheduler.model.JobExecution;
import com.taskdeck.scheduler.store.JobStore;
import com.taskdeck.scheduler.store.JobStoreException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Journals agent tool invocations into the step outputs of an execution, so a
 * resumed execution replays finished tool calls instead of repeating them.
 */
public class ExecutionToolJournal implements ToolStepJournal {

    static final String PREFIX = "tool:";

    private final JobStore store;
    private final String executionId;

    public ExecutionToolJournal(JobStore store, String executionId) {
        this.store = store;
        this.executionId = executionId;
    }

    @Override
    public Optional<AgentTool.ToolResult> lookup(String stepKey) {
        Object stored = load().getStepOutputs().get(PREFIX + stepKey);
        if (!(stored instanceof Map)) {
            return Optional.empty();
        }
        Map<?, ?> map = (Map<?, ?>) stored;
        return Optional.of(AgentTool.ToolResult.builder()
                .success(Boolean.TRUE.equals(map.get("success")))
                .output(map.get("output") != null ? String.valueOf(map.get("output")) : null)
                .error(map.get("error") != null ? String.valueOf(map.get("error")) : null)
                .build());
    }

    @Override
    public synchronized void record(String stepKey, AgentTool.ToolResult result) {
        JobExecution execution = load();
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("success", result.isSuccess());
        entry.put("output", result.getOutput());
        entry.put("error", result.getError());
        execution.getStepOutputs().put(PREFIX + stepKey, entry);
        store.updateExecution(execution);
    }

    private JobExecution load() {
        return store.getExecution(executionId)
                .orElseThrow(() -> new JobStoreException("Execution not found: " + executionId));
    }
}

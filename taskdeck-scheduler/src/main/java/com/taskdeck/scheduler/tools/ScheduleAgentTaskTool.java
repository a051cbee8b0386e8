package com.taskdeck.scheduler.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskdeck.agent.tools.AgentTool;
import com.taskdeck.agent.tools.ToolParamUtils;
import com.taskdeck.scheduler.ScheduledJobService;
import com.taskdeck.scheduler.model.ScheduledJob;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;

/**
 * Schedules work for the agent itself to carry out later.
 */
@Slf4j
public class ScheduleAgentTaskTool implements AgentTool {

    private final ScheduledJobService jobs;
    private final String linkedTaskId;

    public ScheduleAgentTaskTool(ScheduledJobService jobs, String linkedTaskId) {
        this.jobs = jobs;
        this.linkedTaskId = linkedTaskId;
    }

    @Override
    public String getName() {
        return "schedule_agent_task";
    }

    @Override
    public String getDescription() {
        return "Schedule a task for yourself to perform later, once (runAt) or on a cron schedule.";
    }

    @Override
    public JsonNode getParameterSchema() {
        ObjectNode schema = ToolParamUtils.objectSchema();
        ToolParamUtils.addProperty(schema, "title", "string", "Short title for the scheduled task");
        ToolParamUtils.addProperty(schema, "instruction", "string", "What to do when the task runs");
        ToolParamUtils.addProperty(schema, "runAt", "string", "When to run, ISO-8601 (one-time)");
        ToolParamUtils.addProperty(schema, "cronExpression", "string", "Cron expression (recurring)");
        ToolParamUtils.addProperty(schema, "taskId", "string", "Task to link the job to");
        ToolParamUtils.require(schema, "title", "instruction");
        return schema;
    }

    @Override
    public CompletableFuture<ToolResult> execute(ToolContext context) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                JsonNode params = context.getParameters();
                String title = ToolParamUtils.readStringParam(params, "title", true);
                String instruction = ToolParamUtils.readStringParam(params, "instruction", true);
                String taskId = ToolParamUtils.readStringParam(params, "taskId");

                ScheduledJob job = jobs.scheduleAgentTask(context.getAgentId(), title, instruction,
                        SchedulingParams.readRunAt(params),
                        ToolParamUtils.readStringParam(params, "cronExpression"),
                        taskId != null ? taskId : linkedTaskId);
                return ToolParamUtils.jsonResult(SchedulingParams.summary(job));
            } catch (IllegalArgumentException e) {
                return ToolResult.fail(e.getMessage());
            } catch (Exception e) {
                log.error("schedule_agent_task error: {}", e.getMessage(), e);
                return ToolResult.fail("Scheduling failed: " + e.getMessage());
            }
        });
    }
}

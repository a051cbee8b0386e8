package com.taskdeck.scheduler.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskdeck.agent.tools.AgentTool;
import com.taskdeck.agent.tools.ToolParamUtils;
import com.taskdeck.scheduler.ScheduledJobService;
import com.taskdeck.scheduler.model.ScheduledJob;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Schedules a notify job: a one-time reminder or a recurring one.
 */
@Slf4j
public class ScheduleReminderTool implements AgentTool {

    private final ScheduledJobService jobs;
    private final String linkedTaskId;

    public ScheduleReminderTool(ScheduledJobService jobs, String linkedTaskId) {
        this.jobs = jobs;
        this.linkedTaskId = linkedTaskId;
    }

    @Override
    public String getName() {
        return "schedule_reminder";
    }

    @Override
    public String getDescription() {
        return "Schedule a reminder for the user. Use runAt (ISO-8601) for a one-time reminder "
                + "or cronExpression (5 fields) for a recurring one.";
    }

    @Override
    public JsonNode getParameterSchema() {
        ObjectNode schema = ToolParamUtils.objectSchema();
        ToolParamUtils.addProperty(schema, "title", "string", "Short reminder title");
        ToolParamUtils.addProperty(schema, "message", "string", "Reminder text shown to the user");
        ToolParamUtils.addProperty(schema, "runAt", "string", "When to fire, ISO-8601 (one-time)");
        ToolParamUtils.addProperty(schema, "cronExpression", "string", "Cron expression (recurring)");
        ToolParamUtils.addProperty(schema, "taskId", "string", "Task to link the reminder to");
        ToolParamUtils.require(schema, "title");
        return schema;
    }

    @Override
    public CompletableFuture<ToolResult> execute(ToolContext context) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                JsonNode params = context.getParameters();
                String title = ToolParamUtils.readStringParam(params, "title", true);
                String message = ToolParamUtils.readStringParam(params, "message");
                Instant runAt = SchedulingParams.readRunAt(params);
                String cron = ToolParamUtils.readStringParam(params, "cronExpression");
                String taskId = ToolParamUtils.readStringParam(params, "taskId");

                ScheduledJob job = jobs.scheduleReminder(context.getAgentId(), title,
                        message != null ? message : title, runAt, cron,
                        taskId != null ? taskId : linkedTaskId);
                return ToolParamUtils.jsonResult(SchedulingParams.summary(job));
            } catch (IllegalArgumentException e) {
                return ToolResult.fail(e.getMessage());
            } catch (Exception e) {
                log.error("schedule_reminder error: {}", e.getMessage(), e);
                return ToolResult.fail("Scheduling failed: " + e.getMessage());
            }
        });
    }
}

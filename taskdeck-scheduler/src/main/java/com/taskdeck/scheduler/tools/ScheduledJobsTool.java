package com.taskdeck.scheduler.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskdeck.agent.tools.AgentTool;
import com.taskdeck.agent.tools.ToolParamUtils;
import com.taskdeck.scheduler.JobUpdate;
import com.taskdeck.scheduler.ScheduledJobService;
import com.taskdeck.scheduler.model.JobTypes.JobStatus;
import com.taskdeck.scheduler.model.ScheduledJob;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Lets the agent inspect and manage its own scheduled jobs.
 *
 * <p>
 * Actions: list, cancel, pause, resume, update. Jobs owned by another agent
 * are reported as not found.
 * </p>
 */
@Slf4j
public class ScheduledJobsTool implements AgentTool {

    private static final String[] ACTIONS = { "list", "cancel", "pause", "resume", "update" };

    private final ScheduledJobService jobs;

    public ScheduledJobsTool(ScheduledJobService jobs) {
        this.jobs = jobs;
    }

    @Override
    public String getName() {
        return "scheduled_jobs";
    }

    @Override
    public String getDescription() {
        return "Manage your scheduled jobs. Actions: list (optionally by status), cancel, pause, "
                + "resume (reactivates a paused job), update (title, runAt, cronExpression).";
    }

    @Override
    public JsonNode getParameterSchema() {
        ObjectNode schema = ToolParamUtils.objectSchema();
        ToolParamUtils.addEnumProperty(schema, "action", "Job action", ACTIONS);
        ToolParamUtils.addProperty(schema, "jobId", "string", "Job id (cancel, pause, resume, update)");
        ToolParamUtils.addEnumProperty(schema, "status", "Filter for list",
                "active", "paused", "completed", "cancelled");
        ToolParamUtils.addProperty(schema, "title", "string", "New title (update)");
        ToolParamUtils.addProperty(schema, "runAt", "string", "New one-time run, ISO-8601 (update)");
        ToolParamUtils.addProperty(schema, "cronExpression", "string", "New cron schedule (update)");
        ToolParamUtils.require(schema, "action");
        return schema;
    }

    @Override
    public CompletableFuture<ToolResult> execute(ToolContext context) {
        return CompletableFuture.supplyAsync(() -> doExecute(context));
    }

    private ToolResult doExecute(ToolContext context) {
        try {
            JsonNode params = context.getParameters();
            String action = ToolParamUtils.readStringParam(params, "action", true);
            String agentId = context.getAgentId();

            if ("list".equals(action)) {
                String rawStatus = ToolParamUtils.readStringParam(params, "status");
                JobStatus status = rawStatus != null ? JobStatus.fromKey(rawStatus) : null;
                if (rawStatus != null && status == null)
                    return ToolResult.fail("Invalid status: " + rawStatus);
                List<Map<String, Object>> list = jobs.listJobs(agentId, status, null).stream()
                        .map(ScheduledJobsTool::describe)
                        .collect(Collectors.toList());
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("success", true);
                payload.put("jobs", list);
                payload.put("count", list.size());
                return ToolParamUtils.jsonResult(payload);
            }

            String jobId = ToolParamUtils.readStringParam(params, "jobId", true);
            Optional<ScheduledJob> owned = jobs.getJob(jobId)
                    .filter(j -> agentId == null || agentId.equals(j.getAgentId()));
            if (owned.isEmpty())
                return ToolResult.fail("Job not found: " + jobId);

            Optional<ScheduledJob> result;
            switch (action) {
                case "cancel":
                    result = jobs.cancel(jobId);
                    break;
                case "pause":
                    result = jobs.pause(jobId);
                    break;
                case "resume":
                    result = jobs.reactivate(jobId);
                    break;
                case "update":
                    result = jobs.update(jobId, JobUpdate.builder()
                            .title(ToolParamUtils.readStringParam(params, "title"))
                            .runAt(SchedulingParams.readRunAt(params))
                            .cronExpression(ToolParamUtils.readStringParam(params, "cronExpression"))
                            .build());
                    break;
                default:
                    return ToolResult.fail("Unknown scheduled_jobs action: " + action);
            }
            if (result.isEmpty())
                return ToolResult.fail("Job not found: " + jobId);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("success", true);
            payload.put("job", describe(result.get()));
            return ToolParamUtils.jsonResult(payload);
        } catch (IllegalArgumentException | IllegalStateException e) {
            return ToolResult.fail(e.getMessage());
        } catch (Exception e) {
            log.error("scheduled_jobs error: {}", e.getMessage(), e);
            return ToolResult.fail("Scheduled jobs error: " + e.getMessage());
        }
    }

    private static Map<String, Object> describe(ScheduledJob job) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("id", job.getId());
        out.put("title", job.getTitle());
        out.put("actionType", job.getActionType());
        out.put("status", job.getStatus());
        out.put("scheduleType", job.getScheduleType());
        out.put("cronExpression", job.getCronExpression());
        out.put("nextRunAt", job.getNextRunAt());
        out.put("runCount", job.getRunCount());
        out.put("consecutiveFailures", job.getConsecutiveFailures());
        out.put("failureReason", job.getFailureReason());
        return out;
    }
}

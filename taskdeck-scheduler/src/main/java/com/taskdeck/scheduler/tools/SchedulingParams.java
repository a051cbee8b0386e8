package com.taskdeck.scheduler.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskdeck.agent.tools.ToolParamUtils;
import com.taskdeck.scheduler.model.ScheduledJob;
import com.taskdeck.scheduler.schedule.ScheduleTimes;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parameter reading shared by the scheduling tools.
 */
final class SchedulingParams {

    private SchedulingParams() {
    }

    static Instant readRunAt(JsonNode params) {
        String raw = ToolParamUtils.readStringParam(params, "runAt");
        if (raw == null)
            return null;
        Instant runAt = ScheduleTimes.parseAbsoluteTime(raw);
        if (runAt == null)
            throw new IllegalArgumentException("Invalid runAt: " + raw);
        return runAt;
    }

    static Map<String, Object> summary(ScheduledJob job) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("success", true);
        out.put("jobId", job.getId());
        out.put("title", job.getTitle());
        out.put("actionType", job.getActionType());
        out.put("scheduleType", job.getScheduleType());
        out.put("cronExpression", job.getCronExpression());
        out.put("nextRunAt", job.getNextRunAt());
        out.put("status", job.getStatus());
        return out;
    }
}

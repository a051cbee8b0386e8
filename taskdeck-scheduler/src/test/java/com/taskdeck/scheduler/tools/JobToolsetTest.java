package com.taskdeck.scheduler.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskdeck.agent.tools.AgentTool;
import com.taskdeck.agent.tools.AgentTool.ToolResult;
import com.taskdeck.agent.tools.ToolRegistry;
import com.taskdeck.scheduler.SchedulerFixture;
import com.taskdeck.scheduler.model.JobTypes.JobStatus;
import com.taskdeck.scheduler.model.ScheduledJob;
import com.taskdeck.scheduler.workspace.WorkspaceTypes.Task;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JobToolsetTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private SchedulerFixture fx;
    private Task linked;
    private ToolRegistry tools;

    @BeforeEach
    void setUp() {
        fx = new SchedulerFixture();
        linked = fx.tasks.createTask(Task.builder().agentId(SchedulerFixture.AGENT_ID).title("Launch").build());
        ScheduledJob job = fx.dueJob("agent_task", Map.of("instruction", "x"));
        tools = new JobToolset(fx.memory, fx.tasks, fx.jobs).create(job, "conv-1", linked.getId());
    }

    @Test
    void exposesTheAgentToolset() {
        assertEquals(List.of("memory_search", "task", "add_comment", "schedule_reminder",
                "schedule_agent_task", "scheduled_jobs"), new ArrayList<>(tools.getToolNames()));
        for (Map<String, Object> definition : tools.toDefinitions()) {
            assertNotNull(definition.get("input_schema"));
        }
    }

    @Test
    void memorySearch_findsSavedMemories() throws Exception {
        fx.memory.save(SchedulerFixture.AGENT_ID, "Sam prefers morning meetings");
        fx.memory.save("agent-2", "Someone else's morning routine");

        JsonNode out = json(call("memory_search", Map.of("query", "morning meetings")));

        assertEquals(1, out.get("count").asInt());
        assertEquals(1.0, out.get("results").get(0).get("score").asDouble());
    }

    @Test
    void taskTool_updatesOnlyOwnTasks() throws Exception {
        ToolResult updated = call("task", Map.of("action", "update", "taskId", linked.getId(), "status", "done"));
        assertTrue(updated.isSuccess());
        assertEquals("done", fx.tasks.getTask(linked.getId()).orElseThrow().getStatus());

        Task foreign = fx.tasks.createTask(Task.builder().agentId("agent-2").title("Theirs").build());
        ToolResult denied = call("task", Map.of("action", "get", "taskId", foreign.getId()));
        assertFalse(denied.isSuccess());

        ToolResult invalid = call("task", Map.of("action", "update", "taskId", linked.getId(), "status", "blocked"));
        assertEquals("Invalid status: blocked", invalid.getError());

        JsonNode listed = json(call("task", Map.of("action", "list", "status", "all")));
        assertEquals(1, listed.get("count").asInt());
    }

    @Test
    void addComment_defaultsToLinkedTask() {
        ToolResult result = call("add_comment", Map.of("content", "Kicked off vendor review"));

        assertTrue(result.isSuccess());
        assertEquals("Kicked off vendor review", fx.tasks.listComments(linked.getId()).get(0).getContent());
    }

    @Test
    void scheduleReminder_createsFollowUpForLinkedTask() throws Exception {
        JsonNode out = json(call("schedule_reminder",
                Map.of("title", "Check launch", "runAt", "2025-03-04T10:00:00Z")));

        ScheduledJob job = fx.jobs.getJob(out.get("jobId").asText()).orElseThrow();
        assertEquals("notify", job.getActionType());
        assertEquals(linked.getId(), job.getTaskId());
        assertEquals("Check launch", job.getActionPayload().get("message"));
        assertEquals("2025-03-04T10:00:00Z", job.getNextRunAt().toString());
    }

    @Test
    void scheduleReminder_reportsBadInput() {
        assertEquals("Invalid runAt: next tuesday",
                call("schedule_reminder", Map.of("title", "x", "runAt", "next tuesday")).getError());
        assertTrue(call("schedule_reminder", Map.of("title", "x")).getError().startsWith("Must provide either"));
        assertTrue(call("schedule_reminder", Map.of("title", "x", "cronExpression", "often")).getError()
                .startsWith("Invalid cron expression"));
    }

    @Test
    void scheduleAgentTask_createsAgentJob() throws Exception {
        JsonNode out = json(call("schedule_agent_task",
                Map.of("title", "Weekly digest", "instruction", "Summarize", "cronExpression", "0 17 * * 5")));

        ScheduledJob job = fx.jobs.getJob(out.get("jobId").asText()).orElseThrow();
        assertEquals("agent_task", job.getActionType());
        assertEquals("Summarize", job.getActionPayload().get("instruction"));
    }

    @Test
    void scheduledJobs_managesOwnJobsOnly() throws Exception {
        ScheduledJob own = fx.jobs.scheduleReminder(SchedulerFixture.AGENT_ID, "Mine", "m", null, "0 9 * * *", null);
        ScheduledJob other = fx.jobs.scheduleReminder("agent-2", "Theirs", "t", null, "0 9 * * *", null);

        assertTrue(call("scheduled_jobs", Map.of("action", "pause", "jobId", own.getId())).isSuccess());
        assertEquals(JobStatus.PAUSED, fx.jobs.getJob(own.getId()).orElseThrow().getStatus());

        ToolResult again = call("scheduled_jobs", Map.of("action", "pause", "jobId", own.getId()));
        assertTrue(again.getError().startsWith("Cannot pause job"));

        assertTrue(call("scheduled_jobs", Map.of("action", "resume", "jobId", own.getId())).isSuccess());
        assertEquals(JobStatus.ACTIVE, fx.jobs.getJob(own.getId()).orElseThrow().getStatus());

        ToolResult foreign = call("scheduled_jobs", Map.of("action", "cancel", "jobId", other.getId()));
        assertEquals("Job not found: " + other.getId(), foreign.getError());
        assertEquals(JobStatus.ACTIVE, fx.jobs.getJob(other.getId()).orElseThrow().getStatus());

        JsonNode listed = json(call("scheduled_jobs", Map.of("action", "list", "status", "active")));
        assertEquals(2, listed.get("count").asInt());
    }

    private ToolResult call(String name, Map<String, Object> params) {
        AgentTool tool = tools.get(name).orElseThrow();
        return tool.execute(AgentTool.ToolContext.builder()
                .parameters(MAPPER.valueToTree(params))
                .agentId(SchedulerFixture.AGENT_ID)
                .runId("run-1")
                .build()).join();
    }

    private static JsonNode json(ToolResult result) throws Exception {
        assertTrue(result.isSuccess(), result.getError());
        return MAPPER.readTree(result.getOutput());
    }
}

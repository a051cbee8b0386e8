package com.taskdeck.scheduler.action;

import com.taskdeck.agent.models.ModelProvider;
import com.taskdeck.scheduler.SchedulerFixture;
import com.taskdeck.scheduler.ScriptedModelProvider;
import com.taskdeck.scheduler.model.JobExecution;
import com.taskdeck.scheduler.model.JobTypes.ExecutionStatus;
import com.taskdeck.scheduler.model.ScheduledJob;
import com.taskdeck.scheduler.workflow.WorkflowRunner;
import com.taskdeck.scheduler.workspace.WorkspaceTypes.Message;
import com.taskdeck.scheduler.workspace.WorkspaceTypes.Notification;
import com.taskdeck.scheduler.workspace.WorkspaceTypes.Task;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.taskdeck.scheduler.ScriptedModelProvider.text;
import static com.taskdeck.scheduler.ScriptedModelProvider.toolCall;
import static org.junit.jupiter.api.Assertions.*;

class AgentTaskActionTest {

    @Test
    void agentRun_createsConversationToolEffectsAndCompletionNotice() {
        ScriptedModelProvider provider = new ScriptedModelProvider(turn -> turn == 0
                ? toolCall("t0", "task", Map.of("action", "create", "title", "Prepare Q2 plan"))
                : text("Created the Q2 planning task."));
        SchedulerFixture fx = new SchedulerFixture(provider, 5);
        ScheduledJob job = fx.dueJob("agent_task", Map.of("instruction", "Set up quarterly planning"));

        WorkflowRunner.WorkflowResult result = fx.runner.run(job.getId());

        assertTrue(result.success(), result.error());
        assertEquals(1, result.data().get("toolInvocations"));
        List<Task> tasks = fx.tasks.listTasks(SchedulerFixture.AGENT_ID, null, 10);
        assertEquals(1, tasks.size());
        assertEquals("Prepare Q2 plan", tasks.get(0).getTitle());

        List<Message> messages = fx.conversations.allMessages();
        assertEquals(2, messages.size());
        assertEquals("[Scheduled Task: Job agent_task]\n\nSet up quarterly planning", messages.get(0).getContent());
        assertEquals("Created the Q2 planning task.", messages.get(1).getContent());
        assertEquals("Scheduled: Job agent_task",
                fx.conversations.getConversation(messages.get(0).getConversationId()).orElseThrow().getTitle());

        List<Notification> notifications = fx.notifications.listNotifications(SchedulerFixture.AGENT_ID);
        assertEquals(1, notifications.size());
        assertEquals("task_update", notifications.get(0).getType());
        assertEquals("cron_execution", fx.activity.list(SchedulerFixture.AGENT_ID).get(0).getType());

        ModelProvider.ChatRequest first = provider.getRequests().get(0);
        assertTrue(first.getSystemPrompt().contains("You are Ada"));
        assertEquals(6, first.getTools().size());

        JobExecution execution = fx.store.getExecution(result.executionId()).orElseThrow();
        assertTrue(execution.getStepOutputs().keySet().stream().anyMatch(k -> k.startsWith("tool:tool-1:task:")));
    }

    @Test
    void toolHungryAgent_failsAtStepBudget() {
        ScriptedModelProvider provider = new ScriptedModelProvider(
                turn -> toolCall("t" + turn, "memory_search", Map.of("query", "anything")));
        SchedulerFixture fx = new SchedulerFixture(provider, 3);
        ScheduledJob job = fx.dueJob("agent_task", Map.of("instruction", "Loop forever"));

        WorkflowRunner.WorkflowResult result = fx.runner.run(job.getId());

        assertFalse(result.success());
        assertTrue(result.error().startsWith("Agent failed:"));
        assertTrue(result.error().contains("tool steps"));
        assertEquals(4, provider.getRequests().size());
        JobExecution execution = fx.store.getExecution(result.executionId()).orElseThrow();
        assertEquals(ExecutionStatus.FAILED, execution.getStatus());
        assertEquals(1, fx.store.getJob(job.getId()).orElseThrow().getConsecutiveFailures());

        List<Message> messages = fx.conversations.allMessages();
        assertTrue(messages.get(messages.size() - 1).getContent().startsWith("I encountered an error"));
        assertTrue(fx.notifications.listNotifications(SchedulerFixture.AGENT_ID).isEmpty());
    }

    @Test
    void unknownAgent_failsWithoutCallingModel() {
        ScriptedModelProvider provider = new ScriptedModelProvider(turn -> text("unused"));
        SchedulerFixture fx = new SchedulerFixture(provider, 3);
        ScheduledJob job = fx.dueJob("agent_task", Map.of("instruction", "x"));
        fx.store.updateJob(job.getId(), j -> j.setAgentId("ghost"));

        WorkflowRunner.WorkflowResult result = fx.runner.run(job.getId());

        assertFalse(result.success());
        assertEquals("Agent not found", result.error());
        assertTrue(provider.getRequests().isEmpty());
    }
}

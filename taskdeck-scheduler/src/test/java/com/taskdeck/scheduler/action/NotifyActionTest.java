package com.taskdeck.scheduler.action;

import com.taskdeck.agent.runtime.ToolStepJournal;
import com.taskdeck.scheduler.SchedulerFixture;
import com.taskdeck.scheduler.model.ScheduledJob;
import com.taskdeck.scheduler.workspace.WorkspaceTypes.Conversation;
import com.taskdeck.scheduler.workspace.WorkspaceTypes.Task;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NotifyActionTest {

    private SchedulerFixture fx;
    private NotifyAction action;

    @BeforeEach
    void setUp() {
        fx = new SchedulerFixture();
        action = new NotifyAction(fx.conversations, fx.notifications, fx.tasks);
    }

    @Test
    void linkedTask_enrichesMessageWithTitleAndDueDate() {
        Task task = fx.tasks.createTask(Task.builder()
                .agentId(SchedulerFixture.AGENT_ID)
                .title("File taxes")
                .dueDate(Instant.parse("2025-04-15T12:00:00Z"))
                .build());
        ScheduledJob job = fx.dueJob("notify", Map.of("message", "ignored", "taskId", task.getId()));

        ActionResult result = action.execute(job, ActionPayload.NotifyPayload.from(job.getActionPayload()),
                new ActionContext("exec-1", ToolStepJournal.NOOP));

        assertTrue(result.isSuccess());
        assertEquals("**Reminder:** Job notify\n**Task:** File taxes\n**Due:** 2025-04-15",
                result.getData().get("message"));
    }

    @Test
    void linkedConversation_isUsedWhenPresent() {
        Conversation existing = fx.conversations.createConversation(SchedulerFixture.AGENT_ID, "Planning", "k1");
        ScheduledJob job = fx.dueJob("notify", Map.of("message", "Standup"));
        job.setConversationId(existing.getId());

        ActionResult result = action.execute(job, ActionPayload.NotifyPayload.from(job.getActionPayload()),
                new ActionContext("exec-1", ToolStepJournal.NOOP));

        assertEquals(existing.getId(), result.getData().get("conversationId"));
    }

    @Test
    void repeatedDeliveryForSameExecution_isDeduplicated() {
        ScheduledJob job = fx.dueJob("notify", Map.of("message", "Water plants"));
        ActionContext ctx = new ActionContext("exec-1", ToolStepJournal.NOOP);

        action.execute(job, ActionPayload.NotifyPayload.from(job.getActionPayload()), ctx);
        action.execute(job, ActionPayload.NotifyPayload.from(job.getActionPayload()), ctx);

        assertEquals(1, fx.conversations.allMessages().size());
        assertEquals(1, fx.notifications.listNotifications(SchedulerFixture.AGENT_ID).size());
    }

    @Test
    void longContent_isTruncatedInNotification() {
        ScheduledJob job = fx.dueJob("notify", Map.of("message", "x".repeat(400)));

        action.execute(job, ActionPayload.NotifyPayload.from(job.getActionPayload()),
                new ActionContext("exec-1", ToolStepJournal.NOOP));

        assertEquals(NotifyAction.NOTIFICATION_PREVIEW_CHARS,
                fx.notifications.listNotifications(SchedulerFixture.AGENT_ID).get(0).getContent().length());
    }
}

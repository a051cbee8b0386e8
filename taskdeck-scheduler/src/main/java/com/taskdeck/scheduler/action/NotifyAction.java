package com.taskdeck.scheduler.action;

import com.taskdeck.scheduler.action.ActionPayload.NotifyPayload;
import com.taskdeck.scheduler.model.ScheduledJob;
import com.taskdeck.scheduler.workspace.ConversationStore;
import com.taskdeck.scheduler.workspace.NotificationSink;
import com.taskdeck.scheduler.workspace.TaskStore;
import com.taskdeck.scheduler.workspace.WorkspaceTypes.Conversation;
import com.taskdeck.scheduler.workspace.WorkspaceTypes.Task;
import lombok.extern.slf4j.Slf4j;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Posts a reminder into the agent's conversation and raises a notification
 * pointing at it.
 */
@Slf4j
public class NotifyAction {

    static final String FALLBACK_CONVERSATION_TITLE = "Notifications";
    static final int NOTIFICATION_PREVIEW_CHARS = 200;

    private final ConversationStore conversations;
    private final NotificationSink notifications;
    private final TaskStore tasks;

    public NotifyAction(ConversationStore conversations, NotificationSink notifications, TaskStore tasks) {
        this.conversations = conversations;
        this.notifications = notifications;
        this.tasks = tasks;
    }

    public ActionResult execute(ScheduledJob job, NotifyPayload payload, ActionContext ctx) {
        String content = composeContent(job, payload);

        Conversation conversation = resolveConversation(job, ctx);
        if (conversation == null) {
            return ActionResult.fail("Could not find or create conversation");
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("type", "scheduled_notification");
        metadata.put("job_id", job.getId());
        conversations.insertMessage(conversation.getId(), "assistant", content, metadata, ctx.key("notify:message"));

        notifications.createNotification(job.getAgentId(), "reminder", job.getTitle(),
                truncate(content, NOTIFICATION_PREVIEW_CHARS), "conversation", conversation.getId(),
                ctx.key("notify:notification"));

        log.debug("Reminder for job {} posted to conversation {}", job.getId(), conversation.getId());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("conversationId", conversation.getId());
        data.put("message", content);
        return ActionResult.ok(data);
    }

    String composeContent(ScheduledJob job, NotifyPayload payload) {
        String message = payload.message() != null ? payload.message() : job.getTitle();
        String content = "**Reminder:** " + message;

        String taskId = payload.taskId() != null ? payload.taskId() : job.getTaskId();
        if (taskId == null) {
            return content;
        }
        Optional<Task> task = tasks.getTask(taskId);
        if (task.isEmpty()) {
            return content;
        }
        content = "**Reminder:** " + job.getTitle() + "\n**Task:** " + task.get().getTitle();
        if (task.get().getDueDate() != null) {
            content += "\n**Due:** " + DateTimeFormatter.ISO_LOCAL_DATE
                    .format(task.get().getDueDate().atZone(zoneOf(job)));
        }
        return content;
    }

    private Conversation resolveConversation(ScheduledJob job, ActionContext ctx) {
        if (job.getConversationId() != null) {
            Optional<Conversation> linked = conversations.getConversation(job.getConversationId());
            if (linked.isPresent()) {
                return linked.get();
            }
            log.warn("Job {} links missing conversation {}, falling back to latest active",
                    job.getId(), job.getConversationId());
        }
        return conversations.findOrCreateActiveConversation(job.getAgentId(), FALLBACK_CONVERSATION_TITLE,
                ctx.key("notify:conversation"));
    }

    private static ZoneId zoneOf(ScheduledJob job) {
        try {
            return job.getTimezone() != null ? ZoneId.of(job.getTimezone()) : ZoneOffset.UTC;
        } catch (java.time.DateTimeException e) {
            return ZoneOffset.UTC;
        }
    }

    static String truncate(String s, int max) {
        if (s == null || s.length() <= max)
            return s;
        return s.substring(0, max);
    }
}

package com.taskdeck.scheduler.action;

import com.taskdeck.agent.runtime.AgentBudgetExceededException;
import com.taskdeck.agent.runtime.AgentRunException;
import com.taskdeck.agent.runtime.BoundedAgentRunner;
import com.taskdeck.scheduler.action.ActionPayload.AgentTaskPayload;
import com.taskdeck.scheduler.model.ScheduledJob;
import com.taskdeck.scheduler.workspace.ActivityLog;
import com.taskdeck.scheduler.workspace.AgentDirectory;
import com.taskdeck.scheduler.workspace.ConversationStore;
import com.taskdeck.scheduler.workspace.NotificationSink;
import com.taskdeck.scheduler.workspace.WorkspaceTypes.AgentProfile;
import com.taskdeck.scheduler.workspace.WorkspaceTypes.Conversation;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the owning agent on the job's instruction in a fresh conversation,
 * under the step and token ceilings of {@link BoundedAgentRunner}.
 */
@Slf4j
public class AgentTaskAction {

    static final String DEFAULT_INSTRUCTION = "Execute scheduled task";
    static final int RESPONSE_PREVIEW_CHARS = 500;

    private final AgentDirectory agents;
    private final ConversationStore conversations;
    private final NotificationSink notifications;
    private final ActivityLog activity;
    private final BoundedAgentRunner runner;
    private final AgentToolset toolset;
    private final Clock clock;

    public AgentTaskAction(AgentDirectory agents, ConversationStore conversations, NotificationSink notifications,
            ActivityLog activity, BoundedAgentRunner runner, AgentToolset toolset, Clock clock) {
        this.agents = agents;
        this.conversations = conversations;
        this.notifications = notifications;
        this.activity = activity;
        this.runner = runner;
        this.toolset = toolset;
        this.clock = clock;
    }

    public ActionResult execute(ScheduledJob job, AgentTaskPayload payload, ActionContext ctx) {
        String instruction = firstNonBlank(payload.instruction(), job.getDescription(), DEFAULT_INSTRUCTION);

        Optional<AgentProfile> agent = agents.findAgent(job.getAgentId());
        if (agent.isEmpty()) {
            return ActionResult.fail("Agent not found");
        }

        Conversation conversation = conversations.createConversation(job.getAgentId(),
                "Scheduled: " + job.getTitle(), ctx.key("agent:conversation"));
        String userMessage = "[Scheduled Task: " + job.getTitle() + "]\n\n" + instruction;
        conversations.insertMessage(conversation.getId(), "user", userMessage, metadata(job, false),
                ctx.key("agent:user"));

        String linkedTaskId = payload.taskId() != null ? payload.taskId() : job.getTaskId();
        BoundedAgentRunner.AgentRunResult run;
        try {
            run = runner.run(BoundedAgentRunner.AgentRunRequest.builder()
                    .runId(ctx.executionId())
                    .agentId(job.getAgentId())
                    .systemPrompt(buildSystemPrompt(agent.get()))
                    .userMessage(userMessage)
                    .tools(toolset.create(job, conversation.getId(), linkedTaskId))
                    .journal(ctx.journal())
                    .build());
        } catch (AgentBudgetExceededException | AgentRunException e) {
            log.warn("Agent run for job {} failed: {}", job.getId(), e.getMessage());
            conversations.insertMessage(conversation.getId(), "assistant",
                    "I encountered an error while executing this scheduled task: " + e.getMessage(),
                    metadata(job, true), ctx.key("agent:error"));
            return ActionResult.fail("Agent failed: " + e.getMessage());
        }

        String response = run.getFinalText() == null || run.getFinalText().isBlank()
                ? "Task completed."
                : run.getFinalText();
        log.info("Agent completed job {} with {} tool calls and {} tokens",
                job.getId(), run.getToolInvocations(), run.getTokensUsed());

        conversations.insertMessage(conversation.getId(), "assistant", response, metadata(job, false),
                ctx.key("agent:response"));

        Map<String, Object> activityMeta = new LinkedHashMap<>();
        activityMeta.put("jobId", job.getId());
        activityMeta.put("conversationId", conversation.getId());
        activityMeta.put("status", "completed");
        activity.record(job.getAgentId(), "cron_execution",
                "Completed: " + job.getTitle() + " - " + NotifyAction.truncate(response, 200), activityMeta);

        notifications.createNotification(job.getAgentId(), "task_update",
                "Scheduled task completed: " + job.getTitle(),
                NotifyAction.truncate(response, NotifyAction.NOTIFICATION_PREVIEW_CHARS),
                "conversation", conversation.getId(), ctx.key("agent:notification"));

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("conversationId", conversation.getId());
        data.put("instruction", instruction);
        data.put("response", NotifyAction.truncate(response, RESPONSE_PREVIEW_CHARS));
        data.put("toolInvocations", run.getToolInvocations());
        data.put("tokensUsed", run.getTokensUsed());
        return ActionResult.ok(data);
    }

    String buildSystemPrompt(AgentProfile agent) {
        StringBuilder sb = new StringBuilder();
        sb.append("You are ").append(agent.getName() != null ? agent.getName() : "an assistant");
        sb.append(", working for ").append(agent.getOwnerName() != null ? agent.getOwnerName() : "User").append(".\n");
        if (agent.getPersona() != null && !agent.getPersona().isBlank()) {
            sb.append(agent.getPersona().trim()).append("\n");
        }
        sb.append("\nCurrent time: ").append(clock.instant());
        if (agent.getTimezone() != null) {
            sb.append(" (user timezone: ").append(agent.getTimezone()).append(")");
        }
        sb.append("\n\nYou are running a scheduled task without a human in the loop. ")
                .append("Use your tools to complete it, then reply with a short summary of what you did.");
        return sb.toString();
    }

    private static Map<String, Object> metadata(ScheduledJob job, boolean error) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("type", "scheduled_agent_task");
        metadata.put("job_id", job.getId());
        if (error) {
            metadata.put("error", true);
        }
        return metadata;
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank())
                return v;
        }
        return null;
    }
}

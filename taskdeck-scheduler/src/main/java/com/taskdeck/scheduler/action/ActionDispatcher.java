package com.taskdeck.scheduler.action;

import com.taskdeck.scheduler.action.ActionPayload.AgentTaskPayload;
import com.taskdeck.scheduler.action.ActionPayload.NotifyPayload;
import com.taskdeck.scheduler.action.ActionPayload.WebhookPayload;
import com.taskdeck.scheduler.model.ScheduledJob;

/**
 * Routes a job to the handler of its action kind.
 */
public class ActionDispatcher {

    private final NotifyAction notifyAction;
    private final AgentTaskAction agentTaskAction;
    private final WebhookAction webhookAction;

    public ActionDispatcher(NotifyAction notifyAction, AgentTaskAction agentTaskAction, WebhookAction webhookAction) {
        this.notifyAction = notifyAction;
        this.agentTaskAction = agentTaskAction;
        this.webhookAction = webhookAction;
    }

    /**
     * Run the job's action. An unrecognized action type is a failure.
     */
    public ActionResult dispatch(ScheduledJob job, ActionContext ctx) {
        ActionKind kind = ActionKind.fromKey(job.getActionType());
        if (kind == null) {
            return ActionResult.fail("Unknown action type: " + job.getActionType());
        }
        switch (kind) {
            case NOTIFY:
                return notifyAction.execute(job, NotifyPayload.from(job.getActionPayload()), ctx);
            case AGENT_TASK:
                if (agentTaskAction == null) {
                    return ActionResult.fail("Agent tasks are not configured");
                }
                return agentTaskAction.execute(job, AgentTaskPayload.from(job.getActionPayload()), ctx);
            case WEBHOOK:
                return webhookAction.execute(job, WebhookPayload.from(job.getActionPayload()), ctx);
            default:
                return ActionResult.fail("Unknown action type: " + job.getActionType());
        }
    }
}

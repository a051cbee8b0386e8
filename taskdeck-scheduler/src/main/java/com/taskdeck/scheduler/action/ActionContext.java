package com.taskdeck.scheduler.action;

import com.taskdeck.agent.runtime.ToolStepJournal;

/**
 * Per-execution inputs shared by all actions.
 *
 * @param executionId id of the running execution; idempotency keys of every
 *                    write an action makes derive from it
 * @param journal     durable record of agent tool invocations
 */
public record ActionContext(String executionId, ToolStepJournal journal) {

    public String key(String suffix) {
        return executionId + ":" + suffix;
    }
}

package com.taskdeck.scheduler.action;

import com.taskdeck.agent.tools.ToolRegistry;
import com.taskdeck.scheduler.model.ScheduledJob;

/**
 * Builds the tools an agent may call while running a scheduled task.
 */
@FunctionalInterface
public interface AgentToolset {

    ToolRegistry create(ScheduledJob job, String conversationId, String linkedTaskId);
}

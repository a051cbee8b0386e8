package com.taskdeck.scheduler.tools;

import com.taskdeck.agent.tools.ToolRegistry;
import com.taskdeck.scheduler.ScheduledJobService;
import com.taskdeck.scheduler.action.AgentToolset;
import com.taskdeck.scheduler.model.ScheduledJob;
import com.taskdeck.scheduler.workspace.MemoryIndex;
import com.taskdeck.scheduler.workspace.TaskStore;

import java.util.List;

/**
 * Tools available to an agent while it runs a scheduled task.
 */
public class JobToolset implements AgentToolset {

    private final MemoryIndex memory;
    private final TaskStore tasks;
    private final ScheduledJobService jobs;

    public JobToolset(MemoryIndex memory, TaskStore tasks, ScheduledJobService jobs) {
        this.memory = memory;
        this.tasks = tasks;
        this.jobs = jobs;
    }

    @Override
    public ToolRegistry create(ScheduledJob job, String conversationId, String linkedTaskId) {
        ToolRegistry registry = new ToolRegistry();
        registry.registerAll(List.of(
                new MemorySearchTool(memory),
                new TaskTool(tasks),
                new AddCommentTool(tasks, linkedTaskId),
                new ScheduleReminderTool(jobs, linkedTaskId),
                new ScheduleAgentTaskTool(jobs, linkedTaskId),
                new ScheduledJobsTool(jobs)));
        return registry;
    }
}

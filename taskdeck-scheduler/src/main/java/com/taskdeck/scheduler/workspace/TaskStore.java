package com.taskdeck.scheduler.workspace;

import com.taskdeck.scheduler.workspace.WorkspaceTypes.Task;
import com.taskdeck.scheduler.workspace.WorkspaceTypes.TaskComment;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Task board of an agent.
 */
public interface TaskStore {

    Optional<Task> getTask(String taskId);

    /**
     * Create a task. Creating the same title and description twice for one
     * agent returns the existing task.
     */
    Task createTask(Task task);

    Optional<Task> updateTask(String taskId, Consumer<Task> mutation);

    /** Tasks of an agent, newest first; a null status matches all. */
    List<Task> listTasks(String agentId, String status, int limit);

    TaskComment addComment(String taskId, String agentId, String content);

    List<TaskComment> listComments(String taskId);
}

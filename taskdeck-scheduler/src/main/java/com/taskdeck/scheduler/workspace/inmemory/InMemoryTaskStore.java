package com.taskdeck.scheduler.workspace.inmemory;

import com.taskdeck.scheduler.workspace.TaskStore;
import com.taskdeck.scheduler.workspace.WorkspaceTypes.Task;
import com.taskdeck.scheduler.workspace.WorkspaceTypes.TaskComment;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.stream.Collectors;

public class InMemoryTaskStore implements TaskStore {

    private final Map<String, Task> tasks = new LinkedHashMap<>();
    private final List<TaskComment> comments = new ArrayList<>();
    private final Clock clock;

    public InMemoryTaskStore() {
        this(Clock.systemUTC());
    }

    public InMemoryTaskStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized Optional<Task> getTask(String taskId) {
        Task task = tasks.get(taskId);
        return Optional.ofNullable(task != null ? task.toBuilder().build() : null);
    }

    @Override
    public synchronized Task createTask(Task task) {
        Optional<Task> existing = tasks.values().stream()
                .filter(t -> Objects.equals(t.getAgentId(), task.getAgentId())
                        && Objects.equals(t.getTitle(), task.getTitle())
                        && Objects.equals(t.getDescription(), task.getDescription()))
                .findFirst();
        if (existing.isPresent()) {
            return existing.get().toBuilder().build();
        }
        Instant now = clock.instant();
        Task stored = task.toBuilder()
                .id(UUID.randomUUID().toString())
                .status(task.getStatus() != null ? task.getStatus() : "todo")
                .priority(task.getPriority() != null ? task.getPriority() : "medium")
                .createdAt(now)
                .updatedAt(now)
                .build();
        tasks.put(stored.getId(), stored);
        return stored.toBuilder().build();
    }

    @Override
    public synchronized Optional<Task> updateTask(String taskId, Consumer<Task> mutation) {
        Task current = tasks.get(taskId);
        if (current == null) {
            return Optional.empty();
        }
        Task next = current.toBuilder().build();
        mutation.accept(next);
        next.setId(taskId);
        next.setUpdatedAt(clock.instant());
        tasks.put(taskId, next);
        return Optional.of(next.toBuilder().build());
    }

    @Override
    public synchronized List<Task> listTasks(String agentId, String status, int limit) {
        return tasks.values().stream()
                .filter(t -> agentId == null || agentId.equals(t.getAgentId()))
                .filter(t -> status == null || status.equals(t.getStatus()))
                .sorted(Comparator.comparing(Task::getCreatedAt).reversed())
                .limit(Math.max(0, limit))
                .map(t -> t.toBuilder().build())
                .collect(Collectors.toList());
    }

    @Override
    public synchronized TaskComment addComment(String taskId, String agentId, String content) {
        if (!tasks.containsKey(taskId)) {
            throw new IllegalArgumentException("Task not found: " + taskId);
        }
        TaskComment comment = TaskComment.builder()
                .id(UUID.randomUUID().toString())
                .taskId(taskId)
                .agentId(agentId)
                .content(content)
                .createdAt(clock.instant())
                .build();
        comments.add(comment);
        return comment;
    }

    @Override
    public synchronized List<TaskComment> listComments(String taskId) {
        return comments.stream()
                .filter(c -> taskId.equals(c.getTaskId()))
                .collect(Collectors.toList());
    }
}

package com.taskdeck.scheduler.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskdeck.agent.tools.AgentTool;
import com.taskdeck.agent.tools.ToolParamUtils;
import com.taskdeck.scheduler.workspace.TaskStore;
import com.taskdeck.scheduler.workspace.WorkspaceTypes.Task;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Task tool: create, update, get and list tasks on the agent's board.
 */
@Slf4j
public class TaskTool implements AgentTool {

    private static final String[] ACTIONS = { "create", "update", "get", "list" };
    private static final Set<String> STATUSES = Set.of("todo", "in_progress", "waiting_on", "done");
    private static final Set<String> PRIORITIES = Set.of("high", "medium", "low");

    private final TaskStore tasks;

    public TaskTool(TaskStore tasks) {
        this.tasks = tasks;
    }

    @Override
    public String getName() {
        return "task";
    }

    @Override
    public String getDescription() {
        return "Manage tasks. Actions: create, update (status, priority, title, description), get, list.";
    }

    @Override
    public JsonNode getParameterSchema() {
        ObjectNode schema = ToolParamUtils.objectSchema();
        ToolParamUtils.addEnumProperty(schema, "action", "Task action", ACTIONS);
        ToolParamUtils.addProperty(schema, "taskId", "string", "Task id (update, get)");
        ToolParamUtils.addProperty(schema, "title", "string", "Task title");
        ToolParamUtils.addProperty(schema, "description", "string", "Task description");
        ToolParamUtils.addEnumProperty(schema, "status", "Task status", "todo", "in_progress", "waiting_on", "done");
        ToolParamUtils.addEnumProperty(schema, "priority", "Task priority", "high", "medium", "low");
        ToolParamUtils.addProperty(schema, "limit", "number", "Maximum tasks to list (default 20)");
        ToolParamUtils.require(schema, "action");
        return schema;
    }

    @Override
    public CompletableFuture<ToolResult> execute(ToolContext context) {
        return CompletableFuture.supplyAsync(() -> doExecute(context));
    }

    private ToolResult doExecute(ToolContext context) {
        try {
            JsonNode params = context.getParameters();
            String action = ToolParamUtils.readStringParam(params, "action", true);
            String agentId = context.getAgentId();

            switch (action) {
                case "create": {
                    String title = ToolParamUtils.readStringParam(params, "title", true);
                    String priority = checked(ToolParamUtils.readStringParam(params, "priority"), PRIORITIES, "priority");
                    Task task = tasks.createTask(Task.builder()
                            .agentId(agentId)
                            .title(title)
                            .description(ToolParamUtils.readStringParam(params, "description"))
                            .priority(priority)
                            .build());
                    return ToolParamUtils.jsonResult(Map.of("success", true, "task", task));
                }
                case "update": {
                    String taskId = ToolParamUtils.readStringParam(params, "taskId", true);
                    Optional<Task> existing = ownTask(taskId, agentId);
                    if (existing.isEmpty())
                        return ToolResult.fail("Task not found: " + taskId);
                    String status = checked(ToolParamUtils.readStringParam(params, "status"), STATUSES, "status");
                    String priority = checked(ToolParamUtils.readStringParam(params, "priority"), PRIORITIES, "priority");
                    String title = ToolParamUtils.readStringParam(params, "title");
                    String description = ToolParamUtils.readStringParam(params, "description");
                    Optional<Task> updated = tasks.updateTask(taskId, t -> {
                        if (status != null)
                            t.setStatus(status);
                        if (priority != null)
                            t.setPriority(priority);
                        if (title != null)
                            t.setTitle(title);
                        if (description != null)
                            t.setDescription(description);
                    });
                    return ToolParamUtils.jsonResult(Map.of("success", true, "task", updated.orElseThrow()));
                }
                case "get": {
                    String taskId = ToolParamUtils.readStringParam(params, "taskId", true);
                    Optional<Task> task = ownTask(taskId, agentId);
                    if (task.isEmpty())
                        return ToolResult.fail("Task not found: " + taskId);
                    return ToolParamUtils.jsonResult(Map.of("success", true, "task", task.get()));
                }
                case "list": {
                    String status = ToolParamUtils.readStringParam(params, "status");
                    if ("all".equals(status))
                        status = null;
                    List<Task> list = tasks.listTasks(agentId, checked(status, STATUSES, "status"),
                            ToolParamUtils.readIntParam(params, "limit", 20));
                    Map<String, Object> payload = new LinkedHashMap<>();
                    payload.put("success", true);
                    payload.put("tasks", list);
                    payload.put("count", list.size());
                    return ToolParamUtils.jsonResult(payload);
                }
                default:
                    return ToolResult.fail("Unknown task action: " + action);
            }
        } catch (IllegalArgumentException e) {
            return ToolResult.fail(e.getMessage());
        } catch (Exception e) {
            log.error("task tool error: {}", e.getMessage(), e);
            return ToolResult.fail("Task tool error: " + e.getMessage());
        }
    }

    private Optional<Task> ownTask(String taskId, String agentId) {
        return tasks.getTask(taskId).filter(t -> agentId == null || agentId.equals(t.getAgentId()));
    }

    private static String checked(String value, Set<String> allowed, String field) {
        if (value != null && !allowed.contains(value))
            throw new IllegalArgumentException("Invalid " + field + ": " + value);
        return value;
    }
}

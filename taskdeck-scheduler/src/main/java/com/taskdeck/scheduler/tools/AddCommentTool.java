package com.taskdeck.scheduler.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskdeck.agent.tools.AgentTool;
import com.taskdeck.agent.tools.ToolParamUtils;
import com.taskdeck.scheduler.workspace.TaskStore;
import com.taskdeck.scheduler.workspace.WorkspaceTypes.TaskComment;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Comments on a task, by default the one the scheduled job is linked to.
 */
@Slf4j
public class AddCommentTool implements AgentTool {

    private final TaskStore tasks;
    private final String linkedTaskId;

    public AddCommentTool(TaskStore tasks, String linkedTaskId) {
        this.tasks = tasks;
        this.linkedTaskId = linkedTaskId;
    }

    @Override
    public String getName() {
        return "add_comment";
    }

    @Override
    public String getDescription() {
        return "Add a comment to a task to log progress or notes. Defaults to the task linked to this job.";
    }

    @Override
    public JsonNode getParameterSchema() {
        ObjectNode schema = ToolParamUtils.objectSchema();
        ToolParamUtils.addProperty(schema, "targetTaskId", "string",
                "Task id to comment on. If not provided, uses the linked task.");
        ToolParamUtils.addProperty(schema, "content", "string", "Comment text");
        ToolParamUtils.require(schema, "content");
        return schema;
    }

    @Override
    public CompletableFuture<ToolResult> execute(ToolContext context) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                JsonNode params = context.getParameters();
                String content = ToolParamUtils.readStringParam(params, "content", true);
                String target = ToolParamUtils.readStringParam(params, "targetTaskId");
                String taskId = target != null ? target : linkedTaskId;
                if (taskId == null)
                    return ToolResult.fail("No task specified");

                TaskComment comment = tasks.addComment(taskId, context.getAgentId(), content);
                return ToolParamUtils.jsonResult(Map.of("success", true, "commentId", comment.getId()));
            } catch (IllegalArgumentException e) {
                return ToolResult.fail(e.getMessage());
            } catch (Exception e) {
                log.error("add_comment error: {}", e.getMessage(), e);
                return ToolResult.fail("Comment failed: " + e.getMessage());
            }
        });
    }
}

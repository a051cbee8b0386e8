package com.taskdeck.scheduler.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskdeck.agent.tools.AgentTool;
import com.taskdeck.agent.tools.ToolParamUtils;
import com.taskdeck.scheduler.workspace.MemoryIndex;
import com.taskdeck.scheduler.workspace.WorkspaceTypes.MemoryHit;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Memory search tool: keyword search over the agent's saved memories.
 */
@Slf4j
public class MemorySearchTool implements AgentTool {

    private static final int DEFAULT_LIMIT = 10;

    private final MemoryIndex memory;

    public MemorySearchTool(MemoryIndex memory) {
        this.memory = memory;
    }

    @Override
    public String getName() {
        return "memory_search";
    }

    @Override
    public String getDescription() {
        return "Search your memory for relevant information from past conversations, projects, tasks, and context.";
    }

    @Override
    public JsonNode getParameterSchema() {
        ObjectNode schema = ToolParamUtils.objectSchema();
        ToolParamUtils.addProperty(schema, "query", "string", "What to search for");
        ToolParamUtils.addProperty(schema, "limit", "number", "Maximum results (default 10)");
        ToolParamUtils.require(schema, "query");
        return schema;
    }

    @Override
    public CompletableFuture<ToolResult> execute(ToolContext context) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                JsonNode params = context.getParameters();
                String query = ToolParamUtils.readStringParam(params, "query", true);
                int limit = ToolParamUtils.readIntParam(params, "limit", DEFAULT_LIMIT);

                List<MemoryHit> hits = memory.search(context.getAgentId(), query, limit);
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("results", hits);
                payload.put("count", hits.size());
                return ToolParamUtils.jsonResult(payload);
            } catch (IllegalArgumentException e) {
                return ToolResult.fail(e.getMessage());
            } catch (Exception e) {
                log.error("memory_search error: {}", e.getMessage(), e);
                return ToolResult.fail("Memory search failed: " + e.getMessage());
            }
        });
    }
}

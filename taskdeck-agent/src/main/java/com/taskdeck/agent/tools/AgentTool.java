package com.taskdeck.agent.tools;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.concurrent.CompletableFuture;

/**
 * A capability offered to a bounded agent run.
 *
 * <p>
 * A failed {@link ToolResult} goes back to the model as an error message and
 * the run continues; only an exhausted budget or a model failure ends it.
 * Results are journaled per invocation, so they must carry everything the
 * model needs in {@link ToolResult#getOutput()}.
 * </p>
 */
public interface AgentTool {

    /** Name the model calls the tool by. */
    String getName();

    String getDescription();

    /** JSON Schema of the input object. */
    JsonNode getParameterSchema();

    CompletableFuture<ToolResult> execute(ToolContext context);

    // --- Supporting types ---

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class ToolResult {
        private boolean success;
        /** Text returned to the model on success. */
        private String output;
        /** Structured form of the output, for callers other than the model. */
        private Object data;
        private String error;

        public static ToolResult ok(String output) {
            return new ToolResult(true, output, null, null);
        }

        public static ToolResult ok(String output, Object data) {
            return new ToolResult(true, output, data, null);
        }

        public static ToolResult fail(String error) {
            return new ToolResult(false, null, null, error);
        }

        /** What the model reads back as the tool result. */
        public String toModelContent() {
            return success ? (output != null ? output : "") : "Error: " + error;
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class ToolContext {
        private JsonNode parameters;
        /** Agent the run acts for; tools only touch this agent's data. */
        private String agentId;
        private String runId;
    }
}

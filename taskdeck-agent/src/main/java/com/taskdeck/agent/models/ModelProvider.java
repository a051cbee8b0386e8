package com.taskdeck.agent.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Model-calling runtime seam. A bounded run makes one request per turn and
 * needs back the assistant text, the requested tool calls and the token
 * usage it is charged for.
 */
public interface ModelProvider {

    String getId();

    /**
     * One turn. The future fails when the provider cannot produce a response.
     */
    CompletableFuture<ChatResponse> chat(ChatRequest request);

    // --- Supporting types ---

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class ChatRequest {
        /** Run this turn belongs to, for log correlation. */
        private String runId;
        private String model;
        private String systemPrompt;
        private List<ChatMessage> messages;
        /** Tool definitions: name, description, input_schema. */
        private List<Map<String, Object>> tools;
        /** Output cap for this turn. */
        private int maxTokens;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class ChatResponse {
        private ChatMessage message;
        private List<ToolUse> toolUses;
        private Usage usage;
        private String stopReason;

        public boolean hasToolUses() {
            return toolUses != null && !toolUses.isEmpty();
        }

        public String text() {
            return message != null && message.getContent() != null ? message.getContent() : "";
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class ChatMessage {
        public static final String USER = "user";
        public static final String ASSISTANT = "assistant";
        public static final String TOOL = "tool";

        private String role;
        private String content;
        /** Set on {@link #TOOL} messages. */
        private String toolUseId;
        /** Set on {@link #ASSISTANT} messages that requested tools. */
        private List<ToolUse> toolUses;

        public static ChatMessage user(String content) {
            return ChatMessage.builder().role(USER).content(content).build();
        }

        public static ChatMessage assistant(String content, List<ToolUse> toolUses) {
            return ChatMessage.builder().role(ASSISTANT).content(content).toolUses(toolUses).build();
        }

        public static ChatMessage toolResult(String toolUseId, String content) {
            return ChatMessage.builder().role(TOOL).toolUseId(toolUseId).content(content).build();
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class ToolUse {
        private String id;
        private String name;
        private Map<String, Object> input;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class Usage {
        private int inputTokens;
        private int outputTokens;
        /** Prompt-cache reads and writes, billed on top of input tokens. */
        private int cacheTokens;

        /** Tokens charged against a run's budget. */
        public int total() {
            return inputTokens + outputTokens + cacheTokens;
        }
    }
}

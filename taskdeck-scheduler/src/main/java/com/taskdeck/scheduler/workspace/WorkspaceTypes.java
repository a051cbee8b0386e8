package com.taskdeck.scheduler.workspace;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Rows of the workspace collaborators the scheduler writes to.
 */
public final class WorkspaceTypes {

    private WorkspaceTypes() {
    }

    // =========================================================================
    // Conversations
    // =========================================================================

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Conversation {
        private String id;
        private String agentId;
        private String title;
        /** "active" | "archived" */
        private String status;
        private Instant createdAt;
        private Instant updatedAt;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Message {
        private String id;
        private String conversationId;
        /** "user" | "assistant" */
        private String role;
        private String content;
        private Map<String, Object> metadata;
        private Instant createdAt;
    }

    // =========================================================================
    // Notifications
    // =========================================================================

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Notification {
        private String id;
        private String agentId;
        /** "reminder" | "task_update" */
        private String type;
        private String title;
        private String content;
        /** "conversation" | "task" */
        private String linkType;
        private String linkId;
        private boolean read;
        private Instant createdAt;
    }

    // =========================================================================
    // Tasks
    // =========================================================================

    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Task {
        private String id;
        private String agentId;
        private String projectId;
        private String title;
        private String description;
        /** "todo" | "in_progress" | "done" */
        private String status;
        /** "high" | "medium" | "low" */
        private String priority;
        private Instant dueDate;
        private Instant createdAt;
        private Instant updatedAt;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TaskComment {
        private String id;
        private String taskId;
        private String agentId;
        private String content;
        private Instant createdAt;
    }

    // =========================================================================
    // Agents, memory, activity
    // =========================================================================

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AgentProfile {
        private String id;
        private String name;
        private String ownerName;
        private String timezone;
        private String email;
        /** Free-text persona prepended to the system prompt. */
        private String persona;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MemoryHit {
        private String id;
        private String content;
        private double score;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Activity {
        private String agentId;
        private String type;
        private String description;
        private Map<String, Object> metadata;
        private Instant createdAt;
    }
}

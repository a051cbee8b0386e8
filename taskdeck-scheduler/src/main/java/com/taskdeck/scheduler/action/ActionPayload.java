package com.taskdeck.scheduler.action;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Kind-specific parameters of a job action, read from the job's stored
 * payload map.
 */
public sealed interface ActionPayload {

    ActionKind kind();

    static ActionPayload from(ActionKind kind, Map<String, Object> raw) {
        switch (kind) {
            case NOTIFY:
                return NotifyPayload.from(raw);
            case AGENT_TASK:
                return AgentTaskPayload.from(raw);
            case WEBHOOK:
                return WebhookPayload.from(raw);
            default:
                throw new IllegalArgumentException("Unsupported action kind: " + kind);
        }
    }

    record NotifyPayload(String message, String taskId) implements ActionPayload {
        @Override
        public ActionKind kind() {
            return ActionKind.NOTIFY;
        }

        public static NotifyPayload from(Map<String, Object> raw) {
            return new NotifyPayload(string(raw, "message"), string(raw, "taskId"));
        }
    }

    record AgentTaskPayload(String instruction, String taskId) implements ActionPayload {
        @Override
        public ActionKind kind() {
            return ActionKind.AGENT_TASK;
        }

        public static AgentTaskPayload from(Map<String, Object> raw) {
            return new AgentTaskPayload(string(raw, "instruction"), string(raw, "taskId"));
        }
    }

    record WebhookPayload(String url, Map<String, Object> body, Map<String, String> headers)
            implements ActionPayload {
        @Override
        public ActionKind kind() {
            return ActionKind.WEBHOOK;
        }

        public static WebhookPayload from(Map<String, Object> raw) {
            Map<String, Object> body = new LinkedHashMap<>();
            Object rawBody = raw != null ? raw.get("body") : null;
            if (rawBody instanceof Map) {
                ((Map<?, ?>) rawBody).forEach((k, v) -> body.put(String.valueOf(k), v));
            }
            Map<String, String> headers = new LinkedHashMap<>();
            Object rawHeaders = raw != null ? raw.get("headers") : null;
            if (rawHeaders instanceof Map) {
                ((Map<?, ?>) rawHeaders).forEach((k, v) -> {
                    if (v != null)
                        headers.put(String.valueOf(k), String.valueOf(v));
                });
            }
            return new WebhookPayload(string(raw, "url"), body, headers);
        }
    }

    private static String string(Map<String, Object> raw, String key) {
        if (raw == null)
            return null;
        Object value = raw.get(key);
        if (value == null)
            return null;
        String s = String.valueOf(value).trim();
        return s.isEmpty() ? null : s;
    }
}

package com.taskdeck.scheduler.action;

/**
 * Closed set of actions a job can run.
 */
public enum ActionKind {
    NOTIFY, AGENT_TASK, WEBHOOK;

    public String key() {
        return name().toLowerCase();
    }

    /**
     * @return the kind, or null for an unrecognized key
     */
    public static ActionKind fromKey(String key) {
        if (key == null)
            return null;
        for (ActionKind kind : values()) {
            if (kind.key().equals(key.trim().toLowerCase()))
                return kind;
        }
        return null;
    }
}

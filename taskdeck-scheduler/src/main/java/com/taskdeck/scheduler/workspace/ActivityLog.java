package com.taskdeck.scheduler.workspace;

import com.taskdeck.scheduler.workspace.WorkspaceTypes.Activity;

import java.util.List;
import java.util.Map;

/**
 * Append-only activity feed shown on the dashboard.
 */
public interface ActivityLog {

    void record(String agentId, String type, String description, Map<String, Object> metadata);

    List<Activity> list(String agentId);
}

package com.taskdeck.scheduler.workspace;

import com.taskdeck.scheduler.workspace.WorkspaceTypes.Notification;

import java.util.List;

/**
 * User-facing notifications. A repeated dedupe key returns the first
 * notification instead of creating another.
 */
public interface NotificationSink {

    Notification createNotification(String agentId, String type, String title, String content,
            String linkType, String linkId, String dedupeKey);

    List<Notification> listNotifications(String agentId);
}

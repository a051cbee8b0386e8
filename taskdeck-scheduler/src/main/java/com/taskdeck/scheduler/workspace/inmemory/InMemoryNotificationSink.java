package com.taskdeck.scheduler.workspace.inmemory;

import com.taskdeck.scheduler.workspace.NotificationSink;
import com.taskdeck.scheduler.workspace.WorkspaceTypes.Notification;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

public class InMemoryNotificationSink implements NotificationSink {

    private final List<Notification> notifications = new ArrayList<>();
    private final Map<String, Notification> byDedupeKey = new HashMap<>();
    private final Clock clock;

    public InMemoryNotificationSink() {
        this(Clock.systemUTC());
    }

    public InMemoryNotificationSink(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized Notification createNotification(String agentId, String type, String title, String content,
            String linkType, String linkId, String dedupeKey) {
        if (dedupeKey != null && byDedupeKey.containsKey(dedupeKey)) {
            return byDedupeKey.get(dedupeKey);
        }
        Notification notification = Notification.builder()
                .id(UUID.randomUUID().toString())
                .agentId(agentId)
                .type(type)
                .title(title)
                .content(content)
                .linkType(linkType)
                .linkId(linkId)
                .createdAt(clock.instant())
                .build();
        notifications.add(notification);
        if (dedupeKey != null) {
            byDedupeKey.put(dedupeKey, notification);
        }
        return notification;
    }

    @Override
    public synchronized List<Notification> listNotifications(String agentId) {
        return notifications.stream()
                .filter(n -> agentId == null || agentId.equals(n.getAgentId()))
                .collect(Collectors.toList());
    }
}

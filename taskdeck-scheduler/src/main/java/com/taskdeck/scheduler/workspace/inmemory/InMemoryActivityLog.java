package com.taskdeck.scheduler.workspace.inmemory;

import com.taskdeck.scheduler.workspace.ActivityLog;
import com.taskdeck.scheduler.workspace.WorkspaceTypes.Activity;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

public class InMemoryActivityLog implements ActivityLog {

    private final List<Activity> activities = new CopyOnWriteArrayList<>();
    private final Clock clock;

    public InMemoryActivityLog() {
        this(Clock.systemUTC());
    }

    public InMemoryActivityLog(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void record(String agentId, String type, String description, Map<String, Object> metadata) {
        activities.add(Activity.builder()
                .agentId(agentId)
                .type(type)
                .description(description)
                .metadata(metadata != null ? new LinkedHashMap<>(metadata) : Map.of())
                .createdAt(clock.instant())
                .build());
    }

    @Override
    public List<Activity> list(String agentId) {
        return activities.stream()
                .filter(a -> agentId == null || agentId.equals(a.getAgentId()))
                .collect(Collectors.toList());
    }
}

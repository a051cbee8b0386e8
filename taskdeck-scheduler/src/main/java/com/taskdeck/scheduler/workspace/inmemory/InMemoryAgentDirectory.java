package com.taskdeck.scheduler.workspace.inmemory;

import com.taskdeck.scheduler.workspace.AgentDirectory;
import com.taskdeck.scheduler.workspace.WorkspaceTypes.AgentProfile;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryAgentDirectory implements AgentDirectory {

    private final Map<String, AgentProfile> agents = new ConcurrentHashMap<>();

    public void register(AgentProfile profile) {
        agents.put(profile.getId(), profile);
    }

    @Override
    public Optional<AgentProfile> findAgent(String agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }
}

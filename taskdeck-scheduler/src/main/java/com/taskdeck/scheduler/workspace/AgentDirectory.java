package com.taskdeck.scheduler.workspace;

import com.taskdeck.scheduler.workspace.WorkspaceTypes.AgentProfile;

import java.util.Optional;

public interface AgentDirectory {

    Optional<AgentProfile> findAgent(String agentId);
}

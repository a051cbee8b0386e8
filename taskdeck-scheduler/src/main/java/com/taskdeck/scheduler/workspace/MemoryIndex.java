package com.taskdeck.scheduler.workspace;

import com.taskdeck.scheduler.workspace.WorkspaceTypes.MemoryHit;

import java.util.List;

/**
 * Saved memories of an agent, searchable by keyword.
 */
public interface MemoryIndex {

    void save(String agentId, String content);

    List<MemoryHit> search(String agentId, String query, int limit);
}

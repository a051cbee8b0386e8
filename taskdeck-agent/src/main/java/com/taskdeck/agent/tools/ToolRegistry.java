package com.taskdeck.agent.tools;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The toolset of one bounded agent run. Filled once before the run starts and
 * only read afterwards; tools are offered to the model in registration order.
 */
@Slf4j
public class ToolRegistry {

    private final Map<String, AgentTool> byName = new LinkedHashMap<>();

    public void register(AgentTool tool) {
        AgentTool previous = byName.put(tool.getName(), tool);
        if (previous != null && previous != tool) {
            log.warn("Tool {} registered twice, keeping the later one", tool.getName());
        }
    }

    /** Adds tools whose names are not taken yet. */
    public void registerAll(Collection<? extends AgentTool> tools) {
        for (AgentTool tool : tools) {
            if (byName.putIfAbsent(tool.getName(), tool) != null) {
                log.debug("Tool {} already registered, skipping", tool.getName());
            }
        }
    }

    public Optional<AgentTool> get(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public Set<String> getToolNames() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(byName.keySet()));
    }

    public int size() {
        return byName.size();
    }

    /** Definitions in the Messages API shape. */
    public List<Map<String, Object>> toDefinitions() {
        List<Map<String, Object>> definitions = new ArrayList<>(byName.size());
        for (AgentTool tool : byName.values()) {
            Map<String, Object> definition = new LinkedHashMap<>();
            definition.put("name", tool.getName());
            definition.put("description", tool.getDescription());
            definition.put("input_schema", tool.getParameterSchema());
            definitions.add(definition);
        }
        return definitions;
    }
}

package com.taskdeck.scheduler.workspace.inmemory;

import com.taskdeck.scheduler.workspace.MemoryIndex;
import com.taskdeck.scheduler.workspace.WorkspaceTypes.MemoryHit;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Keyword search over saved memories. Score is the fraction of query terms a
 * memory contains.
 */
public class InMemoryMemoryIndex implements MemoryIndex {

    private final Map<String, List<String[]>> memories = new ConcurrentHashMap<>();

    @Override
    public void save(String agentId, String content) {
        memories.computeIfAbsent(agentId, k -> new CopyOnWriteArrayList<>())
                .add(new String[] { UUID.randomUUID().toString(), content });
    }

    @Override
    public List<MemoryHit> search(String agentId, String query, int limit) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        String[] terms = Arrays.stream(query.toLowerCase().split("\\s+"))
                .filter(t -> !t.isBlank())
                .toArray(String[]::new);

        List<MemoryHit> scored = new ArrayList<>();
        for (String[] memory : memories.getOrDefault(agentId, List.of())) {
            String text = memory[1].toLowerCase();
            int matchCount = 0;
            for (String term : terms) {
                if (text.contains(term))
                    matchCount++;
            }
            if (matchCount == 0)
                continue;
            scored.add(MemoryHit.builder()
                    .id(memory[0])
                    .content(memory[1])
                    .score((double) matchCount / terms.length)
                    .build());
        }
        return scored.stream()
                .sorted(Comparator.comparingDouble(MemoryHit::getScore).reversed())
                .limit(Math.max(0, limit))
                .collect(Collectors.toList());
    }
}

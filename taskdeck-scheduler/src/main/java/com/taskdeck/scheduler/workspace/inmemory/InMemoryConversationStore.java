package com.taskdeck.scheduler.workspace.inmemory;

import com.taskdeck.scheduler.workspace.ConversationStore;
import com.taskdeck.scheduler.workspace.WorkspaceTypes.Conversation;
import com.taskdeck.scheduler.workspace.WorkspaceTypes.Message;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

public class InMemoryConversationStore implements ConversationStore {

    private final Map<String, Conversation> conversations = new ConcurrentHashMap<>();
    private final Map<String, List<Message>> messages = new ConcurrentHashMap<>();
    private final Map<String, String> idempotencyKeys = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryConversationStore() {
        this(Clock.systemUTC());
    }

    public InMemoryConversationStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<Conversation> getConversation(String conversationId) {
        return Optional.ofNullable(conversations.get(conversationId));
    }

    @Override
    public Optional<Conversation> findLatestActive(String agentId) {
        return conversations.values().stream()
                .filter(c -> agentId.equals(c.getAgentId()) && "active".equals(c.getStatus()))
                .max(Comparator.comparing(Conversation::getUpdatedAt));
    }

    @Override
    public synchronized Conversation createConversation(String agentId, String title, String idempotencyKey) {
        if (idempotencyKey != null) {
            String existing = idempotencyKeys.get("conversation:" + idempotencyKey);
            if (existing != null) {
                return conversations.get(existing);
            }
        }
        Instant now = clock.instant();
        Conversation conversation = Conversation.builder()
                .id(UUID.randomUUID().toString())
                .agentId(agentId)
                .title(title)
                .status("active")
                .createdAt(now)
                .updatedAt(now)
                .build();
        conversations.put(conversation.getId(), conversation);
        if (idempotencyKey != null) {
            idempotencyKeys.put("conversation:" + idempotencyKey, conversation.getId());
        }
        return conversation;
    }

    @Override
    public synchronized Message insertMessage(String conversationId, String role, String content,
            Map<String, Object> metadata, String idempotencyKey) {
        Conversation conversation = conversations.get(conversationId);
        if (conversation == null) {
            throw new IllegalArgumentException("Conversation not found: " + conversationId);
        }
        if (idempotencyKey != null) {
            String existing = idempotencyKeys.get("message:" + idempotencyKey);
            if (existing != null) {
                return messages.get(conversationId).stream()
                        .filter(m -> m.getId().equals(existing))
                        .findFirst()
                        .orElseThrow();
            }
        }
        Instant now = clock.instant();
        Message message = Message.builder()
                .id(UUID.randomUUID().toString())
                .conversationId(conversationId)
                .role(role)
                .content(content)
                .metadata(metadata != null ? new LinkedHashMap<>(metadata) : Map.of())
                .createdAt(now)
                .build();
        messages.computeIfAbsent(conversationId, k -> new ArrayList<>()).add(message);
        conversation.setUpdatedAt(now);
        if (idempotencyKey != null) {
            idempotencyKeys.put("message:" + idempotencyKey, message.getId());
        }
        return message;
    }

    @Override
    public synchronized List<Message> listMessages(String conversationId) {
        return new ArrayList<>(messages.getOrDefault(conversationId, List.of()));
    }

    public synchronized List<Message> allMessages() {
        return messages.values().stream().flatMap(List::stream).collect(Collectors.toList());
    }
}

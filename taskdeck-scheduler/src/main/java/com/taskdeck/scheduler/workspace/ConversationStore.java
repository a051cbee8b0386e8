package com.taskdeck.scheduler.workspace;

import com.taskdeck.scheduler.workspace.WorkspaceTypes.Conversation;
import com.taskdeck.scheduler.workspace.WorkspaceTypes.Message;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Conversation and message storage.
 *
 * <p>
 * Writes accept an idempotency key: repeating a call with the same key
 * returns the row created by the first call.
 * </p>
 */
public interface ConversationStore {

    Optional<Conversation> getConversation(String conversationId);

    /** Most recently updated active conversation of the agent. */
    Optional<Conversation> findLatestActive(String agentId);

    Conversation createConversation(String agentId, String title, String idempotencyKey);

    Message insertMessage(String conversationId, String role, String content, Map<String, Object> metadata,
            String idempotencyKey);

    List<Message> listMessages(String conversationId);

    default Conversation findOrCreateActiveConversation(String agentId, String title, String idempotencyKey) {
        return findLatestActive(agentId).orElseGet(() -> createConversation(agentId, title, idempotencyKey));
    }
}

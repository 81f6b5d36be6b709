package com.example.scenebrain_backend.memory;

import com.example.scenebrain_backend.api.Message;

import java.util.List;
import java.util.UUID;

/**
 * Persisted conversation transcript of a project.
 */
public interface ConversationStore {

    void append(UUID projectId, Message message);

    /**
     * Returns up to {@code limit} most recent messages, oldest first.
     */
    List<Message> recent(UUID projectId, int limit);
}

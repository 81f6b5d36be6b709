package com.example.scenebrain_backend.memory;

import com.example.scenebrain_backend.api.ImageRef;
import com.example.scenebrain_backend.api.Message;
import com.example.scenebrain_backend.model.ConversationMessage;
import com.example.scenebrain_backend.repository.ConversationMessageRepository;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
public class JpaConversationStore implements ConversationStore {

    private final ConversationMessageRepository repository;
    private final Clock clock;

    public JpaConversationStore(ConversationMessageRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Override
    public void append(UUID projectId, Message message) {
        Instant at = message.createdAt() == null ? Instant.now(clock) : message.createdAt();
        ConversationMessage row = new ConversationMessage(projectId, message.role(), message.content(), at);
        if (!message.imageRefs().isEmpty()) {
            row.setImageRefIds(message.imageRefs().stream().map(ImageRef::id).collect(Collectors.joining(",")));
        }
        try {
            repository.save(row);
        } catch (DataAccessResourceFailureException | CannotCreateTransactionException e) {
            throw new MemoryStoreUnavailableException("Conversation store unavailable", e);
        }
    }

    @Override
    public List<Message> recent(UUID projectId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<ConversationMessage> rows;
        try {
            rows = repository.findByProjectIdOrderByCreatedAtDesc(projectId, PageRequest.of(0, limit));
        } catch (DataAccessResourceFailureException | CannotCreateTransactionException e) {
            throw new MemoryStoreUnavailableException("Conversation store unavailable", e);
        }
        List<Message> out = new ArrayList<>(rows.size());
        for (ConversationMessage row : rows) {
            out.add(new Message(row.getRole(), row.getContent(), refs(row.getImageRefIds()), row.getCreatedAt()));
        }
        Collections.reverse(out);
        return out;
    }

    private static List<ImageRef> refs(String ids) {
        if (ids == null || ids.isBlank()) {
            return List.of();
        }
        return Arrays.stream(ids.split(","))
                .filter(id -> !id.isBlank())
                .map(id -> new ImageRef(id, null))
                .toList();
    }
}

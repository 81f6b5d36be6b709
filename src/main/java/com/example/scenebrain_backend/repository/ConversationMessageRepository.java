package com.example.scenebrain_backend.repository;

import com.example.scenebrain_backend.model.ConversationMessage;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface ConversationMessageRepository extends JpaRepository<ConversationMessage, UUID> {
    List<ConversationMessage> findByProjectIdOrderByCreatedAtDesc(UUID projectId, Pageable pageable);
}

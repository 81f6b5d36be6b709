package com.example.scenebrain_backend.model;

import com.example.scenebrain_backend.api.MessageRole;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "conversation_message",
        indexes = @Index(name = "idx_conversation_project_created", columnList = "project_id, created_at"))
public class ConversationMessage {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "project_id", nullable = false, updatable = false)
    private UUID projectId;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 16)
    private MessageRole role;

    @Column(name = "content", nullable = false, length = 20_000)
    private String content;

    // comma separated image ref ids
    @Column(name = "image_ref_ids", length = 2_000)
    private String imageRefIds;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected ConversationMessage() {
    }

    public ConversationMessage(UUID projectId, MessageRole role, String content, Instant createdAt) {
        this.projectId = projectId;
        this.role = role;
        this.content = content;
        this.createdAt = createdAt;
    }

    public UUID getId() {
        return id;
    }

    public UUID getProjectId() {
        return projectId;
    }

    public MessageRole getRole() {
        return role;
    }

    public String getContent() {
        return content;
    }

    public String getImageRefIds() {
        return imageRefIds;
    }

    public void setImageRefIds(String imageRefIds) {
        this.imageRefIds = imageRefIds;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}

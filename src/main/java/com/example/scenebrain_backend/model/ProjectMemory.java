package com.example.scenebrain_backend.model;

import com.example.scenebrain_backend.memory.MemoryType;
import com.example.scenebrain_backend.memory.PreferenceScope;
import com.example.scenebrain_backend.memory.PreferenceSource;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

/**
 * One project-scoped memory fact. Keys are namespaced, see {@code MemoryKeys}.
 */
@Entity
@Table(name = "project_memory",
        uniqueConstraints = @UniqueConstraint(name = "uk_project_memory_key", columnNames = {"project_id", "memory_key"}),
        indexes = @Index(name = "idx_project_memory_project", columnList = "project_id"))
public class ProjectMemory {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "project_id", nullable = false, updatable = false)
    private UUID projectId;

    @Column(name = "memory_key", nullable = false, length = 512, updatable = false)
    private String memoryKey;

    @Column(name = "memory_value", nullable = false, length = 20_000)
    private String memoryValue;

    @Column(name = "confidence")
    private Double confidence;

    @Enumerated(EnumType.STRING)
    @Column(name = "memory_type", nullable = false, length = 32)
    private MemoryType memoryType;

    @Enumerated(EnumType.STRING)
    @Column(name = "scope", length = 16)
    private PreferenceScope scope;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", length = 16)
    private PreferenceSource source;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected ProjectMemory() {
    }

    public ProjectMemory(UUID projectId, String memoryKey, MemoryType memoryType) {
        this.projectId = projectId;
        this.memoryKey = memoryKey;
        this.memoryType = memoryType;
    }

    public UUID getId() {
        return id;
    }

    public UUID getProjectId() {
        return projectId;
    }

    public String getMemoryKey() {
        return memoryKey;
    }

    public String getMemoryValue() {
        return memoryValue;
    }

    public void setMemoryValue(String memoryValue) {
        this.memoryValue = memoryValue;
    }

    public Double getConfidence() {
        return confidence;
    }

    public void setConfidence(Double confidence) {
        this.confidence = confidence;
    }

    public MemoryType getMemoryType() {
        return memoryType;
    }

    public PreferenceScope getScope() {
        return scope;
    }

    public void setScope(PreferenceScope scope) {
        this.scope = scope;
    }

    public PreferenceSource getSource() {
        return source;
    }

    public void setSource(PreferenceSource source) {
        this.source = source;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}

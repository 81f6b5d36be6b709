package com.example.scenebrain_backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.UUID;

/**
 * Durable copy of a scene artifact. {@code versionToken} is only advanced through a conditional
 * update on the previous token.
 */
@Entity
@Table(name = "scene", indexes = @Index(name = "idx_scene_project", columnList = "project_id, introduced_order"))
public class Scene {
    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "project_id", nullable = false, updatable = false)
    private UUID projectId;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "code", nullable = false, length = 200_000)
    private String code;

    @Column(name = "duration_frames", nullable = false)
    private int durationInFrames;

    @Column(name = "timeline_position")
    private Integer timelinePosition;

    @Column(name = "template_id", length = 100)
    private String templateId;

    @Column(name = "attributes_json", length = 20_000)
    private String attributesJson;

    @Column(name = "deleted", nullable = false)
    private boolean deleted;

    @Column(name = "introduced_order", nullable = false, updatable = false)
    private long introducedOrder;

    @Column(name = "version_token", nullable = false)
    private long versionToken;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected Scene() {
    }

    public Scene(UUID id, UUID projectId, long introducedOrder) {
        this.id = id;
        this.projectId = projectId;
        this.introducedOrder = introducedOrder;
    }

    public UUID getId() {
        return id;
    }

    public UUID getProjectId() {
        return projectId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getCode() {
        return code;
    }

    public void setCode(String code) {
        this.code = code;
    }

    public int getDurationInFrames() {
        return durationInFrames;
    }

    public void setDurationInFrames(int durationInFrames) {
        this.durationInFrames = durationInFrames;
    }

    public Integer getTimelinePosition() {
        return timelinePosition;
    }

    public void setTimelinePosition(Integer timelinePosition) {
        this.timelinePosition = timelinePosition;
    }

    public String getTemplateId() {
        return templateId;
    }

    public void setTemplateId(String templateId) {
        this.templateId = templateId;
    }

    public String getAttributesJson() {
        return attributesJson;
    }

    public void setAttributesJson(String attributesJson) {
        this.attributesJson = attributesJson;
    }

    public boolean isDeleted() {
        return deleted;
    }

    public void setDeleted(boolean deleted) {
        this.deleted = deleted;
    }

    public long getIntroducedOrder() {
        return introducedOrder;
    }

    public long getVersionToken() {
        return versionToken;
    }

    public void setVersionToken(long versionToken) {
        this.versionToken = versionToken;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}

package com.example.scenebrain_backend.sync;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable scene state carried by a {@link VersionedArtifact}. A deleted scene is kept as a
 * tombstone so its token history stays monotonic.
 *
 * @param introducedOrder position in the project's introduction order, assigned on first commit.
 */
public record ScenePayload(UUID projectId,
                           String name,
                           String code,
                           int durationInFrames,
                           Integer timelinePosition,
                           String templateId,
                           Map<String, String> attributes,
                           boolean deleted,
                           long introducedOrder) {

    public static final int FPS = 30;

    public ScenePayload {
        name = name == null ? "" : name;
        code = code == null ? "" : code;
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static ScenePayload create(UUID projectId, String name, String code, int durationInFrames, String templateId) {
        return new ScenePayload(projectId, name, code, durationInFrames, null, templateId, Map.of(), false, 0L);
    }

    public ScenePayload withCode(String newName, String newCode) {
        return new ScenePayload(projectId, newName == null || newName.isBlank() ? name : newName, newCode,
                durationInFrames, timelinePosition, templateId, attributes, deleted, introducedOrder);
    }

    public ScenePayload withAttribute(String key, String value) {
        Map<String, String> next = new LinkedHashMap<>(attributes);
        next.put(key, value);
        return new ScenePayload(projectId, name, code, durationInFrames, timelinePosition, templateId, next, deleted, introducedOrder);
    }

    public ScenePayload withAttributes(Map<String, String> extra) {
        Map<String, String> next = new LinkedHashMap<>(attributes);
        if (extra != null) {
            next.putAll(extra);
        }
        return new ScenePayload(projectId, name, code, durationInFrames, timelinePosition, templateId, next, deleted, introducedOrder);
    }

    public ScenePayload withDuration(int frames) {
        return new ScenePayload(projectId, name, code, frames, timelinePosition, templateId, attributes, deleted, introducedOrder);
    }

    public ScenePayload withTimelinePosition(Integer position) {
        return new ScenePayload(projectId, name, code, durationInFrames, position, templateId, attributes, deleted, introducedOrder);
    }

    public ScenePayload tombstone() {
        return new ScenePayload(projectId, name, code, durationInFrames, timelinePosition, templateId, attributes, true, introducedOrder);
    }

    ScenePayload withIdentity(UUID owner, long order) {
        return new ScenePayload(owner, name, code, durationInFrames, timelinePosition, templateId, attributes, deleted, order);
    }
}

package com.example.scenebrain_backend.dto;

import com.example.scenebrain_backend.sync.ScenePayload;
import com.example.scenebrain_backend.sync.VersionedArtifact;

import java.util.Map;
import java.util.UUID;

/**
 * @param displayNumber "Scene N" label, {@code null} when the scene is deleted or was read on its own.
 */
public record SceneResponse(UUID entityId,
                            UUID projectId,
                            Integer displayNumber,
                            String name,
                            String code,
                            int durationInFrames,
                            Integer timelinePosition,
                            String templateId,
                            Map<String, String> attributes,
                            boolean deleted,
                            long versionToken) {

    public static SceneResponse from(VersionedArtifact artifact, Integer displayNumber) {
        ScenePayload p = artifact.payload();
        return new SceneResponse(artifact.entityId(), artifact.projectId(), displayNumber, p.name(), p.code(),
                p.durationInFrames(), p.timelinePosition(), p.templateId(), p.attributes(), p.deleted(),
                artifact.versionToken());
    }
}

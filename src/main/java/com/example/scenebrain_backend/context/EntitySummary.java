package com.example.scenebrain_backend.context;

import com.example.scenebrain_backend.sync.VersionedArtifact;

import java.util.UUID;

/**
 * Cached view of one live scene.
 *
 * @param displayNumber the "Scene N" number the user sees: 1-based rank in introduction order among
 *                      live scenes, {@code 0} when the summary was built without the list.
 */
public record EntitySummary(UUID entityId,
                            int displayNumber,
                            String name,
                            int durationInFrames,
                            Integer timelinePosition,
                            long versionToken,
                            long introducedOrder) {

    public static EntitySummary of(VersionedArtifact artifact, int displayNumber) {
        return new EntitySummary(artifact.entityId(), displayNumber, artifact.payload().name(),
                artifact.payload().durationInFrames(), artifact.payload().timelinePosition(),
                artifact.versionToken(), artifact.payload().introducedOrder());
    }
}

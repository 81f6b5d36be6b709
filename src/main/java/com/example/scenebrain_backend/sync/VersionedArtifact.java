package com.example.scenebrain_backend.sync;

import java.util.UUID;

/**
 * The unit of truth for a mutable entity. Consumers recompute derived state whenever
 * {@code versionToken} changes and never diff payloads.
 */
public record VersionedArtifact(UUID entityId, ScenePayload payload, long versionToken) {

    public UUID projectId() {
        return payload.projectId();
    }

    public boolean isLive() {
        return !payload.deleted();
    }
}

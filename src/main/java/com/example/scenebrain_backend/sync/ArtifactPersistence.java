package com.example.scenebrain_backend.sync;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable storage for artifacts. Writes are conditional so a stale writer can never move a token
 * backwards.
 */
public interface ArtifactPersistence {

    Optional<VersionedArtifact> find(UUID entityId);

    /**
     * @return {@code false} when an artifact with the same id already exists.
     */
    boolean insert(VersionedArtifact artifact);

    /**
     * @return {@code false} when the stored token is not {@code expectedToken}.
     */
    boolean update(VersionedArtifact next, long expectedToken);

    /**
     * All artifacts of a project including tombstones, in introduction order.
     */
    List<VersionedArtifact> listByProject(UUID projectId);

    long maxIntroducedOrder(UUID projectId);
}

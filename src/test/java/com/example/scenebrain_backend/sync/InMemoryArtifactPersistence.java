package com.example.scenebrain_backend.sync;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Conditional-write store backed by a map, with hooks to simulate a concurrent writer.
 */
public class InMemoryArtifactPersistence implements ArtifactPersistence {

    private final Map<UUID, VersionedArtifact> rows = new ConcurrentHashMap<>();
    public final AtomicInteger finds = new AtomicInteger();
    public final AtomicInteger lists = new AtomicInteger();
    public final AtomicInteger rejectedUpdates = new AtomicInteger();
    private volatile int updatesToReject;

    @Override
    public Optional<VersionedArtifact> find(UUID entityId) {
        finds.incrementAndGet();
        return Optional.ofNullable(rows.get(entityId));
    }

    @Override
    public synchronized boolean insert(VersionedArtifact artifact) {
        return rows.putIfAbsent(artifact.entityId(), artifact) == null;
    }

    @Override
    public synchronized boolean update(VersionedArtifact next, long expectedToken) {
        if (updatesToReject > 0) {
            updatesToReject--;
            rejectedUpdates.incrementAndGet();
            return false;
        }
        VersionedArtifact stored = rows.get(next.entityId());
        if (stored == null || stored.versionToken() != expectedToken) {
            rejectedUpdates.incrementAndGet();
            return false;
        }
        rows.put(next.entityId(), next);
        return true;
    }

    @Override
    public List<VersionedArtifact> listByProject(UUID projectId) {
        lists.incrementAndGet();
        return rows.values().stream()
                .filter(a -> projectId.equals(a.projectId()))
                .sorted(Comparator.comparingLong(a -> a.payload().introducedOrder()))
                .toList();
    }

    @Override
    public long maxIntroducedOrder(UUID projectId) {
        return rows.values().stream()
                .filter(a -> projectId.equals(a.projectId()))
                .mapToLong(a -> a.payload().introducedOrder())
                .max()
                .orElse(0L);
    }

    /**
     * Writes a row behind the service's back, as another instance would.
     */
    public void putExternally(VersionedArtifact artifact) {
        rows.put(artifact.entityId(), artifact);
    }

    public void rejectNextUpdates(int count) {
        this.updatesToReject = count;
    }

    public Optional<VersionedArtifact> stored(UUID entityId) {
        return Optional.ofNullable(rows.get(entityId));
    }
}

package com.example.scenebrain_backend.sync;

import com.example.scenebrain_backend.api.EntityNotFoundException;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-writer commit/observe protocol. Commits on one entity are serialized and each gets the
 * previous token plus one; commits on different entities run independently. After a successful
 * commit nothing re-reads persistence to verify it: the committed view is authoritative.
 */
@Service
public class StateSyncService {
    private static final Logger LOGGER = LoggerFactory.getLogger(StateSyncService.class);
    private static final long LOCK_WAIT_SECONDS = 10;
    static final long COMMITTED_VIEW_MAX = 10_000;
    static final Duration VIEW_IDLE = Duration.ofMinutes(30);

    static final Comparator<VersionedArtifact> INTRODUCTION_ORDER = Comparator
            .comparingLong((VersionedArtifact a) -> a.payload().introducedOrder())
            .thenComparing(VersionedArtifact::entityId);

    private final ArtifactPersistence persistence;
    private final List<CommitListener> listeners;
    private final Cache<UUID, VersionedArtifact> committed;
    private final LoadingCache<UUID, ReentrantLock> locks;
    private final Cache<UUID, AtomicLong> introductionCounters;

    @Autowired
    public StateSyncService(ArtifactPersistence persistence, List<CommitListener> listeners) {
        this(persistence, listeners, Ticker.systemTicker());
    }

    public StateSyncService(ArtifactPersistence persistence, List<CommitListener> listeners, Ticker ticker) {
        this.persistence = persistence;
        this.listeners = List.copyOf(listeners);
        this.committed = Caffeine.newBuilder()
                .maximumSize(COMMITTED_VIEW_MAX)
                .expireAfterAccess(VIEW_IDLE)
                .ticker(ticker)
                .build();
        // a lock stays shared while any writer still references it
        this.locks = Caffeine.newBuilder().weakValues().build(id -> new ReentrantLock(true));
        this.introductionCounters = Caffeine.newBuilder()
                .expireAfterAccess(VIEW_IDLE)
                .ticker(ticker)
                .build();
    }

    /**
     * Atomically replaces the payload of an entity and advances its token.
     *
     * @param entityId   entity to write; unknown ids create the entity.
     * @param newPayload new state; project and introduction order of an existing entity are kept.
     * @return the committed artifact.
     * @throws BusyException when the write keeps conflicting or the entity lock cannot be taken.
     */
    public VersionedArtifact commit(UUID entityId, ScenePayload newPayload) {
        Objects.requireNonNull(entityId, "entityId");
        Objects.requireNonNull(newPayload, "newPayload");
        ReentrantLock lock = locks.get(entityId);
        acquire(lock, entityId);
        try {
            VersionedArtifact current = currentOrNull(entityId);
            VersionedArtifact next = next(entityId, current, newPayload);
            if (!persist(next, current)) {
                VersionedArtifact latest = persistence.find(entityId).orElse(null);
                LOGGER.warn("commit conflict entityId={} attemptedToken={} storedToken={}, retrying once",
                        entityId, next.versionToken(), latest == null ? "-" : latest.versionToken());
                next = next(entityId, latest, newPayload);
                if (!persist(next, latest)) {
                    throw new BusyException(entityId, "Concurrent write to scene " + entityId + ", try again");
                }
            }
            publish(next);
            LOGGER.debug("commit entityId={} token={} deleted={}", entityId, next.versionToken(), next.payload().deleted());
            return next;
        } finally {
            lock.unlock();
        }
    }

    /**
     * The latest committed artifact of an entity, tombstones included.
     *
     * @throws EntityNotFoundException when the entity was never committed.
     */
    public VersionedArtifact observe(UUID entityId) {
        return find(entityId).orElseThrow(() -> new EntityNotFoundException(entityId));
    }

    public Optional<VersionedArtifact> find(UUID entityId) {
        VersionedArtifact view = committed.getIfPresent(entityId);
        if (view != null) {
            return Optional.of(view);
        }
        Optional<VersionedArtifact> stored = persistence.find(entityId);
        stored.ifPresent(this::remember);
        return stored.map(a -> committed.asMap().getOrDefault(entityId, a));
    }

    /**
     * Drops the committed view and introduction counter of a project. Later reads go back to
     * persistence.
     */
    public void releaseProject(UUID projectId) {
        introductionCounters.invalidate(projectId);
        committed.asMap().values().removeIf(artifact -> projectId.equals(artifact.projectId()));
        LOGGER.debug("committed view released projectId={}", projectId);
    }

    /**
     * Live (non-deleted) artifacts of a project in introduction order.
     */
    public List<VersionedArtifact> listLive(UUID projectId) {
        List<VersionedArtifact> out = new ArrayList<>();
        for (VersionedArtifact stored : persistence.listByProject(projectId)) {
            VersionedArtifact view = committed.getIfPresent(stored.entityId());
            VersionedArtifact effective = view != null && view.versionToken() >= stored.versionToken() ? view : stored;
            if (effective.isLive()) {
                out.add(effective);
            }
        }
        out.sort(INTRODUCTION_ORDER);
        return List.copyOf(out);
    }

    private VersionedArtifact next(UUID entityId, VersionedArtifact current, ScenePayload requested) {
        if (current == null) {
            if (requested.projectId() == null) {
                throw new IllegalArgumentException("projectId is required to create entity " + entityId);
            }
            long order = introductionCounters
                    .get(requested.projectId(), p -> new AtomicLong(persistence.maxIntroducedOrder(p)))
                    .incrementAndGet();
            return new VersionedArtifact(entityId, requested.withIdentity(requested.projectId(), order), 1L);
        }
        ScenePayload payload = requested.withIdentity(current.projectId(), current.payload().introducedOrder());
        return new VersionedArtifact(entityId, payload, current.versionToken() + 1);
    }

    private boolean persist(VersionedArtifact next, VersionedArtifact previous) {
        if (previous == null) {
            return persistence.insert(next);
        }
        return persistence.update(next, previous.versionToken());
    }

    private void publish(VersionedArtifact next) {
        remember(next);
        for (CommitListener listener : listeners) {
            try {
                listener.onCommit(next);
            } catch (RuntimeException e) {
                LOGGER.error("commit listener failed listener={} entityId={}", listener.getClass().getSimpleName(), next.entityId(), e);
            }
        }
    }

    private void remember(VersionedArtifact artifact) {
        committed.asMap().merge(artifact.entityId(), artifact,
                (existing, incoming) -> incoming.versionToken() > existing.versionToken() ? incoming : existing);
    }

    private VersionedArtifact currentOrNull(UUID entityId) {
        VersionedArtifact view = committed.getIfPresent(entityId);
        if (view != null) {
            return view;
        }
        return persistence.find(entityId).orElse(null);
    }

    private static void acquire(ReentrantLock lock, UUID entityId) {
        try {
            if (!lock.tryLock(LOCK_WAIT_SECONDS, TimeUnit.SECONDS)) {
                throw new BusyException(entityId, "Scene " + entityId + " is locked by another commit");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusyException(entityId, "Interrupted while waiting for scene " + entityId);
        }
    }
}

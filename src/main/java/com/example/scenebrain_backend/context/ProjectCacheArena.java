package com.example.scenebrain_backend.context;

import com.example.scenebrain_backend.memory.PreferenceValue;
import com.example.scenebrain_backend.sync.VersionedArtifact;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Caches of one project. Cached values are immutable and may be handed to several requests.
 */
public final class ProjectCacheArena {
    private static final String KEY = "project";

    private final UUID projectId;
    private final Ticker ticker;
    private final Cache<String, Map<String, PreferenceValue>> preferences;
    private final Cache<String, List<VersionedArtifact>> entities;
    private final AtomicLong entityGeneration = new AtomicLong();
    private final Object entityMonitor = new Object();
    private volatile long lastAccessNanos;
    private volatile boolean closed;

    ProjectCacheArena(UUID projectId, Duration preferenceTtl, Duration entityTtl, Ticker ticker) {
        this.projectId = projectId;
        this.ticker = ticker;
        this.preferences = Caffeine.newBuilder()
                .expireAfterWrite(preferenceTtl)
                .maximumSize(1)
                .ticker(ticker)
                .build();
        this.entities = Caffeine.newBuilder()
                .expireAfterWrite(entityTtl)
                .maximumSize(1)
                .ticker(ticker)
                .build();
        this.lastAccessNanos = ticker.read();
    }

    public UUID projectId() {
        return projectId;
    }

    public Map<String, PreferenceValue> preferences(Function<UUID, Map<String, PreferenceValue>> loader) {
        touch();
        return preferences.get(KEY, k -> Collections.unmodifiableMap(new LinkedHashMap<>(loader.apply(projectId))));
    }

    /**
     * Returns the live scenes of the project, loading them on a miss. A load that started before an
     * invalidation is returned to its caller but not cached.
     */
    public List<VersionedArtifact> liveEntities(Function<UUID, List<VersionedArtifact>> loader) {
        touch();
        List<VersionedArtifact> cached = entities.getIfPresent(KEY);
        if (cached != null) {
            return cached;
        }
        long generation = entityGeneration.get();
        List<VersionedArtifact> loaded = List.copyOf(loader.apply(projectId));
        synchronized (entityMonitor) {
            if (!closed && entityGeneration.get() == generation) {
                entities.put(KEY, loaded);
            }
        }
        return loaded;
    }

    public void invalidateEntities() {
        synchronized (entityMonitor) {
            entityGeneration.incrementAndGet();
            entities.invalidateAll();
        }
    }

    public void invalidatePreferences() {
        preferences.invalidateAll();
    }

    boolean isIdle(Duration idleTimeout) {
        return ticker.read() - lastAccessNanos >= idleTimeout.toNanos();
    }

    void close() {
        synchronized (entityMonitor) {
            closed = true;
            entityGeneration.incrementAndGet();
        }
        preferences.invalidateAll();
        entities.invalidateAll();
        preferences.cleanUp();
        entities.cleanUp();
    }

    private void touch() {
        lastAccessNanos = ticker.read();
    }
}

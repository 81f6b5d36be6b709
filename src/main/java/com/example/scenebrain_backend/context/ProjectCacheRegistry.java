package com.example.scenebrain_backend.context;

import com.example.scenebrain_backend.config.ContextProperties;
import com.example.scenebrain_backend.sync.CommitListener;
import com.example.scenebrain_backend.sync.VersionedArtifact;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One cache arena per project, opened on first use and closed on project teardown or after an
 * idle period. Entity lists are invalidated synchronously by commits.
 */
@Component
public class ProjectCacheRegistry implements CommitListener {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProjectCacheRegistry.class);

    private final ContextProperties props;
    private final Ticker ticker;
    private final Map<UUID, ProjectCacheArena> arenas = new ConcurrentHashMap<>();

    @Autowired
    public ProjectCacheRegistry(ContextProperties props) {
        this(props, Ticker.systemTicker());
    }

    public ProjectCacheRegistry(ContextProperties props, Ticker ticker) {
        this.props = props;
        this.ticker = ticker;
    }

    public ProjectCacheArena forProject(UUID projectId) {
        return arenas.computeIfAbsent(projectId, id -> {
            LOGGER.debug("cache arena opened projectId={}", id);
            return new ProjectCacheArena(id, props.getPreferenceTtl(), props.getEntityListTtl(), ticker);
        });
    }

    public boolean isOpen(UUID projectId) {
        return arenas.containsKey(projectId);
    }

    public void close(UUID projectId) {
        ProjectCacheArena arena = arenas.remove(projectId);
        if (arena != null) {
            arena.close();
            LOGGER.info("cache arena closed projectId={}", projectId);
        }
    }

    public void invalidatePreferences(UUID projectId) {
        ProjectCacheArena arena = arenas.get(projectId);
        if (arena != null) {
            arena.invalidatePreferences();
        }
    }

    @Override
    public void onCommit(VersionedArtifact artifact) {
        ProjectCacheArena arena = arenas.get(artifact.projectId());
        if (arena != null) {
            arena.invalidateEntities();
            LOGGER.trace("entity list invalidated projectId={} entityId={} token={}",
                    artifact.projectId(), artifact.entityId(), artifact.versionToken());
        }
    }

    @Scheduled(fixedDelayString = "${brain.context.arena-sweep-millis:60000}")
    public void evictIdle() {
        sweepIdle();
    }

    /**
     * Closes every arena idle for longer than the configured timeout.
     *
     * @return number of arenas closed.
     */
    int sweepIdle() {
        int closed = 0;
        for (Map.Entry<UUID, ProjectCacheArena> entry : arenas.entrySet()) {
            ProjectCacheArena arena = entry.getValue();
            if (arena.isIdle(props.getArenaIdleTimeout()) && arenas.remove(entry.getKey(), arena)) {
                arena.close();
                closed++;
            }
        }
        if (closed > 0) {
            LOGGER.info("cache arenas evicted idle={} open={}", closed, arenas.size());
        }
        return closed;
    }

    public int openArenas() {
        return arenas.size();
    }
}

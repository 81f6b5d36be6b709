package com.example.scenebrain_backend.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * At most one in-flight generation or edit per entity. A second request is rejected instead of
 * queued.
 */
@Component
public class EntityLockRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(EntityLockRegistry.class);

    private final Map<UUID, String> holders = new ConcurrentHashMap<>();

    /**
     * Claims the entity for {@code owner}.
     *
     * @throws BusyException when another owner holds the entity.
     */
    public Lease acquire(UUID entityId, String owner) {
        String current = holders.putIfAbsent(entityId, owner);
        if (current != null && !current.equals(owner)) {
            LOGGER.info("entity busy entityId={} holder={} requester={}", entityId, current, owner);
            throw new BusyException(entityId, "Scene " + entityId + " is already being changed");
        }
        return new Lease(entityId, owner, current == null);
    }

    public boolean isHeld(UUID entityId) {
        return holders.containsKey(entityId);
    }

    public final class Lease implements AutoCloseable {
        private final UUID entityId;
        private final String owner;
        private final boolean acquired;

        private Lease(UUID entityId, String owner, boolean acquired) {
            this.entityId = entityId;
            this.owner = owner;
            this.acquired = acquired;
        }

        public UUID entityId() {
            return entityId;
        }

        @Override
        public void close() {
            if (acquired) {
                holders.remove(entityId, owner);
            }
        }
    }
}

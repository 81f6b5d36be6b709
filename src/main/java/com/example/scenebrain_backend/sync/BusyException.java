package com.example.scenebrain_backend.sync;

import com.example.scenebrain_backend.api.BrainException;

import java.util.UUID;

/**
 * The entity is being mutated by another request. Callers may retry later.
 */
public class BusyException extends BrainException {

    private final UUID entityId;

    public BusyException(UUID entityId, String message) {
        super("BUSY", message);
        this.entityId = entityId;
    }

    public UUID getEntityId() {
        return entityId;
    }
}

package com.example.scenebrain_backend.api;

import java.util.UUID;

public class EntityNotFoundException extends BrainException {

    private final UUID entityId;

    public EntityNotFoundException(UUID entityId) {
        super("ENTITY_NOT_FOUND", "Entity " + entityId + " does not exist");
        this.entityId = entityId;
    }

    public UUID getEntityId() {
        return entityId;
    }
}

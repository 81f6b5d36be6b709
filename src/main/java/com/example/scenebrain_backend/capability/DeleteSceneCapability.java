package com.example.scenebrain_backend.capability;

import com.example.scenebrain_backend.api.EntityNotFoundException;
import com.example.scenebrain_backend.brain.ToolSelection;
import com.example.scenebrain_backend.sync.EntityLockRegistry;
import com.example.scenebrain_backend.sync.StateSyncService;
import com.example.scenebrain_backend.sync.VersionedArtifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Deletes a scene by committing a tombstone. Later scenes shift down one display number.
 */
@Component
public class DeleteSceneCapability implements Capability<ToolSelection.Delete> {
    private static final Logger LOGGER = LoggerFactory.getLogger(DeleteSceneCapability.class);

    private final StateSyncService stateSync;
    private final EntityLockRegistry locks;

    public DeleteSceneCapability(StateSyncService stateSync, EntityLockRegistry locks) {
        this.stateSync = stateSync;
        this.locks = locks;
    }

    @Override
    public VersionedArtifact execute(ToolSelection.Delete selection, CapabilityContext context) {
        try (EntityLockRegistry.Lease lease = locks.acquire(selection.targetEntityId(), context.owner())) {
            VersionedArtifact current = stateSync.observe(selection.targetEntityId());
            if (!current.isLive()) {
                throw new EntityNotFoundException(selection.targetEntityId());
            }
            VersionedArtifact tombstone = stateSync.commit(selection.targetEntityId(), current.payload().tombstone());
            LOGGER.info("Deleted scene entityId={} project={} token={}", tombstone.entityId(), tombstone.projectId(),
                    tombstone.versionToken());
            return tombstone;
        }
    }
}

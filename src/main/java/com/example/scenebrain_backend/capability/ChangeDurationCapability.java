package com.example.scenebrain_backend.capability;

import com.example.scenebrain_backend.api.EntityNotFoundException;
import com.example.scenebrain_backend.brain.ToolSelection;
import com.example.scenebrain_backend.sync.ScenePayload;
import com.example.scenebrain_backend.sync.EntityLockRegistry;
import com.example.scenebrain_backend.sync.StateSyncService;
import com.example.scenebrain_backend.sync.VersionedArtifact;
import org.springframework.stereotype.Component;

@Component
public class ChangeDurationCapability implements Capability<ToolSelection.ChangeDuration> {

    private final StateSyncService stateSync;
    private final EntityLockRegistry locks;

    public ChangeDurationCapability(StateSyncService stateSync, EntityLockRegistry locks) {
        this.stateSync = stateSync;
        this.locks = locks;
    }

    @Override
    public VersionedArtifact execute(ToolSelection.ChangeDuration selection, CapabilityContext context) {
        try (EntityLockRegistry.Lease lease = locks.acquire(selection.targetEntityId(), context.owner())) {
            VersionedArtifact current = stateSync.observe(selection.targetEntityId());
            if (!current.isLive()) {
                throw new EntityNotFoundException(selection.targetEntityId());
            }
            return stateSync.commit(selection.targetEntityId(), current.payload().withDuration(frames(selection.seconds())));
        }
    }

    static int frames(double seconds) {
        return Math.max(1, (int) Math.round(seconds * ScenePayload.FPS));
    }
}

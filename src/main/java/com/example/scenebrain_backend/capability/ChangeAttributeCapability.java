package com.example.scenebrain_backend.capability;

import com.example.scenebrain_backend.api.EntityNotFoundException;
import com.example.scenebrain_backend.brain.NoCapabilityMatchException;
import com.example.scenebrain_backend.brain.ToolSelection;
import com.example.scenebrain_backend.sync.ScenePayload;
import com.example.scenebrain_backend.sync.EntityLockRegistry;
import com.example.scenebrain_backend.sync.StateSyncService;
import com.example.scenebrain_backend.sync.VersionedArtifact;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Sets one attribute without touching the code. {@code name} and {@code timeline_position} map onto
 * the scene itself, anything else lands in the attribute map.
 */
@Component
public class ChangeAttributeCapability implements Capability<ToolSelection.ChangeAttribute> {

    private final StateSyncService stateSync;
    private final EntityLockRegistry locks;

    public ChangeAttributeCapability(StateSyncService stateSync, EntityLockRegistry locks) {
        this.stateSync = stateSync;
        this.locks = locks;
    }

    @Override
    public VersionedArtifact execute(ToolSelection.ChangeAttribute selection, CapabilityContext context) {
        try (EntityLockRegistry.Lease lease = locks.acquire(selection.targetEntityId(), context.owner())) {
            return change(selection);
        }
    }

    private VersionedArtifact change(ToolSelection.ChangeAttribute selection) {
        VersionedArtifact current = stateSync.observe(selection.targetEntityId());
        if (!current.isLive()) {
            throw new EntityNotFoundException(selection.targetEntityId());
        }
        ScenePayload payload = current.payload();
        String attribute = selection.attribute().trim().toLowerCase(Locale.ROOT).replace(' ', '_');
        ScenePayload next = switch (attribute) {
            case "name", "title" -> payload.withCode(selection.value(), payload.code());
            case "timeline_position", "timelineposition", "position" -> payload.withTimelinePosition(position(selection.value()));
            default -> payload.withAttribute(attribute, selection.value());
        };
        return stateSync.commit(selection.targetEntityId(), next);
    }

    private static Integer position(String value) {
        try {
            int position = Integer.parseInt(value.trim());
            if (position < 0) {
                throw new NoCapabilityMatchException("Timeline position must not be negative");
            }
            return position;
        } catch (NumberFormatException e) {
            throw new NoCapabilityMatchException("Timeline position must be a number, got '" + value + "'", e);
        }
    }
}

package com.example.scenebrain_backend.capability;

import com.example.scenebrain_backend.api.EntityNotFoundException;
import com.example.scenebrain_backend.api.ImageRef;
import com.example.scenebrain_backend.brain.EditComplexity;
import com.example.scenebrain_backend.brain.ToolSelection;
import com.example.scenebrain_backend.sync.ScenePayload;
import com.example.scenebrain_backend.sync.EntityLockRegistry;
import com.example.scenebrain_backend.sync.StateSyncService;
import com.example.scenebrain_backend.sync.VersionedArtifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Rewrites the code of an existing scene. Surgical edits run on the fast model, creative and
 * structural edits on the quality model.
 */
@Component
public class EditSceneCapability implements Capability<ToolSelection.Edit> {
    private static final Logger LOGGER = LoggerFactory.getLogger(EditSceneCapability.class);

    private final SceneCodeGenerator generator;
    private final StateSyncService stateSync;
    private final EntityLockRegistry locks;

    public EditSceneCapability(SceneCodeGenerator generator, StateSyncService stateSync, EntityLockRegistry locks) {
        this.generator = generator;
        this.stateSync = stateSync;
        this.locks = locks;
    }

    @Override
    public VersionedArtifact execute(ToolSelection.Edit selection, CapabilityContext context) {
        try (EntityLockRegistry.Lease lease = locks.acquire(selection.targetEntityId(), context.owner())) {
            return edit(selection, context);
        }
    }

    private VersionedArtifact edit(ToolSelection.Edit selection, CapabilityContext context) {
        VersionedArtifact current = stateSync.observe(selection.targetEntityId());
        if (!current.isLive()) {
            throw new EntityNotFoundException(selection.targetEntityId());
        }
        EditComplexity complexity = selection.complexity();
        String guidance = rules(complexity) + ScenePrompts.context(context.bundle());
        String instruction = "Current scene \"" + current.payload().name() + "\" ("
                + current.payload().durationInFrames() + " frames):\n```tsx\n" + current.payload().code()
                + "\n```\nInstruction: " + selection.instruction();
        List<String> imageUrls = context.request().attachedImageRefs().stream()
                .filter(ref -> ref.id().equals(selection.imageRefId()))
                .map(ImageRef::url)
                .toList();

        GeneratedScene scene = generator.generate(complexity.modelTier(), guidance, instruction, imageUrls);
        ScenePayload next = current.payload().withCode(scene.name(), scene.code()).withAttributes(scene.attributes());
        if (complexity != EditComplexity.SURGICAL && scene.durationInFrames() != null && scene.durationInFrames() > 0) {
            next = next.withDuration(scene.durationInFrames());
        }
        VersionedArtifact committed = stateSync.commit(selection.targetEntityId(), next);
        LOGGER.info("Edited scene entityId={} complexity={} tier={} token={}", committed.entityId(), complexity,
                complexity.modelTier(), committed.versionToken());
        return committed;
    }

    static String rules(EditComplexity complexity) {
        return switch (complexity) {
            case SURGICAL -> "Change only what the instruction names. Every other line of the code stays identical.\n";
            case CREATIVE -> "Restyle freely but keep the scene's structure, copy and timing.\n";
            case STRUCTURAL -> "You may rearrange and rebuild the layout. Keep the scene's message and copy.\n";
        };
    }
}

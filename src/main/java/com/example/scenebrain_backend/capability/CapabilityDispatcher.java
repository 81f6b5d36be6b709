package com.example.scenebrain_backend.capability;

import com.example.scenebrain_backend.brain.ToolSelection;
import com.example.scenebrain_backend.sync.VersionedArtifact;
import org.springframework.stereotype.Component;

/**
 * Routes a selection to the capability serving its variant.
 */
@Component
public class CapabilityDispatcher {

    private final CreateSceneCapability create;
    private final EditSceneCapability edit;
    private final ChangeAttributeCapability changeAttribute;
    private final ChangeDurationCapability changeDuration;
    private final DeleteSceneCapability delete;

    public CapabilityDispatcher(CreateSceneCapability create,
                                EditSceneCapability edit,
                                ChangeAttributeCapability changeAttribute,
                                ChangeDurationCapability changeDuration,
                                DeleteSceneCapability delete) {
        this.create = create;
        this.edit = edit;
        this.changeAttribute = changeAttribute;
        this.changeDuration = changeDuration;
        this.delete = delete;
    }

    public VersionedArtifact execute(ToolSelection selection, CapabilityContext context) {
        return selection.accept(new ToolSelection.Visitor<>() {
            @Override
            public VersionedArtifact visitCreate(ToolSelection.Create s) {
                return create.execute(s, context);
            }

            @Override
            public VersionedArtifact visitEdit(ToolSelection.Edit s) {
                return edit.execute(s, context);
            }

            @Override
            public VersionedArtifact visitChangeAttribute(ToolSelection.ChangeAttribute s) {
                return changeAttribute.execute(s, context);
            }

            @Override
            public VersionedArtifact visitChangeDuration(ToolSelection.ChangeDuration s) {
                return changeDuration.execute(s, context);
            }

            @Override
            public VersionedArtifact visitDelete(ToolSelection.Delete s) {
                return delete.execute(s, context);
            }
        });
    }
}

package com.example.scenebrain_backend.brain;

import java.util.UUID;

/**
 * One capability invocation chosen for a request. Consumers dispatch through {@link Visitor}, so a
 * new variant does not compile until every consumer handles it.
 */
public sealed interface ToolSelection
        permits ToolSelection.Create, ToolSelection.Edit, ToolSelection.ChangeAttribute,
        ToolSelection.ChangeDuration, ToolSelection.Delete {

    UUID targetEntityId();

    <R> R accept(Visitor<R> visitor);

    default String toolName() {
        return accept(new Visitor<>() {
            @Override
            public String visitCreate(Create create) {
                return "create";
            }

            @Override
            public String visitEdit(Edit edit) {
                return "edit";
            }

            @Override
            public String visitChangeAttribute(ChangeAttribute change) {
                return "change_attribute";
            }

            @Override
            public String visitChangeDuration(ChangeDuration change) {
                return "change_duration";
            }

            @Override
            public String visitDelete(Delete delete) {
                return "delete";
            }
        });
    }

    interface Visitor<R> {
        R visitCreate(Create create);

        R visitEdit(Edit edit);

        R visitChangeAttribute(ChangeAttribute change);

        R visitChangeDuration(ChangeDuration change);

        R visitDelete(Delete delete);
    }

    /**
     * @param imageRefId image the scene should be built from, may be {@code null}.
     */
    record Create(String instruction, String imageRefId) implements ToolSelection {
        @Override
        public UUID targetEntityId() {
            return null;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCreate(this);
        }
    }

    record Edit(UUID targetEntityId, EditComplexity complexity, String instruction, String imageRefId)
            implements ToolSelection {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitEdit(this);
        }
    }

    record ChangeAttribute(UUID targetEntityId, String attribute, String value) implements ToolSelection {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitChangeAttribute(this);
        }
    }

    record ChangeDuration(UUID targetEntityId, double seconds) implements ToolSelection {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitChangeDuration(this);
        }
    }

    record Delete(UUID targetEntityId) implements ToolSelection {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDelete(this);
        }
    }
}

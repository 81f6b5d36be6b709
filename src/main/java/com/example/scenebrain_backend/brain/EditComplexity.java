package com.example.scenebrain_backend.brain;

import com.example.scenebrain_backend.llm.ModelTier;

import java.util.Locale;
import java.util.Optional;

/**
 * Routing label of an edit. Surgical edits take the fast path, the others the quality path.
 */
public enum EditComplexity {
    SURGICAL(ModelTier.FAST),
    CREATIVE(ModelTier.QUALITY),
    STRUCTURAL(ModelTier.QUALITY);

    private final ModelTier modelTier;

    EditComplexity(ModelTier modelTier) {
        this.modelTier = modelTier;
    }

    public ModelTier modelTier() {
        return modelTier;
    }

    public static Optional<EditComplexity> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}

package com.example.scenebrain_backend.context;

import java.util.List;

/**
 * Style traits recurring across the scenes of a project.
 */
public record PatternSummary(List<String> recurringColors, List<String> stylePatterns, List<String> commonElements) {

    public static final PatternSummary EMPTY = new PatternSummary(List.of(), List.of(), List.of());

    public PatternSummary {
        recurringColors = recurringColors == null ? List.of() : List.copyOf(recurringColors);
        stylePatterns = stylePatterns == null ? List.of() : List.copyOf(stylePatterns);
        commonElements = commonElements == null ? List.of() : List.copyOf(commonElements);
    }
}

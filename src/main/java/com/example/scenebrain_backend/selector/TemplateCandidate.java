package com.example.scenebrain_backend.selector;

import java.util.List;
import java.util.Set;

/**
 * Read-only catalog entry.
 */
public record TemplateCandidate(String id,
                                String name,
                                ProfileVector targetProfile,
                                Set<String> keywords,
                                List<Requirement> contentRequirements) {

    public TemplateCandidate {
        keywords = keywords == null ? Set.of() : Set.copyOf(keywords);
        contentRequirements = contentRequirements == null ? List.of() : List.copyOf(contentRequirements);
    }
}

package com.example.scenebrain_backend.selector;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Normalized brand/style profile the template scoring engine matches against.
 *
 * @param personality personality vector.
 * @param keywords    lower-cased industry keywords.
 */
public record BrandProfile(ProfileVector personality, Set<String> keywords) {

    public BrandProfile {
        personality = personality == null ? ProfileVector.neutral() : personality;
        Set<String> normalized = new LinkedHashSet<>();
        if (keywords != null) {
            for (String keyword : keywords) {
                if (keyword != null && !keyword.isBlank()) {
                    normalized.add(keyword.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        keywords = Set.copyOf(normalized);
    }
}

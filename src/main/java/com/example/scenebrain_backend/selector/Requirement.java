package com.example.scenebrain_backend.selector;

/**
 * Hard content requirement of a template.
 *
 * @param type     what the template needs.
 * @param minCount minimum number of items, only meaningful for {@link RequirementType#MIN_FEATURES}.
 */
public record Requirement(RequirementType type, int minCount) {

    public static Requirement of(RequirementType type) {
        return new Requirement(type, 0);
    }

    public static Requirement minFeatures(int minCount) {
        return new Requirement(RequirementType.MIN_FEATURES, minCount);
    }

    public boolean isMetBy(AvailableContent content) {
        if (content == null) {
            return false;
        }
        return switch (type) {
            case LOGO -> content.hasLogo();
            case SOCIAL_PROOF -> content.hasSocialProof();
            case SCREENSHOTS -> content.hasScreenshots();
            case MIN_FEATURES -> content.featureCount() >= minCount;
        };
    }
}

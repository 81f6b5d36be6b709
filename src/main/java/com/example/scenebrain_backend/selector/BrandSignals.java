package com.example.scenebrain_backend.selector;

import java.util.List;

/**
 * Raw brand traits extracted from a website or entered by the user.
 *
 * @param adjectives     voice adjectives and keywords.
 * @param tone           free-text tone description.
 * @param accentColors   accent palette.
 * @param gradientCount  number of brand gradients.
 * @param animationStyle preferred animation style, may be {@code null}.
 * @param keywords       industry keywords passed through to the profile.
 */
public record BrandSignals(List<String> adjectives,
                           String tone,
                           List<String> accentColors,
                           int gradientCount,
                           String animationStyle,
                           List<String> keywords) {

    public BrandSignals {
        adjectives = adjectives == null ? List.of() : List.copyOf(adjectives);
        accentColors = accentColors == null ? List.of() : List.copyOf(accentColors);
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }
}

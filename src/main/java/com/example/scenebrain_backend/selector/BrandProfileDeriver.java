package com.example.scenebrain_backend.selector;

import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Rule-based personality estimate used when no profile was supplied with the request.
 */
@Component
public class BrandProfileDeriver {

    private static final Pattern CALM_ANIMATION = Pattern.compile("calm|smooth|gentle");
    private static final Pattern ENERGETIC_ANIMATION = Pattern.compile("energetic|dynamic|punchy");

    public BrandProfile derive(BrandSignals signals) {
        Set<String> adjectives = new LinkedHashSet<>();
        for (String adjective : signals.adjectives()) {
            if (adjective != null) {
                adjectives.add(adjective.toLowerCase(Locale.ROOT));
            }
        }
        String tone = signals.tone() == null ? "" : signals.tone().toLowerCase(Locale.ROOT);
        int paletteSize = signals.accentColors().size();

        double corporate = 0.5;
        double minimalist = 0.5;
        double playful = 0.5;
        double technical = 0.5;
        double bold = 0.5;
        double modern = 0.5;

        if (has(adjectives, tone, "enterprise", "professional", "secure", "trustworthy", "regulated")) {
            corporate += 0.25;
        }
        if (has(adjectives, tone, "friendly", "approachable", "playful", "fun", "delightful")) {
            playful += 0.3;
            corporate -= 0.1;
        }
        if (has(adjectives, tone, "minimal", "clean", "simple", "elegant", "sleek")) {
            minimalist += 0.3;
        }
        if (paletteSize <= 2) {
            minimalist += 0.1;
        }
        if (has(adjectives, tone, "technical", "developer", "api", "data", "analytics", "automation", "ai")) {
            technical += 0.3;
        }
        if (has(adjectives, tone, "bold", "powerful", "dynamic", "impactful", "vibrant")) {
            bold += 0.3;
        }
        if (paletteSize >= 3 || signals.gradientCount() > 0) {
            bold += 0.1;
        }
        if (has(adjectives, tone, "modern", "innovative", "future", "cutting-edge", "next-gen")) {
            modern += 0.3;
        }

        String animation = signals.animationStyle() == null ? "" : signals.animationStyle().toLowerCase(Locale.ROOT);
        if (CALM_ANIMATION.matcher(animation).find()) {
            minimalist += 0.05;
        }
        if (ENERGETIC_ANIMATION.matcher(animation).find()) {
            bold += 0.1;
            playful += 0.05;
        }

        corporate = ProfileVector.clamp(corporate);
        playful = ProfileVector.clamp(playful);
        if (playful > 0.7) {
            corporate -= 0.1;
        }
        if (corporate > 0.7) {
            playful -= 0.1;
        }

        return new BrandProfile(new ProfileVector(corporate, minimalist, playful, technical, bold, modern),
                new LinkedHashSet<>(signals.keywords()));
    }

    private static boolean has(Set<String> adjectives, String tone, String... keywords) {
        for (String keyword : keywords) {
            if (adjectives.contains(keyword) || tone.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}

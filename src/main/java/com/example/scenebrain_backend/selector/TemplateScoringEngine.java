package com.example.scenebrain_backend.selector;

import com.example.scenebrain_backend.config.ScoringProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Weighted template matcher. Pure: the result depends only on the arguments and the configured
 * weights, and equal scores keep catalog order.
 */
@Component
public class TemplateScoringEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(TemplateScoringEngine.class);

    private static final double STRONG_MATCH = 0.8;
    private static final double MISMATCH = 0.6;
    private static final double KEYWORD_ALIGNED = 0.6;

    private final ScoringProperties props;

    public TemplateScoringEngine(ScoringProperties props) {
        this.props = props;
    }

    /**
     * Scores every candidate against the profile.
     *
     * @param profile          brand profile; a neutral profile is used when {@code null}.
     * @param candidates       catalog entries in catalog order.
     * @param availableContent what the user can supply.
     * @return scored templates sorted by descending score, empty for empty input.
     */
    public List<ScoredTemplate> score(BrandProfile profile, List<TemplateCandidate> candidates, AvailableContent availableContent) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        BrandProfile effective = profile == null ? new BrandProfile(ProfileVector.neutral(), Set.of()) : profile;
        AvailableContent content = availableContent == null ? AvailableContent.none() : availableContent;
        ScoringProperties.Weights weights = props.getWeights();

        List<ScoredTemplate> scored = new ArrayList<>(candidates.size());
        for (TemplateCandidate candidate : candidates) {
            if (candidate == null) {
                continue;
            }
            double profileMatch = clamp(1.0 - effective.personality().meanDistance(candidate.targetProfile()));
            double keywordMatch = keywordMatch(effective.keywords(), candidate.keywords());
            double contentAvailability = contentAvailability(candidate.contentRequirements(), content);

            double score = clamp(weights.getProfileMatch() * profileMatch
                    + weights.getKeywordMatch() * keywordMatch
                    + weights.getContentAvailability() * contentAvailability);

            ScoreBreakdown breakdown = new ScoreBreakdown(profileMatch, keywordMatch, contentAvailability);
            String reasoning = reasoning(breakdown, candidate.contentRequirements(), content);
            scored.add(new ScoredTemplate(candidate, score, breakdown, reasoning));
            LOGGER.trace("template {} profile={} keyword={} content={} -> {}", candidate.id(),
                    fmt(profileMatch), fmt(keywordMatch), fmt(contentAvailability), fmt(score));
        }

        scored.sort(Comparator.comparingDouble(ScoredTemplate::score).reversed());
        LOGGER.debug("TemplateScoringEngine candidates={} top={} topScore={}", candidates.size(),
                scored.isEmpty() ? "-" : scored.get(0).candidate().id(),
                scored.isEmpty() ? "-" : fmt(scored.get(0).score()));
        return List.copyOf(scored);
    }

    public Optional<ScoredTemplate> select(BrandProfile profile, List<TemplateCandidate> candidates, AvailableContent availableContent) {
        List<ScoredTemplate> scored = score(profile, candidates, availableContent);
        return scored.isEmpty() ? Optional.empty() : Optional.of(scored.get(0));
    }

    double keywordMatch(Set<String> brandKeywords, Set<String> templateKeywords) {
        if (brandKeywords.isEmpty() || templateKeywords.isEmpty()) {
            return 0.0;
        }
        long matched = templateKeywords.stream()
                .map(k -> k.toLowerCase(Locale.ROOT))
                .filter(k -> brandKeywords.stream().anyMatch(b -> b.contains(k)))
                .count();
        int saturation = Math.max(1, props.getKeywordSaturation());
        return Math.min((double) matched / saturation, 1.0);
    }

    double contentAvailability(List<Requirement> requirements, AvailableContent content) {
        double value = 1.0;
        for (Requirement requirement : requirements) {
            if (!requirement.isMetBy(content)) {
                value -= props.penaltyFor(requirement.type());
            }
        }
        return clamp(value);
    }

    private static String reasoning(ScoreBreakdown breakdown, List<Requirement> requirements, AvailableContent content) {
        List<String> reasons = new ArrayList<>();
        if (breakdown.profileMatch() > STRONG_MATCH) {
            reasons.add("Strong personality match (" + percent(breakdown.profileMatch()) + "%)");
        } else if (breakdown.profileMatch() < MISMATCH) {
            reasons.add("Personality mismatch (" + percent(breakdown.profileMatch()) + "%)");
        }
        if (breakdown.keywordMatch() > KEYWORD_ALIGNED) {
            reasons.add("Industry keywords align well");
        }
        for (Requirement requirement : requirements) {
            if (requirement.isMetBy(content)) {
                continue;
            }
            reasons.add(switch (requirement.type()) {
                case LOGO -> "Logo missing for this template";
                case SOCIAL_PROOF -> "No social proof available";
                case SCREENSHOTS -> "Screenshots not available";
                case MIN_FEATURES -> "Not enough features provided";
            });
        }
        return reasons.isEmpty() ? "Good all-around match" : String.join(". ", reasons);
    }

    private static long percent(double value) {
        return Math.round(value * 100);
    }

    private static String fmt(double value) {
        return String.format(Locale.ROOT, "%.3f", value);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value) || value < 0.0) {
            return 0.0;
        }
        return Math.min(1.0, value);
    }
}

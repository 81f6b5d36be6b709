package com.example.scenebrain_backend.config;

import com.example.scenebrain_backend.selector.RequirementType;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.EnumMap;
import java.util.Map;

/**
 * Policy constants of the template scoring engine. The defaults reproduce the tuned production
 * weights; operators override them in {@code application.yml}.
 */
@ConfigurationProperties(prefix = "brain.scoring")
public class ScoringProperties {

    private Weights weights = new Weights();
    private int keywordSaturation = 3;
    private Map<RequirementType, Double> penalties = defaultPenalties();

    public Weights getWeights() {
        return weights;
    }

    public void setWeights(Weights weights) {
        this.weights = weights;
    }

    public int getKeywordSaturation() {
        return keywordSaturation;
    }

    public void setKeywordSaturation(int keywordSaturation) {
        this.keywordSaturation = keywordSaturation;
    }

    public Map<RequirementType, Double> getPenalties() {
        return penalties;
    }

    public void setPenalties(Map<RequirementType, Double> penalties) {
        this.penalties = penalties;
    }

    /**
     * Returns the penalty applied when a requirement of the given type is not met.
     *
     * @param type requirement type.
     * @return penalty in {@code [0,1]}, {@code 0} when not configured.
     */
    public double penaltyFor(RequirementType type) {
        Double value = penalties == null ? null : penalties.get(type);
        return value == null ? 0.0 : Math.max(0.0, Math.min(1.0, value));
    }

    private static Map<RequirementType, Double> defaultPenalties() {
        Map<RequirementType, Double> map = new EnumMap<>(RequirementType.class);
        map.put(RequirementType.LOGO, 0.3);
        map.put(RequirementType.SOCIAL_PROOF, 0.2);
        map.put(RequirementType.SCREENSHOTS, 0.2);
        map.put(RequirementType.MIN_FEATURES, 0.3);
        return map;
    }

    public static class Weights {
        private double profileMatch = 0.6;
        private double keywordMatch = 0.25;
        private double contentAvailability = 0.15;

        public Weights() {
        }

        public Weights(double profileMatch, double keywordMatch, double contentAvailability) {
            this.profileMatch = profileMatch;
            this.keywordMatch = keywordMatch;
            this.contentAvailability = contentAvailability;
        }

        public double getProfileMatch() {
            return profileMatch;
        }

        public void setProfileMatch(double profileMatch) {
            this.profileMatch = profileMatch;
        }

        public double getKeywordMatch() {
            return keywordMatch;
        }

        public void setKeywordMatch(double keywordMatch) {
            this.keywordMatch = keywordMatch;
        }

        public double getContentAvailability() {
            return contentAvailability;
        }

        public void setContentAvailability(double contentAvailability) {
            this.contentAvailability = contentAvailability;
        }

        public double sum() {
            return profileMatch + keywordMatch + contentAvailability;
        }
    }
}

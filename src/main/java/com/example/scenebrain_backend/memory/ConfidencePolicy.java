package com.example.scenebrain_backend.memory;

import com.example.scenebrain_backend.config.LearnerProperties;
import org.springframework.stereotype.Component;

/**
 * Confidence arithmetic for preferences. Results are clamped to {@code [0,1]} and rounded to six
 * decimals so repeated increments do not drift.
 */
@Component
public class ConfidencePolicy {

    private final LearnerProperties props;

    public ConfidencePolicy(LearnerProperties props) {
        this.props = props;
    }

    public double explicitStart() {
        return bound(props.getExplicitConfidence());
    }

    /**
     * Starting confidence of a pattern first seen {@code occurrences} times.
     */
    public double patternStart(int occurrences) {
        int extra = Math.max(0, occurrences - 1);
        double start = props.getPatternStartConfidence() + props.getRecurrenceIncrement() * extra;
        return bound(Math.min(props.getPatternStartCap(), start));
    }

    public double inferredStart() {
        return bound(props.getPatternStartConfidence());
    }

    public double reinforce(double current) {
        return bound(current + props.getRecurrenceIncrement());
    }

    public double contradict(double current) {
        return bound(current - props.getContradictionDecrement());
    }

    public boolean isPublishable(double confidence) {
        return confidence >= props.getPublishThreshold();
    }

    public boolean isHigh(double confidence) {
        return confidence >= props.getHighConfidence();
    }

    public int repeatThreshold() {
        return props.getRepeatThreshold();
    }

    static double bound(double value) {
        if (Double.isNaN(value) || value < 0.0) {
            return 0.0;
        }
        double clamped = Math.min(1.0, value);
        return Math.round(clamped * 1_000_000d) / 1_000_000d;
    }
}

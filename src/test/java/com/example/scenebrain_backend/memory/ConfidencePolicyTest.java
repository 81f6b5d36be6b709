package com.example.scenebrain_backend.memory;

import com.example.scenebrain_backend.config.LearnerProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ConfidencePolicyTest {

    private final ConfidencePolicy policy = new ConfidencePolicy(new LearnerProperties());

    @Test
    void patternStartGrowsWithOccurrencesUpToCap() {
        assertThat(policy.patternStart(1)).isEqualTo(0.5);
        assertThat(policy.patternStart(2)).isCloseTo(0.6, within(1e-9));
        assertThat(policy.patternStart(3)).isCloseTo(0.7, within(1e-9));
        assertThat(policy.patternStart(10)).isCloseTo(0.7, within(1e-9));
    }

    @Test
    void reinforceAndContradictStayWithinBounds() {
        assertThat(policy.reinforce(0.95)).isEqualTo(1.0);
        assertThat(policy.contradict(0.1)).isEqualTo(0.0);
        assertThat(policy.contradict(0.9)).isCloseTo(0.7, within(1e-9));
    }

    @Test
    void repeatedIncrementsDoNotDrift() {
        double c = 0.5;
        for (int i = 0; i < 3; i++) {
            c = policy.reinforce(c);
        }
        assertThat(c).isEqualTo(0.8);
    }

    @Test
    void publishAndHighThresholds() {
        assertThat(policy.isPublishable(0.5)).isTrue();
        assertThat(policy.isPublishable(0.49)).isFalse();
        assertThat(policy.isHigh(0.7)).isTrue();
        assertThat(policy.isHigh(0.69)).isFalse();
    }
}

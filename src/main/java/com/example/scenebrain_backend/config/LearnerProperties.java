package com.example.scenebrain_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Thresholds and confidence increments of the background preference learner.
 */
@ConfigurationProperties(prefix = "brain.learner")
public class LearnerProperties {

    private boolean enabled = true;
    private int minPriorTurns = 2;
    private int maxHistoryMessages = 60;
    private int repeatThreshold = 3;
    private double publishThreshold = 0.5;
    private double explicitConfidence = 0.9;
    private double patternStartConfidence = 0.5;
    private double patternStartCap = 0.7;
    private double recurrenceIncrement = 0.1;
    private double contradictionDecrement = 0.2;
    private double highConfidence = 0.7;
    private int errorChannelCapacity = 50;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getMinPriorTurns() {
        return minPriorTurns;
    }

    public void setMinPriorTurns(int minPriorTurns) {
        this.minPriorTurns = minPriorTurns;
    }

    public int getMaxHistoryMessages() {
        return maxHistoryMessages;
    }

    public void setMaxHistoryMessages(int maxHistoryMessages) {
        this.maxHistoryMessages = maxHistoryMessages;
    }

    public int getRepeatThreshold() {
        return repeatThreshold;
    }

    public void setRepeatThreshold(int repeatThreshold) {
        this.repeatThreshold = repeatThreshold;
    }

    public double getPublishThreshold() {
        return publishThreshold;
    }

    public void setPublishThreshold(double publishThreshold) {
        this.publishThreshold = publishThreshold;
    }

    public double getExplicitConfidence() {
        return explicitConfidence;
    }

    public void setExplicitConfidence(double explicitConfidence) {
        this.explicitConfidence = explicitConfidence;
    }

    public double getPatternStartConfidence() {
        return patternStartConfidence;
    }

    public void setPatternStartConfidence(double patternStartConfidence) {
        this.patternStartConfidence = patternStartConfidence;
    }

    public double getPatternStartCap() {
        return patternStartCap;
    }

    public void setPatternStartCap(double patternStartCap) {
        this.patternStartCap = patternStartCap;
    }

    public double getRecurrenceIncrement() {
        return recurrenceIncrement;
    }

    public void setRecurrenceIncrement(double recurrenceIncrement) {
        this.recurrenceIncrement = recurrenceIncrement;
    }

    public double getContradictionDecrement() {
        return contradictionDecrement;
    }

    public void setContradictionDecrement(double contradictionDecrement) {
        this.contradictionDecrement = contradictionDecrement;
    }

    public double getHighConfidence() {
        return highConfidence;
    }

    public void setHighConfidence(double highConfidence) {
        this.highConfidence = highConfidence;
    }

    public int getErrorChannelCapacity() {
        return errorChannelCapacity;
    }

    public void setErrorChannelCapacity(int errorChannelCapacity) {
        this.errorChannelCapacity = errorChannelCapacity;
    }
}

package com.example.scenebrain_backend.selector;

public record AvailableContent(boolean hasLogo, boolean hasSocialProof, boolean hasScreenshots, int featureCount) {

    public static AvailableContent everything(int featureCount) {
        return new AvailableContent(true, true, true, featureCount);
    }

    public static AvailableContent none() {
        return new AvailableContent(false, false, false, 0);
    }
}

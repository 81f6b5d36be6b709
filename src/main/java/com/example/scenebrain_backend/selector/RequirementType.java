package com.example.scenebrain_backend.selector;

public enum RequirementType {
    LOGO,
    SOCIAL_PROOF,
    SCREENSHOTS,
    MIN_FEATURES
}

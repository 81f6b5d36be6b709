package com.example.scenebrain_backend.memory;

public enum PreferenceSource {
    EXPLICIT,
    PATTERN,
    INFERRED
}

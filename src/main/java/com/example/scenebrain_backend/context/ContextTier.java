package com.example.scenebrain_backend.context;

public enum ContextTier {
    LIGHT,
    STANDARD,
    FULL
}

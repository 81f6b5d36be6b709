package com.example.scenebrain_backend.llm;

/**
 * Resource class of a model call. Surgical work goes to {@link #FAST}; creative and structural
 * generation goes to {@link #QUALITY}.
 */
public enum ModelTier {
    FAST,
    QUALITY,
    VISION
}

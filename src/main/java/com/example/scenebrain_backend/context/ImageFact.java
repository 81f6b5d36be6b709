package com.example.scenebrain_backend.context;

import java.util.List;

/**
 * Analysis result of one uploaded image.
 */
public record ImageFact(String imageRefId,
                        List<String> palette,
                        String mood,
                        String layout,
                        String detectedText,
                        double confidence) {

    public ImageFact {
        palette = palette == null ? List.of() : List.copyOf(palette);
    }
}

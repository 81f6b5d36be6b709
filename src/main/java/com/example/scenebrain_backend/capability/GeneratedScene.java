package com.example.scenebrain_backend.capability;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GeneratedScene(String name, String code, Integer durationInFrames, Map<String, String> attributes) {

    public GeneratedScene {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }
}

package com.example.scenebrain_backend.learning;

/**
 * A concrete (key, value) preference candidate found in text or in a generated scene.
 */
public record PreferenceSignal(String key, String value) {
}

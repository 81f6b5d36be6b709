package com.example.scenebrain_backend.memory;

import java.time.Instant;

/**
 * A learned or stated preference. Confidence is always within {@code [0,1]}.
 */
public record PreferenceValue(String key,
                              String value,
                              double confidence,
                              PreferenceScope scope,
                              PreferenceSource source,
                              Instant updatedAt) {

    public static PreferenceValue fromEntry(MemoryEntry entry) {
        String[] parts = MemoryKeys.parsePreference(entry.key())
                .orElseThrow(() -> new IllegalArgumentException("Not a preference key: " + entry.key()));
        double confidence = entry.confidence() == null ? 0.0 : entry.confidence();
        return new PreferenceValue(parts[0], parts[1], confidence,
                entry.scope() == null ? PreferenceScope.PROJECT : entry.scope(),
                entry.source() == null ? PreferenceSource.INFERRED : entry.source(),
                entry.updatedAt());
    }
}

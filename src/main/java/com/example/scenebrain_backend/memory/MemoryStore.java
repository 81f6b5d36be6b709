package com.example.scenebrain_backend.memory;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistent project-scoped key/value facts.
 * Every method throws {@link MemoryStoreUnavailableException} when the store cannot be reached.
 */
public interface MemoryStore {

    Optional<MemoryEntry> get(UUID projectId, String key);

    /**
     * Inserts or replaces the value stored under {@code key}.
     *
     * @param confidence confidence in {@code [0,1]}, {@code null} for facts without one.
     */
    default MemoryEntry put(UUID projectId, String key, String value, Double confidence) {
        return put(projectId, key, value, confidence, null, null);
    }

    MemoryEntry put(UUID projectId, String key, String value, Double confidence,
                    PreferenceScope scope, PreferenceSource source);

    /**
     * Lists entries whose key starts with {@code prefix}, ordered by key.
     */
    List<MemoryEntry> list(UUID projectId, String prefix);
}

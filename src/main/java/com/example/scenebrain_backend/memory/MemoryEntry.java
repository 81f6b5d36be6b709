package com.example.scenebrain_backend.memory;

import java.time.Instant;
import java.util.UUID;

public record MemoryEntry(UUID projectId,
                          String key,
                          String value,
                          Double confidence,
                          PreferenceScope scope,
                          PreferenceSource source,
                          MemoryType type,
                          Instant updatedAt) {
}

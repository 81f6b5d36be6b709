package com.example.scenebrain_backend.memory;

import com.example.scenebrain_backend.model.ProjectMemory;
import com.example.scenebrain_backend.repository.ProjectMemoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

@Service
public class JpaMemoryStore implements MemoryStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(JpaMemoryStore.class);

    private final ProjectMemoryRepository repository;
    private final Clock clock;

    public JpaMemoryStore(ProjectMemoryRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Override
    public Optional<MemoryEntry> get(UUID projectId, String key) {
        Objects.requireNonNull(projectId, "projectId");
        return guarded("get", () -> repository.findByProjectIdAndMemoryKey(projectId, key).map(JpaMemoryStore::toEntry));
    }

    @Override
    public MemoryEntry put(UUID projectId, String key, String value, Double confidence,
                           PreferenceScope scope, PreferenceSource source) {
        Objects.requireNonNull(projectId, "projectId");
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("memory key is required");
        }
        Double bounded = confidence == null ? null : Math.max(0.0, Math.min(1.0, confidence));
        return guarded("put", () -> {
            try {
                return toEntry(upsert(projectId, key, value, bounded, scope, source));
            } catch (DataIntegrityViolationException race) {
                LOGGER.debug("memory put raced on insert projectId={} key={}, updating instead", projectId, key);
                return toEntry(upsert(projectId, key, value, bounded, scope, source));
            }
        });
    }

    @Override
    public List<MemoryEntry> list(UUID projectId, String prefix) {
        Objects.requireNonNull(projectId, "projectId");
        String effective = prefix == null ? "" : prefix;
        return guarded("list", () -> repository.findByPrefix(projectId, effective).stream()
                .map(JpaMemoryStore::toEntry)
                .toList());
    }

    private ProjectMemory upsert(UUID projectId, String key, String value, Double confidence,
                                 PreferenceScope scope, PreferenceSource source) {
        ProjectMemory row = repository.findByProjectIdAndMemoryKey(projectId, key)
                .orElseGet(() -> new ProjectMemory(projectId, key, MemoryType.fromKey(key)));
        row.setMemoryValue(value == null ? "" : value);
        row.setConfidence(confidence);
        if (scope != null) {
            row.setScope(scope);
        }
        if (source != null) {
            row.setSource(source);
        }
        row.setUpdatedAt(Instant.now(clock));
        return repository.saveAndFlush(row);
    }

    private <T> T guarded(String operation, Supplier<T> body) {
        try {
            return body.get();
        } catch (DataAccessResourceFailureException | TransientDataAccessResourceException
                 | CannotCreateTransactionException e) {
            LOGGER.warn("memory store unavailable op={} cause={}", operation, e.getMessage());
            throw new MemoryStoreUnavailableException("Memory store unavailable during " + operation, e);
        }
    }

    private static MemoryEntry toEntry(ProjectMemory row) {
        return new MemoryEntry(row.getProjectId(), row.getMemoryKey(), row.getMemoryValue(), row.getConfidence(),
                row.getScope(), row.getSource(), row.getMemoryType(), row.getUpdatedAt());
    }
}

package com.example.scenebrain_backend.sync;

import com.example.scenebrain_backend.memory.MemoryStoreUnavailableException;
import com.example.scenebrain_backend.model.Scene;
import com.example.scenebrain_backend.repository.SceneRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Repository
public class JpaArtifactPersistence implements ArtifactPersistence {
    private static final Logger LOGGER = LoggerFactory.getLogger(JpaArtifactPersistence.class);
    private static final TypeReference<Map<String, String>> ATTRIBUTES = new TypeReference<>() {
    };

    private final SceneRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @PersistenceContext
    private EntityManager entityManager;

    public JpaArtifactPersistence(SceneRepository repository, ObjectMapper objectMapper, Clock clock) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public Optional<VersionedArtifact> find(UUID entityId) {
        try {
            return repository.findById(entityId).map(this::toArtifact);
        } catch (DataAccessResourceFailureException | CannotCreateTransactionException e) {
            throw new MemoryStoreUnavailableException("Entity persistence unavailable", e);
        }
    }

    @Override
    @Transactional
    public boolean insert(VersionedArtifact artifact) {
        if (repository.existsById(artifact.entityId())) {
            return false;
        }
        ScenePayload payload = artifact.payload();
        Scene scene = new Scene(artifact.entityId(), payload.projectId(), payload.introducedOrder());
        scene.setName(payload.name());
        scene.setCode(payload.code());
        scene.setDurationInFrames(payload.durationInFrames());
        scene.setTimelinePosition(payload.timelinePosition());
        scene.setTemplateId(payload.templateId());
        scene.setAttributesJson(writeAttributes(payload.attributes()));
        scene.setDeleted(payload.deleted());
        scene.setVersionToken(artifact.versionToken());
        scene.setUpdatedAt(Instant.now(clock));
        entityManager.persist(scene);
        return true;
    }

    @Override
    public boolean update(VersionedArtifact next, long expectedToken) {
        ScenePayload payload = next.payload();
        int rows = repository.updateIfToken(next.entityId(), expectedToken, next.versionToken(),
                payload.name(), payload.code(), payload.durationInFrames(), payload.timelinePosition(),
                payload.templateId(), writeAttributes(payload.attributes()), payload.deleted(), Instant.now(clock));
        if (rows != 1) {
            LOGGER.debug("conditional scene update missed entityId={} expectedToken={}", next.entityId(), expectedToken);
        }
        return rows == 1;
    }

    @Override
    public List<VersionedArtifact> listByProject(UUID projectId) {
        try {
            return repository.findByProjectIdOrderByIntroducedOrderAsc(projectId).stream()
                    .map(this::toArtifact)
                    .toList();
        } catch (DataAccessResourceFailureException | CannotCreateTransactionException e) {
            throw new MemoryStoreUnavailableException("Entity persistence unavailable", e);
        }
    }

    @Override
    public long maxIntroducedOrder(UUID projectId) {
        return repository.maxIntroducedOrder(projectId);
    }

    private VersionedArtifact toArtifact(Scene scene) {
        ScenePayload payload = new ScenePayload(scene.getProjectId(), scene.getName(), scene.getCode(),
                scene.getDurationInFrames(), scene.getTimelinePosition(), scene.getTemplateId(),
                readAttributes(scene.getAttributesJson()), scene.isDeleted(), scene.getIntroducedOrder());
        return new VersionedArtifact(scene.getId(), payload, scene.getVersionToken());
    }

    private String writeAttributes(Map<String, String> attributes) {
        try {
            return objectMapper.writeValueAsString(attributes);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize scene attributes", e);
        }
    }

    private Map<String, String> readAttributes(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, ATTRIBUTES);
        } catch (JsonProcessingException e) {
            LOGGER.warn("Unreadable scene attributes, ignoring: {}", e.getOriginalMessage());
            return Map.of();
        }
    }
}

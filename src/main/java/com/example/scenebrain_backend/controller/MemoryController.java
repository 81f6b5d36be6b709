package com.example.scenebrain_backend.controller;

import com.example.scenebrain_backend.context.ProjectCacheRegistry;
import com.example.scenebrain_backend.dto.PreferenceRequest;
import com.example.scenebrain_backend.dto.PreferencesResponse;
import com.example.scenebrain_backend.learning.LearningErrorChannel;
import com.example.scenebrain_backend.memory.MemoryEntry;
import com.example.scenebrain_backend.memory.MemoryKeys;
import com.example.scenebrain_backend.memory.MemoryStore;
import com.example.scenebrain_backend.memory.PreferenceScope;
import com.example.scenebrain_backend.memory.PreferenceService;
import com.example.scenebrain_backend.memory.PreferenceValue;
import com.example.scenebrain_backend.selector.BrandSignals;
import com.example.scenebrain_backend.sync.StateSyncService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Project memory: preferences, raw facts, brand signals and the project's cache session.
 */
@RestController
@RequestMapping("/v1")
public class MemoryController {

    private final PreferenceService preferenceService;
    private final MemoryStore memoryStore;
    private final ProjectCacheRegistry caches;
    private final LearningErrorChannel learningErrors;
    private final StateSyncService stateSync;
    private final ObjectMapper objectMapper;

    public MemoryController(PreferenceService preferenceService,
                            MemoryStore memoryStore,
                            ProjectCacheRegistry caches,
                            LearningErrorChannel learningErrors,
                            StateSyncService stateSync,
                            ObjectMapper objectMapper) {
        this.preferenceService = preferenceService;
        this.memoryStore = memoryStore;
        this.caches = caches;
        this.learningErrors = learningErrors;
        this.stateSync = stateSync;
        this.objectMapper = objectMapper;
    }

    @GetMapping("/projects/{projectId}/preferences")
    public PreferencesResponse preferences(@PathVariable UUID projectId) {
        return new PreferencesResponse(preferenceService.resolve(projectId), preferenceService.all(projectId));
    }

    @PutMapping("/projects/{projectId}/preferences")
    public PreferenceValue setPreference(@PathVariable UUID projectId, @Valid @RequestBody PreferenceRequest request) {
        PreferenceScope scope = request.scope() == null ? PreferenceScope.PROJECT : request.scope();
        PreferenceValue stored = preferenceService.recordExplicit(projectId, request.key(), request.value(), scope);
        caches.invalidatePreferences(projectId);
        return stored;
    }

    @GetMapping("/projects/{projectId}/memory")
    public List<MemoryEntry> memory(@PathVariable UUID projectId, @RequestParam(defaultValue = "") String prefix) {
        return memoryStore.list(projectId, prefix);
    }

    @PutMapping("/projects/{projectId}/brand")
    public MemoryEntry setBrand(@PathVariable UUID projectId, @RequestBody BrandSignals signals) {
        try {
            return memoryStore.put(projectId, MemoryKeys.BRAND_PROFILE, objectMapper.writeValueAsString(signals), null);
        } catch (JsonProcessingException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "BRAND_SIGNALS_INVALID", e);
        }
    }

    /**
     * Ends the project's cache session, e.g. when the user closes the project.
     */
    @DeleteMapping("/projects/{projectId}/session")
    public ResponseEntity<Void> closeSession(@PathVariable UUID projectId) {
        caches.close(projectId);
        stateSync.releaseProject(projectId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/learning/errors")
    public Map<String, Object> learningErrors() {
        return Map.of("total", learningErrors.totalFailures(), "recent", learningErrors.recent());
    }
}

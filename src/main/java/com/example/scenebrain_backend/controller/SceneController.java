package com.example.scenebrain_backend.controller;

import com.example.scenebrain_backend.dto.SceneResponse;
import com.example.scenebrain_backend.dto.SceneWriteRequest;
import com.example.scenebrain_backend.sync.EntityLockRegistry;
import com.example.scenebrain_backend.sync.ScenePayload;
import com.example.scenebrain_backend.sync.StateSyncService;
import com.example.scenebrain_backend.sync.VersionedArtifact;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Scene reads and manual edits. Writes go through the same commit protocol as the tools.
 */
@RestController
@RequestMapping("/v1")
public class SceneController {

    private final StateSyncService stateSync;
    private final EntityLockRegistry locks;

    public SceneController(StateSyncService stateSync, EntityLockRegistry locks) {
        this.stateSync = stateSync;
        this.locks = locks;
    }

    @GetMapping("/projects/{projectId}/scenes")
    public List<SceneResponse> list(@PathVariable UUID projectId) {
        List<VersionedArtifact> live = stateSync.listLive(projectId);
        List<SceneResponse> out = new ArrayList<>(live.size());
        for (int i = 0; i < live.size(); i++) {
            out.add(SceneResponse.from(live.get(i), i + 1));
        }
        return out;
    }

    @GetMapping("/scenes/{sceneId}")
    public SceneResponse get(@PathVariable UUID sceneId) {
        return SceneResponse.from(stateSync.observe(sceneId), null);
    }

    @PutMapping("/scenes/{sceneId}")
    public SceneResponse put(@PathVariable UUID sceneId, @Valid @RequestBody SceneWriteRequest request) {
        VersionedArtifact existing = stateSync.find(sceneId).orElse(null);
        if (existing != null && !existing.projectId().equals(request.projectId())) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "SCENE_BELONGS_TO_OTHER_PROJECT");
        }
        ScenePayload payload = new ScenePayload(request.projectId(), request.name(), request.code(),
                request.durationInFrames(), request.timelinePosition(), request.templateId(),
                request.attributes() == null ? Map.of() : request.attributes(), false, 0L);
        try (EntityLockRegistry.Lease lease = locks.acquire(sceneId, manualOwner())) {
            return SceneResponse.from(stateSync.commit(sceneId, payload), null);
        }
    }

    @DeleteMapping("/scenes/{sceneId}")
    public SceneResponse delete(@PathVariable UUID sceneId) {
        try (EntityLockRegistry.Lease lease = locks.acquire(sceneId, manualOwner())) {
            VersionedArtifact current = stateSync.observe(sceneId);
            if (!current.isLive()) {
                return SceneResponse.from(current, null);
            }
            return SceneResponse.from(stateSync.commit(sceneId, current.payload().tombstone()), null);
        }
    }

    private static String manualOwner() {
        return "manual-" + UUID.randomUUID();
    }
}

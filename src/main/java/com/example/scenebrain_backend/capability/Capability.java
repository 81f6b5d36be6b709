package com.example.scenebrain_backend.capability;

import com.example.scenebrain_backend.brain.ToolSelection;
import com.example.scenebrain_backend.sync.VersionedArtifact;

/**
 * One tool the orchestrator can run. Every capability writes through
 * {@link com.example.scenebrain_backend.sync.StateSyncService} and returns the committed artifact.
 *
 * @param <S> selection variant the capability serves.
 */
public interface Capability<S extends ToolSelection> {

    VersionedArtifact execute(S selection, CapabilityContext context);
}

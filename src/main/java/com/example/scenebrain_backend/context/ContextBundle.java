package com.example.scenebrain_backend.context;

import com.example.scenebrain_backend.api.Message;
import com.example.scenebrain_backend.memory.PreferenceValue;

import java.util.List;
import java.util.Map;

/**
 * Context handed to the selector and the capabilities. Lists and maps are immutable snapshots that
 * may be shared with the project cache.
 *
 * @param targetEntity the explicitly targeted scene, {@code null} when none was given or it is gone.
 * @param patterns     only computed for the full tier, {@link PatternSummary#EMPTY} otherwise.
 */
public record ContextBundle(ContextTier tier,
                            EntitySummary targetEntity,
                            List<EntitySummary> entityList,
                            Map<String, PreferenceValue> preferences,
                            List<Message> recentHistory,
                            List<ImageFact> imageFacts,
                            PatternSummary patterns,
                            boolean degraded) {

    public ContextBundle {
        entityList = entityList == null ? List.of() : List.copyOf(entityList);
        preferences = preferences == null ? Map.of() : preferences;
        recentHistory = recentHistory == null ? List.of() : List.copyOf(recentHistory);
        imageFacts = imageFacts == null ? List.of() : List.copyOf(imageFacts);
        patterns = patterns == null ? PatternSummary.EMPTY : patterns;
    }

    public static ContextBundle empty(ContextTier tier, List<Message> recentHistory) {
        return new ContextBundle(tier, null, List.of(), Map.of(), recentHistory, List.of(), PatternSummary.EMPTY, true);
    }
}

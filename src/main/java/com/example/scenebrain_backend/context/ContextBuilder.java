package com.example.scenebrain_backend.context;

import com.example.scenebrain_backend.api.EntityNotFoundException;
import com.example.scenebrain_backend.api.ImageRef;
import com.example.scenebrain_backend.api.Message;
import com.example.scenebrain_backend.api.OrchestrationRequest;
import com.example.scenebrain_backend.config.ContextProperties;
import com.example.scenebrain_backend.learning.ImageAnalysisService;
import com.example.scenebrain_backend.memory.ConversationStore;
import com.example.scenebrain_backend.memory.MemoryStoreUnavailableException;
import com.example.scenebrain_backend.memory.PreferenceService;
import com.example.scenebrain_backend.memory.PreferenceValue;
import com.example.scenebrain_backend.sync.StateSyncService;
import com.example.scenebrain_backend.sync.VersionedArtifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Assembles the tiered context of a request. Sub-fetches of a tier run concurrently on the
 * context fetch pool; preferences and the entity list come from the project's cache arena first.
 * Only an unreachable store fails the build, any other problem yields a degraded bundle.
 */
@Service
public class ContextBuilder {
    private static final Logger LOGGER = LoggerFactory.getLogger(ContextBuilder.class);

    private final ContextProperties props;
    private final StateSyncService stateSync;
    private final PreferenceService preferenceService;
    private final ConversationStore conversationStore;
    private final ImageAnalysisService imageAnalysis;
    private final PatternAnalyzer patternAnalyzer;
    private final ProjectCacheRegistry caches;
    private final Executor executor;

    public ContextBuilder(ContextProperties props,
                          StateSyncService stateSync,
                          PreferenceService preferenceService,
                          ConversationStore conversationStore,
                          ImageAnalysisService imageAnalysis,
                          PatternAnalyzer patternAnalyzer,
                          ProjectCacheRegistry caches,
                          @Qualifier("contextFetchExecutor") Executor executor) {
        this.props = props;
        this.stateSync = stateSync;
        this.preferenceService = preferenceService;
        this.conversationStore = conversationStore;
        this.imageAnalysis = imageAnalysis;
        this.patternAnalyzer = patternAnalyzer;
        this.caches = caches;
        this.executor = executor;
    }

    /**
     * Builds the context bundle for a classified request.
     *
     * @throws ContextUnavailableException when the memory store cannot be reached.
     */
    public ContextBundle build(OrchestrationRequest request, OperationClass classification) {
        ContextTier tier = classification.tier();
        long t0 = System.nanoTime();
        try {
            ContextBundle bundle = switch (tier) {
                case LIGHT -> light(request);
                case STANDARD -> standard(request);
                case FULL -> full(request);
            };
            LOGGER.debug("context built projectId={} class={} tier={} entities={} prefs={} history={} images={} in={}ms",
                    request.projectId(), classification, tier, bundle.entityList().size(), bundle.preferences().size(),
                    bundle.recentHistory().size(), bundle.imageFacts().size(), (System.nanoTime() - t0) / 1_000_000);
            return bundle;
        } catch (MemoryStoreUnavailableException e) {
            throw new ContextUnavailableException("Memory store unreachable for project " + request.projectId(), e);
        } catch (RuntimeException e) {
            LOGGER.warn("context degraded projectId={} tier={} cause={}", request.projectId(), tier, e.toString());
            return ContextBundle.empty(tier, tail(request.conversationHistory(), historySize(tier)));
        }
    }

    /**
     * Degraded bundle used when the store is unreachable: no entities or preferences, only the
     * request's own history tail for the tier.
     */
    public ContextBundle fallback(OrchestrationRequest request, OperationClass classification) {
        ContextTier tier = classification.tier();
        return ContextBundle.empty(tier, tail(request.conversationHistory(), historySize(tier)));
    }

    private ContextBundle light(OrchestrationRequest request) {
        List<Message> history = tail(request.conversationHistory(), props.getLightHistory());
        if (request.targetEntityId() == null) {
            return new ContextBundle(ContextTier.LIGHT, null, List.of(), Map.of(), history, List.of(), PatternSummary.EMPTY, false);
        }
        CompletableFuture<EntitySummary> target = async(() -> standaloneTarget(request.targetEntityId()));
        await(target);
        return new ContextBundle(ContextTier.LIGHT, target.join(), List.of(), Map.of(), history, List.of(), PatternSummary.EMPTY, false);
    }

    private ContextBundle standard(OrchestrationRequest request) {
        UUID projectId = request.projectId();
        ProjectCacheArena arena = caches.forProject(projectId);
        CompletableFuture<List<VersionedArtifact>> entities = async(() -> arena.liveEntities(stateSync::listLive));
        CompletableFuture<Map<String, PreferenceValue>> preferences = async(() -> arena.preferences(preferenceService::resolve));
        CompletableFuture<List<ImageFact>> images = request.attachedImageRefs().isEmpty()
                ? CompletableFuture.completedFuture(List.of())
                : async(() -> imageAnalysis.factsFor(projectId, request.attachedImageRefs(), props.getImageFactWait()));
        await(entities, preferences, images);

        List<EntitySummary> list = summaries(entities.join());
        return new ContextBundle(ContextTier.STANDARD, target(request.targetEntityId(), list), list, preferences.join(),
                tail(request.conversationHistory(), props.getStandardHistory()), images.join(), PatternSummary.EMPTY, false);
    }

    private ContextBundle full(OrchestrationRequest request) {
        UUID projectId = request.projectId();
        ProjectCacheArena arena = caches.forProject(projectId);
        CompletableFuture<List<VersionedArtifact>> entities = async(() -> arena.liveEntities(stateSync::listLive));
        CompletableFuture<Map<String, PreferenceValue>> preferences = async(() -> arena.preferences(preferenceService::resolve));
        CompletableFuture<List<Message>> history = async(() -> fullHistory(request));
        CompletableFuture<List<ImageFact>> images = async(() -> allImageFacts(request));
        CompletableFuture<PatternSummary> patterns = entities.thenApplyAsync(patternAnalyzer::analyze, executor);
        await(entities, preferences, history, images, patterns);

        List<EntitySummary> list = summaries(entities.join());
        return new ContextBundle(ContextTier.FULL, target(request.targetEntityId(), list), list, preferences.join(),
                history.join(), images.join(), patterns.join(), false);
    }

    private List<Message> fullHistory(OrchestrationRequest request) {
        List<Message> stored = conversationStore.recent(request.projectId(), props.getFullHistory());
        if (stored.isEmpty()) {
            return tail(request.conversationHistory(), props.getFullHistory());
        }
        return stored;
    }

    private List<ImageFact> allImageFacts(OrchestrationRequest request) {
        Map<String, ImageFact> byId = new LinkedHashMap<>();
        for (ImageFact fact : imageAnalysis.storedAll(request.projectId())) {
            byId.put(fact.imageRefId(), fact);
        }
        List<ImageRef> missing = request.attachedImageRefs().stream().filter(r -> !byId.containsKey(r.id())).toList();
        if (!missing.isEmpty()) {
            for (ImageFact fact : imageAnalysis.factsFor(request.projectId(), missing, props.getImageFactWait())) {
                byId.put(fact.imageRefId(), fact);
            }
        }
        return List.copyOf(byId.values());
    }

    private EntitySummary standaloneTarget(UUID entityId) {
        try {
            VersionedArtifact artifact = stateSync.observe(entityId);
            return artifact.isLive() ? EntitySummary.of(artifact, 0) : null;
        } catch (EntityNotFoundException e) {
            LOGGER.debug("target entity not found entityId={}", entityId);
            return null;
        }
    }

    private static EntitySummary target(UUID targetId, List<EntitySummary> list) {
        if (targetId == null) {
            return null;
        }
        return list.stream().filter(s -> s.entityId().equals(targetId)).findFirst().orElse(null);
    }

    private List<EntitySummary> summaries(List<VersionedArtifact> live) {
        List<EntitySummary> out = new ArrayList<>(Math.min(live.size(), props.getMaxCachedEntities()));
        int number = 1;
        for (VersionedArtifact artifact : live) {
            if (out.size() >= props.getMaxCachedEntities()) {
                break;
            }
            out.add(EntitySummary.of(artifact, number++));
        }
        return out;
    }

    private <T> CompletableFuture<T> async(Supplier<T> fetch) {
        return CompletableFuture.supplyAsync(fetch, executor);
    }

    private void await(CompletableFuture<?>... fetches) {
        try {
            CompletableFuture.allOf(fetches).get(props.getFetchTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        } catch (TimeoutException e) {
            for (CompletableFuture<?> fetch : fetches) {
                fetch.cancel(true);
            }
            throw new IllegalStateException("context fetch timed out after " + props.getFetchTimeout().toMillis() + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while building context", e);
        }
    }

    private static RuntimeException unwrap(Throwable cause) {
        Throwable current = cause;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        if (current instanceof RuntimeException runtime) {
            return runtime;
        }
        return new IllegalStateException(current);
    }

    private int historySize(ContextTier tier) {
        return switch (tier) {
            case LIGHT -> props.getLightHistory();
            case STANDARD -> props.getStandardHistory();
            case FULL -> props.getFullHistory();
        };
    }

    static List<Message> tail(List<Message> history, int size) {
        if (history == null || history.isEmpty() || size <= 0) {
            return List.of();
        }
        int from = Math.max(0, history.size() - size);
        return List.copyOf(history.subList(from, history.size()));
    }
}

package com.example.scenebrain_backend.learning;

import com.example.scenebrain_backend.api.ImageRef;
import com.example.scenebrain_backend.context.ImageFact;
import com.example.scenebrain_backend.llm.LlmMessage;
import com.example.scenebrain_backend.llm.ModelTier;
import com.example.scenebrain_backend.llm.SchemaRegistry;
import com.example.scenebrain_backend.llm.StructuredOutputService;
import com.example.scenebrain_backend.memory.MemoryEntry;
import com.example.scenebrain_backend.memory.MemoryKeys;
import com.example.scenebrain_backend.memory.MemoryStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Analyses uploaded images into {@link ImageFact}s stored under {@code image:<refId>}. Each image is
 * analysed in the background and at most once while an analysis is in flight.
 */
@Service
public class ImageAnalysisService {
    private static final Logger LOGGER = LoggerFactory.getLogger(ImageAnalysisService.class);

    static final String INSTRUCTION = "Describe the image for a motion designer: dominant palette as hex colours, "
            + "overall mood, layout and any readable text.";

    private final MemoryStore memoryStore;
    private final StructuredOutputService structuredOutput;
    private final ObjectMapper objectMapper;
    private final Executor executor;
    private final Map<String, CompletableFuture<ImageFact>> inFlight = new ConcurrentHashMap<>();

    public ImageAnalysisService(MemoryStore memoryStore,
                                StructuredOutputService structuredOutput,
                                ObjectMapper objectMapper,
                                @Qualifier("learnerTaskExecutor") Executor executor) {
        this.memoryStore = memoryStore;
        this.structuredOutput = structuredOutput;
        this.objectMapper = objectMapper;
        this.executor = executor;
    }

    public Optional<ImageFact> stored(UUID projectId, String imageRefId) {
        return memoryStore.get(projectId, MemoryKeys.image(imageRefId)).flatMap(this::parse);
    }

    public List<ImageFact> storedAll(UUID projectId) {
        List<ImageFact> out = new ArrayList<>();
        for (MemoryEntry entry : memoryStore.list(projectId, MemoryKeys.IMAGE_PREFIX)) {
            parse(entry).ifPresent(out::add);
        }
        return out;
    }

    /**
     * Starts the analysis of an image unless its facts are stored or an analysis is running.
     */
    public CompletableFuture<ImageFact> analyze(UUID projectId, ImageRef ref) {
        Optional<ImageFact> known = stored(projectId, ref.id());
        if (known.isPresent()) {
            return CompletableFuture.completedFuture(known.get());
        }
        if (ref.url() == null || ref.url().isBlank()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Image " + ref.id() + " has no url"));
        }
        String key = projectId + ":" + ref.id();
        CompletableFuture<ImageFact> created = new CompletableFuture<>();
        CompletableFuture<ImageFact> running = inFlight.putIfAbsent(key, created);
        if (running != null) {
            return running;
        }
        start(projectId, ref, key, created);
        return created;
    }

    /**
     * Facts for the given images: stored ones immediately, the rest awaited up to {@code wait} in total.
     * Images whose analysis is not done in time are left out.
     */
    public List<ImageFact> factsFor(UUID projectId, List<ImageRef> refs, Duration wait) {
        Map<String, ImageFact> facts = new LinkedHashMap<>();
        Map<String, CompletableFuture<ImageFact>> pending = new LinkedHashMap<>();
        for (ImageRef ref : refs) {
            Optional<ImageFact> known = stored(projectId, ref.id());
            if (known.isPresent()) {
                facts.put(ref.id(), known.get());
            } else {
                pending.put(ref.id(), analyze(projectId, ref));
            }
        }
        long deadline = System.nanoTime() + wait.toNanos();
        for (Map.Entry<String, CompletableFuture<ImageFact>> entry : pending.entrySet()) {
            long remaining = Math.max(0, deadline - System.nanoTime());
            try {
                facts.put(entry.getKey(), entry.getValue().get(remaining, TimeUnit.NANOSECONDS));
            } catch (TimeoutException e) {
                LOGGER.debug("image facts not ready projectId={} imageRefId={}", projectId, entry.getKey());
            } catch (ExecutionException e) {
                LOGGER.warn("image analysis failed projectId={} imageRefId={} cause={}", projectId, entry.getKey(),
                        e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        List<ImageFact> ordered = new ArrayList<>();
        for (ImageRef ref : refs) {
            ImageFact fact = facts.get(ref.id());
            if (fact != null) {
                ordered.add(fact);
            }
        }
        return ordered;
    }

    private void start(UUID projectId, ImageRef ref, String key, CompletableFuture<ImageFact> result) {
        try {
            executor.execute(() -> {
                try {
                    result.complete(runAnalysis(projectId, ref));
                } catch (RuntimeException e) {
                    result.completeExceptionally(e);
                } finally {
                    inFlight.remove(key, result);
                }
            });
        } catch (RejectedExecutionException e) {
            LOGGER.warn("image analysis rejected projectId={} imageRefId={}", projectId, ref.id());
            inFlight.remove(key, result);
            result.completeExceptionally(e);
        }
    }

    private ImageFact runAnalysis(UUID projectId, ImageRef ref) {
        long t0 = System.nanoTime();
        JsonNode out = structuredOutput.call(ModelTier.VISION, SchemaRegistry.IMAGE_ANALYSIS,
                List.of(LlmMessage.userWithImages(INSTRUCTION, List.of(ref.url()))));
        List<String> palette = new ArrayList<>();
        out.path("palette").forEach(n -> palette.add(n.asText()));
        ImageFact fact = new ImageFact(ref.id(), palette, out.path("mood").asText(""),
                textOrNull(out.path("layout")), textOrNull(out.path("detectedText")),
                out.path("confidence").isNumber() ? out.path("confidence").asDouble() : 0.8);
        try {
            memoryStore.put(projectId, MemoryKeys.image(ref.id()), objectMapper.writeValueAsString(fact), fact.confidence());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize image fact", e);
        }
        LOGGER.info("image analysed projectId={} imageRefId={} in={}ms", projectId, ref.id(), (System.nanoTime() - t0) / 1_000_000);
        return fact;
    }

    private Optional<ImageFact> parse(MemoryEntry entry) {
        try {
            return Optional.of(objectMapper.readValue(entry.value(), ImageFact.class));
        } catch (JsonProcessingException e) {
            LOGGER.warn("unreadable image fact key={} cause={}", entry.key(), e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private static String textOrNull(JsonNode node) {
        return node.isTextual() ? node.asText() : null;
    }
}

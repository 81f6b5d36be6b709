package com.example.scenebrain_backend.capability;

import com.example.scenebrain_backend.api.ImageRef;
import com.example.scenebrain_backend.api.Message;
import com.example.scenebrain_backend.api.OrchestrationRequest;
import com.example.scenebrain_backend.brain.ToolSelection;
import com.example.scenebrain_backend.context.ContextBundle;
import com.example.scenebrain_backend.learning.PreferenceSignalExtractor;
import com.example.scenebrain_backend.llm.ModelTier;
import com.example.scenebrain_backend.memory.MemoryKeys;
import com.example.scenebrain_backend.memory.MemoryStore;
import com.example.scenebrain_backend.memory.MemoryStoreUnavailableException;
import com.example.scenebrain_backend.memory.PreferenceValue;
import com.example.scenebrain_backend.selector.AvailableContent;
import com.example.scenebrain_backend.selector.BrandProfile;
import com.example.scenebrain_backend.selector.ScoredTemplate;
import com.example.scenebrain_backend.selector.TemplateCatalog;
import com.example.scenebrain_backend.selector.TemplateScoringEngine;
import com.example.scenebrain_backend.sync.ScenePayload;
import com.example.scenebrain_backend.sync.StateSyncService;
import com.example.scenebrain_backend.sync.VersionedArtifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Creates a new scene, optionally from an image. The best-scoring template guides generation and is
 * recorded on the scene.
 */
@Component
public class CreateSceneCapability implements Capability<ToolSelection.Create> {
    private static final Logger LOGGER = LoggerFactory.getLogger(CreateSceneCapability.class);

    static final int DEFAULT_DURATION_FRAMES = 5 * ScenePayload.FPS;
    static final String SOURCE_IMAGE_ATTRIBUTE = "source_image";

    private final SceneCodeGenerator generator;
    private final StateSyncService stateSync;
    private final TemplateScoringEngine scoringEngine;
    private final TemplateCatalog catalog;
    private final BrandProfileResolver brandProfiles;
    private final ContentInventory contentInventory;
    private final MemoryStore memoryStore;

    public CreateSceneCapability(SceneCodeGenerator generator,
                                 StateSyncService stateSync,
                                 TemplateScoringEngine scoringEngine,
                                 TemplateCatalog catalog,
                                 BrandProfileResolver brandProfiles,
                                 ContentInventory contentInventory,
                                 MemoryStore memoryStore) {
        this.generator = generator;
        this.stateSync = stateSync;
        this.scoringEngine = scoringEngine;
        this.catalog = catalog;
        this.brandProfiles = brandProfiles;
        this.contentInventory = contentInventory;
        this.memoryStore = memoryStore;
    }

    @Override
    public VersionedArtifact execute(ToolSelection.Create selection, CapabilityContext context) {
        OrchestrationRequest request = context.request();
        ContextBundle bundle = context.bundle();

        BrandProfile profile = brandProfiles.resolve(request);
        AvailableContent content = contentInventory.inspect(request, bundle);
        Optional<ScoredTemplate> template = scoringEngine.select(profile, catalog.all(), content);
        template.ifPresent(t -> LOGGER.info("Template chosen project={} template={} score={} reasoning='{}'",
                request.projectId(), t.candidate().id(), String.format("%.3f", t.score()), t.reasoning()));

        StringBuilder guidance = new StringBuilder();
        template.ifPresent(t -> guidance.append("Follow the \"").append(t.candidate().name())
                .append("\" template: ").append(t.reasoning()).append(".\n"));
        guidance.append(ScenePrompts.context(bundle));

        Optional<ImageRef> image = findImage(request, selection.imageRefId());
        List<String> imageUrls = image.map(ImageRef::url).filter(u -> u != null && !u.isBlank()).stream().toList();
        ModelTier tier = imageUrls.isEmpty() ? ModelTier.QUALITY : ModelTier.VISION;

        GeneratedScene scene = generator.generate(tier, guidance.toString(), selection.instruction(), imageUrls);
        int frames = scene.durationInFrames() != null && scene.durationInFrames() > 0
                ? scene.durationInFrames()
                : preferredFrames(bundle);

        ScenePayload payload = ScenePayload.create(request.projectId(), scene.name(), scene.code(), frames,
                        template.map(t -> t.candidate().id()).orElse(null))
                .withAttributes(scene.attributes());
        if (selection.imageRefId() != null) {
            payload = payload.withAttribute(SOURCE_IMAGE_ATTRIBUTE, selection.imageRefId());
        }
        VersionedArtifact artifact = stateSync.commit(UUID.randomUUID(), payload);
        if (selection.imageRefId() != null) {
            rememberSource(request.projectId(), artifact.entityId(), selection.imageRefId());
        }
        return artifact;
    }

    private void rememberSource(UUID projectId, UUID sceneId, String imageRefId) {
        try {
            memoryStore.put(projectId, MemoryKeys.sceneRelation(sceneId), MemoryKeys.image(imageRefId), null);
        } catch (MemoryStoreUnavailableException e) {
            // the scene is committed; only the relation fact is lost
            LOGGER.warn("Could not record scene source sceneId={} imageRefId={}: {}", sceneId, imageRefId, e.getMessage());
        }
    }

    static int preferredFrames(ContextBundle bundle) {
        PreferenceValue preferred = bundle.preferences().get(PreferenceSignalExtractor.PREFERRED_DURATION);
        if (preferred != null) {
            try {
                int seconds = Integer.parseInt(preferred.value().trim());
                if (seconds > 0) {
                    return seconds * ScenePayload.FPS;
                }
            } catch (NumberFormatException e) {
                LOGGER.debug("Ignoring non-numeric duration preference '{}'", preferred.value());
            }
        }
        return DEFAULT_DURATION_FRAMES;
    }

    private static Optional<ImageRef> findImage(OrchestrationRequest request, String imageRefId) {
        if (imageRefId == null) {
            return Optional.empty();
        }
        return Stream.concat(request.attachedImageRefs().stream(),
                        request.conversationHistory().stream().map(Message::imageRefs).flatMap(List::stream))
                .filter(ref -> imageRefId.equals(ref.id()))
                .findFirst();
    }
}

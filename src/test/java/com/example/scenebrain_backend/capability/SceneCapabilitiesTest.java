package com.example.scenebrain_backend.capability;

import com.example.scenebrain_backend.api.EntityNotFoundException;
import com.example.scenebrain_backend.api.ImageRef;
import com.example.scenebrain_backend.api.OrchestrationRequest;
import com.example.scenebrain_backend.brain.EditComplexity;
import com.example.scenebrain_backend.brain.NoCapabilityMatchException;
import com.example.scenebrain_backend.brain.ToolSelection;
import com.example.scenebrain_backend.config.ScoringProperties;
import com.example.scenebrain_backend.context.ContextBundle;
import com.example.scenebrain_backend.context.ContextTier;
import com.example.scenebrain_backend.context.PatternSummary;
import com.example.scenebrain_backend.llm.ModelTier;
import com.example.scenebrain_backend.memory.InMemoryMemoryStore;
import com.example.scenebrain_backend.memory.MemoryKeys;
import com.example.scenebrain_backend.memory.PreferenceScope;
import com.example.scenebrain_backend.memory.PreferenceSource;
import com.example.scenebrain_backend.memory.PreferenceValue;
import com.example.scenebrain_backend.selector.BrandProfileDeriver;
import com.example.scenebrain_backend.selector.TemplateCatalog;
import com.example.scenebrain_backend.selector.TemplateScoringEngine;
import com.example.scenebrain_backend.sync.BusyException;
import com.example.scenebrain_backend.sync.EntityLockRegistry;
import com.example.scenebrain_backend.sync.InMemoryArtifactPersistence;
import com.example.scenebrain_backend.sync.ScenePayload;
import com.example.scenebrain_backend.sync.StateSyncService;
import com.example.scenebrain_backend.sync.VersionedArtifact;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SceneCapabilitiesTest {

    @Mock
    private SceneCodeGenerator generator;

    private final UUID projectId = UUID.randomUUID();
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ContextBundle bundle = new ContextBundle(ContextTier.FULL, null, List.of(), Map.of(), List.of(),
            List.of(), PatternSummary.EMPTY, false);
    private StateSyncService stateSync;
    private InMemoryMemoryStore memoryStore;
    private EntityLockRegistry locks;
    private CapabilityDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        stateSync = new StateSyncService(new InMemoryArtifactPersistence(), List.of());
        memoryStore = new InMemoryMemoryStore();
        CreateSceneCapability create = new CreateSceneCapability(generator, stateSync,
                new TemplateScoringEngine(new ScoringProperties()), new TemplateCatalog(objectMapper),
                new BrandProfileResolver(memoryStore, new BrandProfileDeriver(), objectMapper),
                new ContentInventory(), memoryStore);
        locks = new EntityLockRegistry();
        dispatcher = new CapabilityDispatcher(create, new EditSceneCapability(generator, stateSync, locks),
                new ChangeAttributeCapability(stateSync, locks), new ChangeDurationCapability(stateSync, locks),
                new DeleteSceneCapability(stateSync, locks));
    }

    private CapabilityContext context(OrchestrationRequest request) {
        return new CapabilityContext(request, bundle);
    }

    private VersionedArtifact existing(String name) {
        return stateSync.commit(UUID.randomUUID(), ScenePayload.create(projectId, name, "<h1>" + name + "</h1>", 90, null));
    }

    @Test
    void createFromImageUsesVisionAndRecordsSource() {
        ImageRef screenshot = new ImageRef("img-1", "https://cdn.example.com/app.png");
        OrchestrationRequest request = new OrchestrationRequest(projectId, "u1",
                "create a fintech intro from this screenshot", null, List.of(), List.of(screenshot), null);
        when(generator.generate(eq(ModelTier.VISION), anyString(), eq("create a fintech intro from this screenshot"),
                eq(List.of("https://cdn.example.com/app.png"))))
                .thenReturn(new GeneratedScene("Intro", "<Intro/>", null, Map.of("primary_color", "teal")));

        VersionedArtifact created = dispatcher.execute(
                new ToolSelection.Create("create a fintech intro from this screenshot", "img-1"), context(request));

        assertThat(created.versionToken()).isEqualTo(1L);
        assertThat(created.payload().durationInFrames()).isEqualTo(CreateSceneCapability.DEFAULT_DURATION_FRAMES);
        assertThat(created.payload().templateId()).isNotBlank();
        assertThat(created.payload().attributes())
                .containsEntry("primary_color", "teal")
                .containsEntry(CreateSceneCapability.SOURCE_IMAGE_ATTRIBUTE, "img-1");
        assertThat(memoryStore.get(projectId, MemoryKeys.sceneRelation(created.entityId())))
                .hasValueSatisfying(e -> assertThat(e.value()).isEqualTo("image:img-1"));
    }

    @Test
    void preferredDurationFillsMissingLength() {
        PreferenceValue eightSeconds = new PreferenceValue("preferred_duration", "8", 0.9, PreferenceScope.PROJECT,
                PreferenceSource.EXPLICIT, Instant.EPOCH);
        ContextBundle withPreference = new ContextBundle(ContextTier.FULL, null, List.of(),
                Map.of("preferred_duration", eightSeconds), List.of(), List.of(), PatternSummary.EMPTY, false);

        assertThat(CreateSceneCapability.preferredFrames(withPreference)).isEqualTo(240);
        assertThat(CreateSceneCapability.preferredFrames(bundle)).isEqualTo(150);
    }

    @Test
    void surgicalEditKeepsDurationAndUsesFastModel() {
        VersionedArtifact scene = existing("Intro");
        when(generator.generate(eq(ModelTier.FAST), anyString(), anyString(), eq(List.of())))
                .thenReturn(new GeneratedScene(null, "<h1 style={{color: 'blue'}}>Intro</h1>", 300, Map.of()));

        VersionedArtifact edited = dispatcher.execute(new ToolSelection.Edit(scene.entityId(), EditComplexity.SURGICAL,
                "change the text color to blue", null), context(OrchestrationRequest.of(projectId, "change the text color to blue")));

        assertThat(edited.versionToken()).isEqualTo(2L);
        assertThat(edited.payload().name()).isEqualTo("Intro");
        assertThat(edited.payload().durationInFrames()).isEqualTo(90);
        assertThat(edited.payload().code()).contains("blue");
    }

    @Test
    void concurrentEditOfTheSameSceneIsRejected() throws Exception {
        VersionedArtifact scene = existing("Intro");
        CountDownLatch inside = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(generator.generate(eq(ModelTier.QUALITY), anyString(), anyString(), eq(List.of()))).thenAnswer(invocation -> {
            inside.countDown();
            release.await(5, TimeUnit.SECONDS);
            return new GeneratedScene(null, "<Intro variant='one'/>", null, Map.of());
        });
        ToolSelection.Edit first = new ToolSelection.Edit(scene.entityId(), EditComplexity.CREATIVE, "make it bolder", null);
        ToolSelection.Edit second = new ToolSelection.Edit(scene.entityId(), EditComplexity.CREATIVE, "make it calmer", null);

        CompletableFuture<VersionedArtifact> running = CompletableFuture.supplyAsync(() ->
                dispatcher.execute(first, context(OrchestrationRequest.of(projectId, "make it bolder"))));
        assertThat(inside.await(5, TimeUnit.SECONDS)).isTrue();

        assertThatThrownBy(() -> dispatcher.execute(second, context(OrchestrationRequest.of(projectId, "make it calmer"))))
                .isInstanceOf(BusyException.class);
        assertThatThrownBy(() -> dispatcher.execute(new ToolSelection.Delete(scene.entityId()),
                context(OrchestrationRequest.of(projectId, "delete it"))))
                .isInstanceOf(BusyException.class);

        release.countDown();
        VersionedArtifact edited = running.get(5, TimeUnit.SECONDS);
        assertThat(edited.versionToken()).isEqualTo(2L);
        assertThat(stateSync.observe(scene.entityId()).payload().code()).isEqualTo("<Intro variant='one'/>");
        assertThat(locks.isHeld(scene.entityId())).isFalse();
        verify(generator, times(1)).generate(eq(ModelTier.QUALITY), anyString(), anyString(), eq(List.of()));
    }

    @Test
    void leaseIsReleasedWhenTheStepFails() {
        VersionedArtifact scene = existing("Intro");
        dispatcher.execute(new ToolSelection.Delete(scene.entityId()), context(OrchestrationRequest.of(projectId, "delete it")));

        assertThatThrownBy(() -> dispatcher.execute(new ToolSelection.ChangeDuration(scene.entityId(), 3),
                context(OrchestrationRequest.of(projectId, "make it 3 seconds"))))
                .isInstanceOf(EntityNotFoundException.class);
        assertThat(locks.isHeld(scene.entityId())).isFalse();
    }

    @Test
    void structuralEditMayChangeDuration() {
        VersionedArtifact scene = existing("Intro");
        when(generator.generate(eq(ModelTier.QUALITY), anyString(), anyString(), eq(List.of())))
                .thenReturn(new GeneratedScene("Intro v2", "<Grid/>", 180, Map.of()));

        VersionedArtifact edited = dispatcher.execute(new ToolSelection.Edit(scene.entityId(), EditComplexity.STRUCTURAL,
                "redesign as a grid", null), context(OrchestrationRequest.of(projectId, "redesign as a grid")));

        assertThat(edited.payload().durationInFrames()).isEqualTo(180);
        assertThat(edited.payload().name()).isEqualTo("Intro v2");
    }

    @Test
    void editOfDeletedSceneIsNotFound() {
        VersionedArtifact scene = existing("Intro");
        stateSync.commit(scene.entityId(), scene.payload().tombstone());

        assertThatThrownBy(() -> dispatcher.execute(new ToolSelection.Edit(scene.entityId(), EditComplexity.CREATIVE,
                "make it pop", null), context(OrchestrationRequest.of(projectId, "make it pop"))))
                .isInstanceOf(EntityNotFoundException.class);
        verifyNoInteractions(generator);
    }

    @Test
    void attributeChangesDoNotTouchCode() {
        VersionedArtifact scene = existing("Intro");
        CapabilityContext ctx = context(OrchestrationRequest.of(projectId, "rename"));

        VersionedArtifact renamed = dispatcher.execute(new ToolSelection.ChangeAttribute(scene.entityId(), "Name", "Hero"), ctx);
        VersionedArtifact moved = dispatcher.execute(new ToolSelection.ChangeAttribute(scene.entityId(), "timeline position", "3"), ctx);
        VersionedArtifact tagged = dispatcher.execute(new ToolSelection.ChangeAttribute(scene.entityId(), "mood", "calm"), ctx);

        assertThat(renamed.payload().name()).isEqualTo("Hero");
        assertThat(moved.payload().timelinePosition()).isEqualTo(3);
        assertThat(tagged.payload().attributes()).containsEntry("mood", "calm");
        assertThat(tagged.payload().code()).isEqualTo(scene.payload().code());
        assertThat(tagged.versionToken()).isEqualTo(4L);
    }

    @Test
    void invalidPositionIsRejected() {
        VersionedArtifact scene = existing("Intro");

        assertThatThrownBy(() -> dispatcher.execute(new ToolSelection.ChangeAttribute(scene.entityId(), "position", "first"),
                context(OrchestrationRequest.of(projectId, "move it"))))
                .isInstanceOf(NoCapabilityMatchException.class);
    }

    @Test
    void durationIsConvertedToFrames() {
        VersionedArtifact scene = existing("Intro");

        VersionedArtifact changed = dispatcher.execute(new ToolSelection.ChangeDuration(scene.entityId(), 2.5),
                context(OrchestrationRequest.of(projectId, "make it 2.5 seconds")));

        assertThat(changed.payload().durationInFrames()).isEqualTo(75);
        assertThat(ChangeDurationCapability.frames(0.001)).isEqualTo(1);
    }

    @Test
    void deleteLeavesTombstoneAndShrinksLiveList() {
        VersionedArtifact first = existing("Intro");
        VersionedArtifact second = existing("Outro");

        VersionedArtifact deleted = dispatcher.execute(new ToolSelection.Delete(first.entityId()),
                context(OrchestrationRequest.of(projectId, "delete scene 1")));

        assertThat(deleted.isLive()).isFalse();
        assertThat(deleted.versionToken()).isEqualTo(2L);
        assertThat(stateSync.listLive(projectId)).extracting(VersionedArtifact::entityId).containsExactly(second.entityId());
    }
}

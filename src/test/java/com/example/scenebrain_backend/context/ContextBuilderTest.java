package com.example.scenebrain_backend.context;

import com.example.scenebrain_backend.api.Message;
import com.example.scenebrain_backend.api.OrchestrationRequest;
import com.example.scenebrain_backend.config.ContextProperties;
import com.example.scenebrain_backend.learning.ImageAnalysisService;
import com.example.scenebrain_backend.memory.ConversationStore;
import com.example.scenebrain_backend.memory.MemoryStoreUnavailableException;
import com.example.scenebrain_backend.memory.PreferenceScope;
import com.example.scenebrain_backend.memory.PreferenceService;
import com.example.scenebrain_backend.memory.PreferenceSource;
import com.example.scenebrain_backend.memory.PreferenceValue;
import com.example.scenebrain_backend.sync.InMemoryArtifactPersistence;
import com.example.scenebrain_backend.sync.ScenePayload;
import com.example.scenebrain_backend.sync.StateSyncService;
import com.example.scenebrain_backend.sync.VersionedArtifact;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ContextBuilderTest {

    @Mock
    private PreferenceService preferenceService;
    @Mock
    private ConversationStore conversationStore;
    @Mock
    private ImageAnalysisService imageAnalysis;

    private final UUID projectId = UUID.randomUUID();
    private InMemoryArtifactPersistence persistence;
    private StateSyncService stateSync;
    private ContextBuilder builder;

    @BeforeEach
    void setUp() {
        ContextProperties props = new ContextProperties();
        ProjectCacheRegistry caches = new ProjectCacheRegistry(props);
        persistence = new InMemoryArtifactPersistence();
        stateSync = new StateSyncService(persistence, List.of(caches));
        builder = new ContextBuilder(props, stateSync, preferenceService, conversationStore, imageAnalysis,
                new PatternAnalyzer(), caches, Runnable::run);
    }

    private VersionedArtifact scene(String name) {
        return stateSync.commit(UUID.randomUUID(), ScenePayload.create(projectId, name, "<h1 style={{color: '#112233'}}/>", 90, null));
    }

    private static PreferenceValue pref(String key, String value) {
        return new PreferenceValue(key, value, 0.9, PreferenceScope.PROJECT, PreferenceSource.EXPLICIT, Instant.EPOCH);
    }

    @Test
    void lightTierFetchesOnlyTheTarget() {
        VersionedArtifact target = scene("Intro");
        int listsBefore = persistence.lists.get();
        OrchestrationRequest request = OrchestrationRequest.of(projectId, "change the color to blue")
                .withTarget(target.entityId())
                .withHistory(List.of(Message.user("a"), Message.assistant("b"), Message.user("c")));

        ContextBundle bundle = builder.build(request, OperationClass.TRIVIAL);

        assertThat(bundle.tier()).isEqualTo(ContextTier.LIGHT);
        assertThat(bundle.targetEntity().entityId()).isEqualTo(target.entityId());
        assertThat(bundle.targetEntity().displayNumber()).isZero();
        assertThat(bundle.entityList()).isEmpty();
        assertThat(bundle.preferences()).isEmpty();
        assertThat(bundle.recentHistory()).extracting(Message::content).containsExactly("b", "c");
        assertThat(persistence.lists.get()).isEqualTo(listsBefore);
        verifyNoInteractions(preferenceService, conversationStore, imageAnalysis);
    }

    @Test
    void lightTierWithoutTargetTouchesNothing() {
        ContextBundle bundle = builder.build(OrchestrationRequest.of(projectId, "rename it"), OperationClass.TRIVIAL);

        assertThat(bundle.targetEntity()).isNull();
        assertThat(bundle.degraded()).isFalse();
        assertThat(persistence.finds.get()).isZero();
        verifyNoInteractions(preferenceService, conversationStore, imageAnalysis);
    }

    @Test
    void standardTierNumbersLiveScenesAndCachesTheList() {
        VersionedArtifact first = scene("Intro");
        VersionedArtifact second = scene("Features");
        VersionedArtifact third = scene("Outro");
        stateSync.commit(second.entityId(), second.payload().tombstone());
        when(preferenceService.resolve(projectId)).thenReturn(Map.of("style", pref("style", "minimal")));
        OrchestrationRequest request = OrchestrationRequest.of(projectId, "make it pop").withTarget(third.entityId());

        ContextBundle bundle = builder.build(request, OperationClass.MODERATE);
        builder.build(request, OperationClass.MODERATE);

        assertThat(bundle.entityList()).extracting(EntitySummary::entityId, EntitySummary::displayNumber)
                .containsExactly(
                        tuple(first.entityId(), 1),
                        tuple(third.entityId(), 2));
        assertThat(bundle.targetEntity().displayNumber()).isEqualTo(2);
        assertThat(bundle.preferences()).containsKey("style");
        assertThat(persistence.lists.get()).isEqualTo(1);
        verify(preferenceService, times(1)).resolve(projectId);
        verify(conversationStore, never()).recent(any(), anyInt());
    }

    @Test
    void commitInvalidatesCachedEntityList() {
        scene("Intro");
        when(preferenceService.resolve(projectId)).thenReturn(Map.of());
        OrchestrationRequest request = OrchestrationRequest.of(projectId, "make it pop");
        assertThat(builder.build(request, OperationClass.MODERATE).entityList()).hasSize(1);

        VersionedArtifact added = scene("Pricing");
        ContextBundle after = builder.build(request, OperationClass.MODERATE);

        assertThat(after.entityList()).extracting(EntitySummary::entityId).endsWith(added.entityId());
        assertThat(after.entityList()).hasSize(2);
        assertThat(persistence.lists.get()).isEqualTo(2);
    }

    @Test
    void fullTierUsesStoredHistoryAndPatterns() {
        scene("Intro");
        scene("Outro");
        when(preferenceService.resolve(projectId)).thenReturn(Map.of());
        when(conversationStore.recent(projectId, 50)).thenReturn(List.of(Message.user("stored turn")));
        when(imageAnalysis.storedAll(projectId)).thenReturn(List.of());

        ContextBundle bundle = builder.build(OrchestrationRequest.of(projectId, "create a new scene"), OperationClass.COMPLEX);

        assertThat(bundle.tier()).isEqualTo(ContextTier.FULL);
        assertThat(bundle.recentHistory()).extracting(Message::content).containsExactly("stored turn");
        assertThat(bundle.patterns().recurringColors()).contains("#112233");
    }

    @Test
    void unreachableStoreFailsTheBuild() {
        when(preferenceService.resolve(projectId))
                .thenThrow(new MemoryStoreUnavailableException("down", new IllegalStateException("down")));

        assertThatThrownBy(() -> builder.build(OrchestrationRequest.of(projectId, "make it pop"), OperationClass.MODERATE))
                .isInstanceOf(ContextUnavailableException.class)
                .hasCauseInstanceOf(MemoryStoreUnavailableException.class);
    }

    @Test
    void otherFailuresDegradeTheBundle() {
        when(preferenceService.resolve(projectId)).thenThrow(new IllegalStateException("bad row"));
        OrchestrationRequest request = OrchestrationRequest.of(projectId, "make it pop")
                .withHistory(List.of(Message.user("earlier")));

        ContextBundle bundle = builder.build(request, OperationClass.MODERATE);

        assertThat(bundle.degraded()).isTrue();
        assertThat(bundle.entityList()).isEmpty();
        assertThat(bundle.recentHistory()).extracting(Message::content).containsExactly("earlier");
    }
}

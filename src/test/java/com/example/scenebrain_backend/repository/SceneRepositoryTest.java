package com.example.scenebrain_backend.repository;

import com.example.scenebrain_backend.model.Scene;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class SceneRepositoryTest {

    @Autowired
    private SceneRepository sceneRepository;

    private Scene scene(UUID projectId, long order) {
        Scene scene = new Scene(UUID.randomUUID(), projectId, order);
        scene.setName("Scene " + order);
        scene.setCode("<div/>");
        scene.setDurationInFrames(90);
        scene.setVersionToken(1L);
        scene.setUpdatedAt(Instant.now());
        return sceneRepository.saveAndFlush(scene);
    }

    @Test
    void conditionalUpdateOnlyAppliesToExpectedToken() {
        Scene saved = scene(UUID.randomUUID(), 1);

        int applied = sceneRepository.updateIfToken(saved.getId(), 1L, 2L, "Renamed", "<div/>", 120, null, null,
                "{}", false, Instant.now());
        int stale = sceneRepository.updateIfToken(saved.getId(), 1L, 2L, "Lost", "<div/>", 60, null, null,
                "{}", false, Instant.now());

        assertThat(applied).isEqualTo(1);
        assertThat(stale).isZero();
        Scene reloaded = sceneRepository.findById(saved.getId()).orElseThrow();
        assertThat(reloaded.getVersionToken()).isEqualTo(2L);
        assertThat(reloaded.getName()).isEqualTo("Renamed");
        assertThat(reloaded.getDurationInFrames()).isEqualTo(120);
    }

    @Test
    void introductionOrderIsPerProject() {
        UUID projectId = UUID.randomUUID();
        scene(projectId, 2);
        scene(projectId, 1);
        scene(UUID.randomUUID(), 7);

        assertThat(sceneRepository.maxIntroducedOrder(projectId)).isEqualTo(2L);
        assertThat(sceneRepository.maxIntroducedOrder(UUID.randomUUID())).isZero();
        assertThat(sceneRepository.findByProjectIdOrderByIntroducedOrderAsc(projectId))
                .extracting(Scene::getIntroducedOrder).containsExactly(1L, 2L);
    }
}

package com.example.scenebrain_backend.memory;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DataJpaTest
@Import(JpaMemoryStore.class)
class JpaMemoryStoreTest {

    @TestConfiguration
    static class FixedClock {
        @Bean
        Clock clock() {
            return Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);
        }
    }

    @Autowired
    private JpaMemoryStore store;

    private final UUID projectId = UUID.randomUUID();

    @Test
    void putUpsertsByProjectAndKey() {
        store.put(projectId, "preference:style:minimal", "minimal", 0.6, PreferenceScope.PROJECT, PreferenceSource.INFERRED);
        MemoryEntry updated = store.put(projectId, "preference:style:minimal", "minimal", 0.8, null, null);

        assertThat(updated.confidence()).isEqualTo(0.8);
        assertThat(updated.scope()).isEqualTo(PreferenceScope.PROJECT);
        assertThat(updated.source()).isEqualTo(PreferenceSource.INFERRED);
        assertThat(updated.type()).isEqualTo(MemoryType.PREFERENCE);
        assertThat(updated.updatedAt()).isEqualTo(Instant.parse("2026-01-01T00:00:00Z"));
        assertThat(store.list(projectId, "preference:")).hasSize(1);
    }

    @Test
    void confidenceIsClampedIntoUnitRange() {
        assertThat(store.put(projectId, "preference:tone:calm", "calm", 1.7).confidence()).isEqualTo(1.0);
        assertThat(store.put(projectId, "preference:tone:calm", "calm", -0.3).confidence()).isEqualTo(0.0);
    }

    @Test
    void listFiltersByPrefixAndProject() {
        store.put(projectId, "image:a", "{}", null);
        store.put(projectId, "image:b", "{}", null);
        store.put(projectId, "brand:profile", "{}", null);
        store.put(UUID.randomUUID(), "image:c", "{}", null);

        assertThat(store.list(projectId, "image:")).extracting(MemoryEntry::key).containsExactly("image:a", "image:b");
        assertThat(store.list(projectId, null)).hasSize(3);
        assertThat(store.get(projectId, "brand:profile")).get()
                .extracting(MemoryEntry::type).isEqualTo(MemoryType.BRAND_PROFILE);
        assertThat(store.get(projectId, "image:c")).isEmpty();
    }

    @Test
    void blankKeyIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> store.put(projectId, " ", "x", null));
    }
}

package com.example.scenebrain_backend.orchestrator;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class ProgressStreamTest {

    private final UUID runId = UUID.randomUUID();

    @Test
    void exactlyOneTerminalEventIsDelivered() {
        List<ProgressEvent> seen = new ArrayList<>();
        ProgressStream stream = new ProgressStream(runId, Clock.systemUTC(), seen::add, 16);

        assertThat(stream.emit(ProgressEventType.STARTED, "Run started")).isTrue();
        assertThat(stream.emit(ProgressEventType.DONE, "Done")).isTrue();
        assertThat(stream.emit(ProgressEventType.FAILED, "late", Map.of("reason", "INTERNAL_ERROR"))).isFalse();
        assertThat(stream.emit(ProgressEventType.STEP_COMPLETED, "late")).isFalse();

        assertThat(seen).extracting(ProgressEvent::type).containsExactly(ProgressEventType.STARTED, ProgressEventType.DONE);
        assertThat(stream.isFinished()).isTrue();
        assertThat(stream.terminalEvent().type()).isEqualTo(ProgressEventType.DONE);
    }

    @Test
    void sequencesAreOrderedAndPollable() {
        ProgressStream stream = new ProgressStream(runId, Clock.systemUTC(), null, 16);
        stream.emit(ProgressEventType.STARTED, "a");
        stream.emit(ProgressEventType.CONTEXT_READY, "b");
        stream.emit(ProgressEventType.TOOL_SELECTED, "c");

        assertThat(stream.snapshot()).extracting(ProgressEvent::sequence).containsExactly(1L, 2L, 3L);
        assertThat(stream.since(1)).extracting(ProgressEvent::type)
                .containsExactly(ProgressEventType.CONTEXT_READY, ProgressEventType.TOOL_SELECTED);
        assertThat(stream.isFinished()).isFalse();
    }

    @Test
    void lateSubscriberGetsReplayAndCompletion() {
        ProgressStream stream = new ProgressStream(runId, Clock.systemUTC(), null, 16);
        stream.emit(ProgressEventType.STARTED, "a");
        stream.emit(ProgressEventType.FAILED, "boom", Map.of("reason", "BUSY"));

        List<ProgressEvent> replayed = stream.flux().collectList().block(Duration.ofSeconds(2));

        assertThat(replayed).extracting(ProgressEvent::type)
                .containsExactly(ProgressEventType.STARTED, ProgressEventType.FAILED);
        assertThat(replayed.get(1).data()).containsEntry("reason", "BUSY");
    }

    @Test
    void failingListenerDoesNotBreakTheStream() {
        ProgressStream stream = new ProgressStream(runId, Clock.systemUTC(), e -> {
            throw new IllegalStateException("listener down");
        }, 16);

        assertThat(stream.emit(ProgressEventType.STARTED, "a")).isTrue();
        assertThat(stream.emit(ProgressEventType.DONE, "b")).isTrue();
        assertThat(stream.snapshot()).hasSize(2);
    }

    @Test
    void registryFindsOpenedStreams() {
        ProgressStreamRegistry registry = new ProgressStreamRegistry(Clock.systemUTC(), 8, Duration.ofMinutes(1));

        ProgressStream opened = registry.open(runId, ProgressListener.NOOP);

        assertThat(registry.find(runId)).containsSame(opened);
        assertThat(registry.find(UUID.randomUUID())).isEmpty();
    }
}

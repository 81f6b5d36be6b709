package com.example.scenebrain_backend.orchestrator;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Keeps the progress streams of recent runs so clients can attach or poll after starting a run.
 */
@Component
public class ProgressStreamRegistry {

    private final Clock clock;
    private final int replayCapacity;
    private final Cache<UUID, ProgressStream> streams;

    public ProgressStreamRegistry(Clock clock,
                                  @Value("${brain.progress.replay-capacity:256}") int replayCapacity,
                                  @Value("${brain.progress.retention:PT15M}") Duration retention) {
        this.clock = clock;
        this.replayCapacity = replayCapacity;
        this.streams = Caffeine.newBuilder()
                .expireAfterAccess(retention)
                .maximumSize(10_000)
                .build();
    }

    public ProgressStream open(UUID runId, ProgressListener listener) {
        ProgressStream stream = new ProgressStream(runId, clock, listener, replayCapacity);
        streams.put(runId, stream);
        return stream;
    }

    public Optional<ProgressStream> find(UUID runId) {
        return Optional.ofNullable(streams.getIfPresent(runId));
    }
}

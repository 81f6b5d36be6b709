package com.example.scenebrain_backend.learning;

import com.example.scenebrain_backend.config.LearnerProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded record of background learning failures. Oldest entries are dropped first.
 */
@Component
public class LearningErrorChannel {

    public record LearningFailure(UUID projectId, String stage, String error, String message, Instant occurredAt) {
    }

    private final Deque<LearningFailure> recent = new ArrayDeque<>();
    private final AtomicLong total = new AtomicLong();
    private final int capacity;
    private final Clock clock;

    public LearningErrorChannel(LearnerProperties props, Clock clock) {
        this.capacity = Math.max(1, props.getErrorChannelCapacity());
        this.clock = clock;
    }

    public void publish(UUID projectId, String stage, Throwable error) {
        LearningFailure failure = new LearningFailure(projectId, stage, error.getClass().getSimpleName(),
                error.getMessage(), Instant.now(clock));
        total.incrementAndGet();
        synchronized (recent) {
            if (recent.size() >= capacity) {
                recent.removeFirst();
            }
            recent.addLast(failure);
        }
    }

    public List<LearningFailure> recent() {
        synchronized (recent) {
            return List.copyOf(new ArrayList<>(recent));
        }
    }

    public long totalFailures() {
        return total.get();
    }
}

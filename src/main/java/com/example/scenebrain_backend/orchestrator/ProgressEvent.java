package com.example.scenebrain_backend.orchestrator;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One progress notification of an orchestration run.
 *
 * @param sequence 1-based position within the run.
 * @param data     event-specific fields, never {@code null}.
 */
public record ProgressEvent(UUID runId,
                            long sequence,
                            ProgressEventType type,
                            String message,
                            Map<String, Object> data,
                            Instant at) {

    public ProgressEvent {
        data = data == null ? Map.of() : Map.copyOf(data);
    }

    public boolean isTerminal() {
        return type.isTerminal();
    }
}

package com.example.scenebrain_backend.orchestrator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Ordered progress events of one run. Exactly one terminal event is delivered: the first terminal
 * emission wins and everything after it is dropped. Late subscribers get the buffered events
 * replayed.
 */
public class ProgressStream {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProgressStream.class);

    private final UUID runId;
    private final Clock clock;
    private final ProgressListener listener;
    private final Sinks.Many<ProgressEvent> sink;
    private final List<ProgressEvent> history = new ArrayList<>();
    private long sequence;
    private ProgressEvent terminal;

    public ProgressStream(UUID runId, Clock clock, ProgressListener listener, int replayCapacity) {
        this.runId = runId;
        this.clock = clock;
        this.listener = listener == null ? ProgressListener.NOOP : listener;
        this.sink = Sinks.many().replay().limit(replayCapacity);
    }

    public UUID runId() {
        return runId;
    }

    /**
     * Emits an event unless the run already ended.
     *
     * @return {@code true} when the event was delivered.
     */
    public boolean emit(ProgressEventType type, String message, Map<String, Object> data) {
        ProgressEvent event;
        synchronized (this) {
            if (terminal != null) {
                LOGGER.debug("dropping {} after terminal {} runId={}", type, terminal.type(), runId);
                return false;
            }
            event = new ProgressEvent(runId, ++sequence, type, message, data, clock.instant());
            history.add(event);
            if (type.isTerminal()) {
                terminal = event;
            }
            Sinks.EmitResult result = sink.tryEmitNext(event);
            if (result.isFailure()) {
                LOGGER.warn("progress sink rejected event runId={} type={} result={}", runId, type, result);
            }
            if (type.isTerminal()) {
                sink.tryEmitComplete();
            }
        }
        try {
            listener.onEvent(event);
        } catch (RuntimeException e) {
            LOGGER.warn("progress listener failed runId={} type={}", runId, type, e);
        }
        return true;
    }

    public boolean emit(ProgressEventType type, String message) {
        return emit(type, message, Map.of());
    }

    public synchronized boolean isFinished() {
        return terminal != null;
    }

    public synchronized ProgressEvent terminalEvent() {
        return terminal;
    }

    /**
     * Events emitted so far, for polling clients.
     */
    public synchronized List<ProgressEvent> snapshot() {
        return List.copyOf(history);
    }

    /**
     * Events from {@code afterSequence + 1} on.
     */
    public synchronized List<ProgressEvent> since(long afterSequence) {
        return history.stream().filter(e -> e.sequence() > afterSequence).toList();
    }

    public Flux<ProgressEvent> flux() {
        return sink.asFlux();
    }
}

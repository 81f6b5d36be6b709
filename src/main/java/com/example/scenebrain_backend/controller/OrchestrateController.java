package com.example.scenebrain_backend.controller;

import com.example.scenebrain_backend.dto.OrchestrateRequest;
import com.example.scenebrain_backend.dto.OrchestrateResponse;
import com.example.scenebrain_backend.dto.RunProgressResponse;
import com.example.scenebrain_backend.orchestrator.OrchestrationResult;
import com.example.scenebrain_backend.orchestrator.OrchestrationService;
import com.example.scenebrain_backend.orchestrator.ProgressEvent;
import com.example.scenebrain_backend.orchestrator.ProgressStream;
import com.example.scenebrain_backend.orchestrator.ProgressStreamRegistry;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;

import java.util.Locale;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/v1")
public class OrchestrateController {
    private static final Logger LOGGER = LoggerFactory.getLogger(OrchestrateController.class);

    private final OrchestrationService orchestrationService;
    private final ProgressStreamRegistry streams;

    public OrchestrateController(OrchestrationService orchestrationService, ProgressStreamRegistry streams) {
        this.orchestrationService = orchestrationService;
        this.streams = streams;
    }

    @PostMapping("/projects/{projectId}/orchestrate")
    public OrchestrateResponse orchestrate(@PathVariable UUID projectId, @Valid @RequestBody OrchestrateRequest request) {
        OrchestrationResult result = orchestrationService.orchestrate(request.toDomain(projectId));
        return OrchestrateResponse.from(result);
    }

    @PostMapping("/projects/{projectId}/runs")
    public ResponseEntity<Map<String, Object>> start(@PathVariable UUID projectId, @Valid @RequestBody OrchestrateRequest request) {
        UUID runId = orchestrationService.start(request.toDomain(projectId));
        LOGGER.info("run accepted projectId={} runId={}", projectId, runId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of(
                "runId", runId,
                "events", "/v1/runs/" + runId + "/events",
                "poll", "/v1/runs/" + runId));
    }

    @GetMapping(value = "/runs/{runId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<ProgressEvent>> events(@PathVariable UUID runId) {
        return stream(runId).flux().map(OrchestrateController::sse);
    }

    @GetMapping("/runs/{runId}")
    public RunProgressResponse poll(@PathVariable UUID runId, @RequestParam(defaultValue = "0") long after) {
        ProgressStream stream = stream(runId);
        return new RunProgressResponse(runId, stream.isFinished(), stream.since(after));
    }

    private ProgressStream stream(UUID runId) {
        return streams.find(runId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "RUN_NOT_FOUND"));
    }

    private static ServerSentEvent<ProgressEvent> sse(ProgressEvent event) {
        return ServerSentEvent.<ProgressEvent>builder(event)
                .id(Long.toString(event.sequence()))
                .event(event.type().name().toLowerCase(Locale.ROOT))
                .build();
    }
}

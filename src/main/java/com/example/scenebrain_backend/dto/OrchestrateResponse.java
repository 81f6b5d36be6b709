package com.example.scenebrain_backend.dto;

import com.example.scenebrain_backend.orchestrator.OrchestrationResult;
import com.example.scenebrain_backend.orchestrator.RunStatus;

import java.util.List;
import java.util.UUID;

public record OrchestrateResponse(UUID runId,
                                  RunStatus status,
                                  String operationClass,
                                  List<String> tools,
                                  List<SceneResponse> scenes,
                                  String reasoning,
                                  String clarificationQuestion,
                                  String errorCode,
                                  String errorMessage,
                                  boolean degradedContext) {

    public static OrchestrateResponse from(OrchestrationResult result) {
        return new OrchestrateResponse(result.runId(), result.status(),
                result.operationClass() == null ? null : result.operationClass().name(),
                result.tools(),
                result.artifacts().stream().map(a -> SceneResponse.from(a, null)).toList(),
                result.reasoning(), result.clarificationQuestion(), result.errorCode(), result.errorMessage(),
                result.degradedContext());
    }
}

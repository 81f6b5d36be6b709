package com.example.scenebrain_backend.orchestrator;

import com.example.scenebrain_backend.context.OperationClass;
import com.example.scenebrain_backend.sync.VersionedArtifact;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of one run. On failure {@code artifacts} still lists the steps committed before the
 * failing one.
 */
public record OrchestrationResult(UUID runId,
                                  RunStatus status,
                                  OperationClass operationClass,
                                  List<String> tools,
                                  List<VersionedArtifact> artifacts,
                                  String reasoning,
                                  String clarificationQuestion,
                                  String errorCode,
                                  String errorMessage,
                                  boolean degradedContext) {

    public OrchestrationResult {
        tools = tools == null ? List.of() : List.copyOf(tools);
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
    }

    public boolean succeeded() {
        return status == RunStatus.SUCCEEDED;
    }
}

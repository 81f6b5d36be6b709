package com.example.scenebrain_backend.orchestrator;

public enum RunStatus {
    RUNNING,
    SUCCEEDED,
    CLARIFICATION_NEEDED,
    FAILED
}

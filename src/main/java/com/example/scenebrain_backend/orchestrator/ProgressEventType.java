package com.example.scenebrain_backend.orchestrator;

/**
 * Progress event kinds. {@link #DONE} and {@link #FAILED} are terminal; a clarification request is
 * a failure whose reason is {@code AMBIGUOUS_INTENT}.
 */
public enum ProgressEventType {
    STARTED(false),
    CONTEXT_READY(false),
    TOOL_SELECTED(false),
    ARTIFACT_COMMITTED(false),
    STEP_COMPLETED(false),
    DONE(true),
    FAILED(true);

    private final boolean terminal;

    ProgressEventType(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }
}

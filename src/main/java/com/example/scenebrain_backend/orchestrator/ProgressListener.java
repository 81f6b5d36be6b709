package com.example.scenebrain_backend.orchestrator;

@FunctionalInterface
public interface ProgressListener {

    ProgressListener NOOP = event -> {
    };

    void onEvent(ProgressEvent event);
}

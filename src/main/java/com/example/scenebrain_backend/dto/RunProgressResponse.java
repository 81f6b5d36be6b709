package com.example.scenebrain_backend.dto;

import com.example.scenebrain_backend.orchestrator.ProgressEvent;

import java.util.List;
import java.util.UUID;

public record RunProgressResponse(UUID runId, boolean finished, List<ProgressEvent> events) {
}

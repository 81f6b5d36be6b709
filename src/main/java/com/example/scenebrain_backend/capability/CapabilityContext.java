package com.example.scenebrain_backend.capability;

import com.example.scenebrain_backend.api.OrchestrationRequest;
import com.example.scenebrain_backend.context.ContextBundle;

import java.util.UUID;

/**
 * @param runId run the step belongs to; it owns the entity leases the step takes.
 */
public record CapabilityContext(OrchestrationRequest request, ContextBundle bundle, UUID runId) {

    public CapabilityContext(OrchestrationRequest request, ContextBundle bundle) {
        this(request, bundle, UUID.randomUUID());
    }

    public String owner() {
        return runId.toString();
    }
}

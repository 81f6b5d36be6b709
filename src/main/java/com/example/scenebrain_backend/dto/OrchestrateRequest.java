package com.example.scenebrain_backend.dto;

import com.example.scenebrain_backend.api.OrchestrationRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.UUID;

public record OrchestrateRequest(String userId,
                                 @NotBlank @Size(max = 10_000) String prompt,
                                 UUID targetEntityId,
                                 @Valid List<MessageDto> history,
                                 @Valid List<ImageRefDto> images,
                                 @Valid BrandProfileDto brandProfile) {

    public OrchestrationRequest toDomain(UUID projectId) {
        return new OrchestrationRequest(projectId, userId, prompt, targetEntityId,
                history == null ? List.of() : history.stream().map(MessageDto::toDomain).toList(),
                images == null ? List.of() : images.stream().map(ImageRefDto::toDomain).toList(),
                brandProfile == null ? null : brandProfile.toDomain());
    }
}

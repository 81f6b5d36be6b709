package com.example.scenebrain_backend.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.Map;
import java.util.UUID;

/**
 * Manual write from the editor. {@code projectId} is only used when the scene does not exist yet.
 */
public record SceneWriteRequest(@NotNull UUID projectId,
                                @NotBlank String name,
                                @NotBlank String code,
                                @Min(1) int durationInFrames,
                                Integer timelinePosition,
                                String templateId,
                                Map<String, String> attributes) {
}

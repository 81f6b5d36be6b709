package com.example.scenebrain_backend.dto;

import com.example.scenebrain_backend.selector.AvailableContent;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

public record TemplateScoreRequest(@NotNull @Valid BrandProfileDto profile,
                                   boolean hasLogo,
                                   boolean hasSocialProof,
                                   boolean hasScreenshots,
                                   @Min(0) int featureCount) {

    public AvailableContent content() {
        return new AvailableContent(hasLogo, hasSocialProof, hasScreenshots, featureCount);
    }
}

package com.example.scenebrain_backend.dto;

import com.example.scenebrain_backend.api.ImageRef;
import jakarta.validation.constraints.NotBlank;

public record ImageRefDto(@NotBlank String id, String url) {

    public ImageRef toDomain() {
        return new ImageRef(id, url);
    }
}

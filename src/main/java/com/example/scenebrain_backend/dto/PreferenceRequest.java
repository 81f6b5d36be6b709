package com.example.scenebrain_backend.dto;

import com.example.scenebrain_backend.memory.PreferenceScope;
import jakarta.validation.constraints.NotBlank;

public record PreferenceRequest(@NotBlank String key, @NotBlank String value, PreferenceScope scope) {
}

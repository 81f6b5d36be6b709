package com.example.scenebrain_backend.dto;

import com.example.scenebrain_backend.selector.BrandProfile;
import com.example.scenebrain_backend.selector.ProfileVector;
import jakarta.validation.constraints.Size;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * @param personality corporate, minimalist, playful, technical, bold, modern; each in [0,1].
 */
public record BrandProfileDto(@Size(min = ProfileVector.DIMENSIONS, max = ProfileVector.DIMENSIONS) List<Double> personality,
                              List<String> keywords) {

    public BrandProfile toDomain() {
        ProfileVector vector = personality == null ? ProfileVector.neutral() : ProfileVector.of(personality);
        return new BrandProfile(vector, keywords == null ? null : new LinkedHashSet<>(keywords));
    }
}

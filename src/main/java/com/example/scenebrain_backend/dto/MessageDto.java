package com.example.scenebrain_backend.dto;

import com.example.scenebrain_backend.api.Message;
import com.example.scenebrain_backend.api.MessageRole;
import jakarta.validation.Valid;

import java.util.List;
import java.util.Locale;

public record MessageDto(String role, String content, @Valid List<ImageRefDto> images) {

    public Message toDomain() {
        MessageRole messageRole = role != null && role.toLowerCase(Locale.ROOT).startsWith("assistant")
                ? MessageRole.ASSISTANT
                : MessageRole.USER;
        List<ImageRefDto> refs = images == null ? List.of() : images;
        return new Message(messageRole, content, refs.stream().map(ImageRefDto::toDomain).toList(), null);
    }
}

package com.example.scenebrain_backend.llm;

import java.util.List;

/**
 * One message sent to the language model.
 *
 * @param role      message role.
 * @param content   text content.
 * @param imageUrls images attached to a user message, empty otherwise.
 */
public record LlmMessage(LlmRole role, String content, List<String> imageUrls) {

    public LlmMessage {
        content = content == null ? "" : content;
        imageUrls = imageUrls == null ? List.of() : List.copyOf(imageUrls);
    }

    public static LlmMessage system(String content) {
        return new LlmMessage(LlmRole.SYSTEM, content, List.of());
    }

    public static LlmMessage user(String content) {
        return new LlmMessage(LlmRole.USER, content, List.of());
    }

    public static LlmMessage userWithImages(String content, List<String> imageUrls) {
        return new LlmMessage(LlmRole.USER, content, imageUrls);
    }
}

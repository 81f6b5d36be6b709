package com.example.scenebrain_backend.api;

import java.time.Instant;
import java.util.List;

/**
 * One conversation turn.
 *
 * @param role      who wrote it.
 * @param content   message text.
 * @param imageRefs images attached to the turn, in attachment order.
 * @param createdAt when the turn was written, may be {@code null} for caller-supplied history.
 */
public record Message(MessageRole role, String content, List<ImageRef> imageRefs, Instant createdAt) {

    public Message {
        content = content == null ? "" : content;
        imageRefs = imageRefs == null ? List.of() : List.copyOf(imageRefs);
    }

    public static Message user(String content) {
        return new Message(MessageRole.USER, content, List.of(), null);
    }

    public static Message assistant(String content) {
        return new Message(MessageRole.ASSISTANT, content, List.of(), null);
    }

    public boolean isUser() {
        return role == MessageRole.USER;
    }
}

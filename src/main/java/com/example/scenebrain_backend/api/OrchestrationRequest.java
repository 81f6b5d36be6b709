package com.example.scenebrain_backend.api;

import com.example.scenebrain_backend.selector.BrandProfile;

import java.util.List;
import java.util.UUID;

/**
 * Immutable input of one orchestration call.
 *
 * @param projectId           project the request operates on.
 * @param userId              requesting user.
 * @param prompt              natural-language instruction.
 * @param targetEntityId      entity explicitly selected in the UI, may be {@code null}.
 * @param conversationHistory prior turns, oldest first, excluding {@code prompt}.
 * @param attachedImageRefs   images attached to this request.
 * @param brandProfile        brand profile for template selection, may be {@code null}.
 */
public record OrchestrationRequest(UUID projectId,
                                   String userId,
                                   String prompt,
                                   UUID targetEntityId,
                                   List<Message> conversationHistory,
                                   List<ImageRef> attachedImageRefs,
                                   BrandProfile brandProfile) {

    public OrchestrationRequest {
        prompt = prompt == null ? "" : prompt;
        conversationHistory = conversationHistory == null ? List.of() : List.copyOf(conversationHistory);
        attachedImageRefs = attachedImageRefs == null ? List.of() : List.copyOf(attachedImageRefs);
    }

    public static OrchestrationRequest of(UUID projectId, String prompt) {
        return new OrchestrationRequest(projectId, null, prompt, null, List.of(), List.of(), null);
    }

    public OrchestrationRequest withTarget(UUID entityId) {
        return new OrchestrationRequest(projectId, userId, prompt, entityId, conversationHistory, attachedImageRefs, brandProfile);
    }

    public OrchestrationRequest withHistory(List<Message> history) {
        return new OrchestrationRequest(projectId, userId, prompt, targetEntityId, history, attachedImageRefs, brandProfile);
    }

    public long priorUserTurns() {
        return conversationHistory.stream().filter(Message::isUser).count();
    }
}

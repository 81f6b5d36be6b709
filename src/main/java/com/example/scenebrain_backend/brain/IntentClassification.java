package com.example.scenebrain_backend.brain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Model output of the intent classification call.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IntentClassification(List<Step> steps, String clarificationQuestion, String reasoning) {

    public IntentClassification {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public boolean needsClarification() {
        return clarificationQuestion != null && !clarificationQuestion.isBlank();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Step(String action,
                       String targetEntityId,
                       String reference,
                       String complexity,
                       String attribute,
                       String value,
                       Double durationSeconds,
                       String instruction,
                       String imageRefId) {
    }
}

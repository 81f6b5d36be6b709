package com.example.scenebrain_backend.brain;

import com.example.scenebrain_backend.api.BrainException;

/**
 * The request cannot be routed without asking the user. The message is the clarification question.
 */
public class AmbiguousIntentException extends BrainException {

    public AmbiguousIntentException(String question) {
        super("AMBIGUOUS_INTENT", question);
    }

    public String getQuestion() {
        return getMessage();
    }
}

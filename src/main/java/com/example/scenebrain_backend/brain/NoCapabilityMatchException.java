package com.example.scenebrain_backend.brain;

import com.example.scenebrain_backend.api.BrainException;

public class NoCapabilityMatchException extends BrainException {

    public NoCapabilityMatchException(String message) {
        super("NO_CAPABILITY_MATCH", message);
    }

    public NoCapabilityMatchException(String message, Throwable cause) {
        super("NO_CAPABILITY_MATCH", message, cause);
    }
}

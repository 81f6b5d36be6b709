package com.example.scenebrain_backend.context;

import com.example.scenebrain_backend.api.BrainException;

/**
 * The memory store could not be reached while assembling context.
 */
public class ContextUnavailableException extends BrainException {

    public ContextUnavailableException(String message, Throwable cause) {
        super("CONTEXT_UNAVAILABLE", message, cause);
    }
}

package com.example.scenebrain_backend.llm;

import com.example.scenebrain_backend.api.BrainException;

/**
 * A language-model call failed, timed out or kept returning output that does not validate against
 * the requested schema.
 */
public class InvocationException extends BrainException {

    private final boolean timeout;

    public InvocationException(String message) {
        this(message, false, null);
    }

    public InvocationException(String message, boolean timeout, Throwable cause) {
        super("INVOCATION_ERROR", message, cause);
        this.timeout = timeout;
    }

    public static InvocationException timeout(String message, Throwable cause) {
        return new InvocationException(message, true, cause);
    }

    public boolean isTimeout() {
        return timeout;
    }
}

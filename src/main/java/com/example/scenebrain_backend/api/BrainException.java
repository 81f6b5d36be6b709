package com.example.scenebrain_backend.api;

/**
 * Base type of the orchestration error taxonomy. Each subtype carries a stable machine code that is
 * returned to clients and written to the audit record.
 */
public abstract class BrainException extends RuntimeException {

    private final String code;

    protected BrainException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected BrainException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}

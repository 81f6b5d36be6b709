package com.example.scenebrain_backend.memory;

import com.example.scenebrain_backend.api.BrainException;

/**
 * The backing store cannot be reached. Distinct from a missing key, which is an empty result.
 */
public class MemoryStoreUnavailableException extends BrainException {

    public MemoryStoreUnavailableException(String message, Throwable cause) {
        super("MEMORY_STORE_UNAVAILABLE", message, cause);
    }
}

package com.example.scenebrain_backend.context;

/**
 * Cost class of a requested operation; decides which context sub-fetches run.
 */
public enum OperationClass {
    TRIVIAL(ContextTier.LIGHT),
    MODERATE(ContextTier.STANDARD),
    COMPLEX(ContextTier.FULL),
    ANALYTICAL(ContextTier.FULL);

    private final ContextTier tier;

    OperationClass(ContextTier tier) {
        this.tier = tier;
    }

    public ContextTier tier() {
        return tier;
    }
}

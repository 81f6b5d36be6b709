package com.example.scenebrain_backend.sync;

/**
 * Notified synchronously after a commit is durable and before {@code commit} returns.
 */
public interface CommitListener {
    void onCommit(VersionedArtifact artifact);
}

package com.projectledger.bus;

import java.util.UUID;

/**
 * Raised when an append's expected version no longer matches the stream.
 * The caller should reload state and retry.
 */
public class ConcurrencyException extends RuntimeException {

    private final UUID projectId;
    private final long expectedVersion;

    public ConcurrencyException(UUID projectId, long expectedVersion, long actualVersion) {
        super("Concurrent modification of project " + projectId
            + ": expected version " + expectedVersion + " but found " + actualVersion);
        this.projectId = projectId;
        this.expectedVersion = expectedVersion;
    }

    public ConcurrencyException(UUID projectId, long expectedVersion, Throwable cause) {
        super("Concurrent modification of project " + projectId + " at version " + expectedVersion, cause);
        this.projectId = projectId;
        this.expectedVersion = expectedVersion;
    }

    public UUID getProjectId() {
        return projectId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }
}

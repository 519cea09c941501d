package com.questrail.tso.store;

/**
 * A checkpoint compare-and-swap lost against a concurrent writer. Treated by
 * allocators as evidence that another process holds, or is acquiring, the
 * stream.
 */
public final class VersionConflictException extends RuntimeException
{
    private final String streamId;
    private final long expectedVersion;
    private final long actualVersion;

    public VersionConflictException(String streamId, long expectedVersion, long actualVersion) {
        super("Checkpoint version conflict on '" + streamId + "': expected "
                + expectedVersion + ", found " + actualVersion);
        this.streamId = streamId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String streamId() {
        return streamId;
    }

    public long expectedVersion() {
        return expectedVersion;
    }

    public long actualVersion() {
        return actualVersion;
    }
}

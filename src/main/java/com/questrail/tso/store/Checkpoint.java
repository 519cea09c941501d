package com.questrail.tso.store;

import java.util.Objects;

/**
 * Persisted watermark of one timestamp stream.
 *
 * <p>{@code savedPhysical} is strictly greater than every physical value ever
 * handed out for the stream. {@code version} is the optimistic-concurrency token
 * returned by the store for the write that produced this record.</p>
 */
public record Checkpoint(String streamId, long savedPhysical, long version)
{
    public Checkpoint {
        Objects.requireNonNull(streamId, "streamId");
        if (savedPhysical < 0) {
            throw new IllegalArgumentException("savedPhysical must be >= 0");
        }
        if (version < 1) {
            throw new IllegalArgumentException("version must be >= 1");
        }
    }
}

package com.questrail.tso.codec;

import com.questrail.tso.api.StreamKey;

import java.util.Objects;

/**
 * A {@code GetTimestamp} request as carried in one datagram.
 *
 * @param requestId client-chosen correlation id, echoed in the response
 * @param stream    stream to allocate from
 * @param count     number of timestamps requested
 */
public record TsoRequest(long requestId, StreamKey stream, int count)
{
    public TsoRequest {
        Objects.requireNonNull(stream, "stream");
        if (count < 1) {
            throw new IllegalArgumentException("count must be >= 1: " + count);
        }
    }
}

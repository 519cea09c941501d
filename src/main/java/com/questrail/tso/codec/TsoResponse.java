package com.questrail.tso.codec;

import com.questrail.tso.api.Timestamp;

import java.util.Objects;

/**
 * A {@code GetTimestamp} response as carried in one datagram.
 *
 * <p>For {@link TsoResponseStatus#OK} the fields {@code physical}, {@code logical}
 * and {@code count} describe the first timestamp of the reserved block and its
 * size. For any other status they are zero.</p>
 */
public record TsoResponse(long requestId, TsoResponseStatus status, long physical, long logical, int count)
{
    public TsoResponse {
        Objects.requireNonNull(status, "status");
        if (status != TsoResponseStatus.OK && (physical != 0 || logical != 0 || count != 0)) {
            throw new IllegalArgumentException("Error response must not carry a timestamp");
        }
    }

    public static TsoResponse ok(long requestId, Timestamp first, int count) {
        Objects.requireNonNull(first, "first");
        return new TsoResponse(requestId, TsoResponseStatus.OK, first.physical(), first.logical(), count);
    }

    public static TsoResponse error(long requestId, TsoResponseStatus status) {
        if (status == TsoResponseStatus.OK) {
            throw new IllegalArgumentException("status must not be OK");
        }
        return new TsoResponse(requestId, status, 0, 0, 0);
    }

    public boolean isOk() {
        return status == TsoResponseStatus.OK;
    }

    /**
     * First timestamp of the reserved block.
     *
     * @throws IllegalStateException if this is not an {@code OK} response
     */
    public Timestamp timestamp() {
        if (!isOk()) {
            throw new IllegalStateException("No timestamp in " + status + " response");
        }
        return new Timestamp(physical, logical);
    }
}

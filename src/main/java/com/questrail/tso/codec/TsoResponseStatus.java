package com.questrail.tso.codec;

import java.util.Optional;

/**
 * Outcome of a {@code GetTimestamp} request, as carried on the wire.
 */
public enum TsoResponseStatus
{
    OK(0),

    /** This process does not serve the stream; the client re-resolves the leader. */
    NOT_LEADER(1),

    /** Transient failure (store unavailable, clock anomaly); the client may retry. */
    UNAVAILABLE(2),

    /** Bad count or unknown stream; retrying will not help. */
    INVALID_REQUEST(3);

    private final int code;

    TsoResponseStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static Optional<TsoResponseStatus> fromCode(int code) {
        for (TsoResponseStatus status : values()) {
            if (status.code == code) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}

package com.questrail.tso.api;

/**
 * The allocator is not initialized under a live leadership term. Callers must
 * re-resolve the leader instead of retrying against the same process.
 */
public final class NotLeaderException extends TsoException
{
    public NotLeaderException(String message) {
        super(message);
    }

    public NotLeaderException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}

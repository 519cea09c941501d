package com.questrail.tso.api;

/**
 * Base type of all caller-visible allocation failures.
 */
public abstract class TsoException extends RuntimeException
{
    protected TsoException(String message) {
        super(message);
    }

    protected TsoException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether the caller may retry the same request, possibly against a
     * different process.
     */
    public abstract boolean isRetryable();
}

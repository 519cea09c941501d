package com.questrail.tso.api;

/**
 * The checkpoint store could not be reached. Transient.
 */
public final class StoreUnavailableException extends TsoException
{
    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}

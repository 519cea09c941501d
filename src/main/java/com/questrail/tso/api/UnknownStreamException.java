package com.questrail.tso.api;

/**
 * The requested stream is not served here (unknown region, or local allocation
 * disabled).
 */
public final class UnknownStreamException extends TsoException
{
    public UnknownStreamException(StreamKey stream) {
        super("Unknown stream: " + stream);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}

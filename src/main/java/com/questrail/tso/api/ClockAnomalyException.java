package com.questrail.tso.api;

/**
 * The wall clock moved backward beyond the tolerated gap, stalled long enough to
 * exhaust the logical space, or the watermark could not be persisted in time.
 * Fatal to the leadership term it was raised under.
 */
public final class ClockAnomalyException extends TsoException
{
    public static final long UNKNOWN_EPOCH = -1L;

    private final long epoch;

    public ClockAnomalyException(String message) {
        this(message, UNKNOWN_EPOCH);
    }

    public ClockAnomalyException(String message, long epoch) {
        super(message);
        this.epoch = epoch;
    }

    public ClockAnomalyException(String message, long epoch, Throwable cause) {
        super(message, cause);
        this.epoch = epoch;
    }

    /**
     * Leadership term the anomaly was detected under, or {@link #UNKNOWN_EPOCH}.
     */
    public long epoch() {
        return epoch;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}

package com.questrail.tso.api;

/**
 * TimestampOracle
 * -----------------------------------------------------------------------------
 * Caller-facing allocation surface, the operation exposed to clients as
 * {@code GetTimestamp}.
 *
 * <p>Callers observe either a valid timestamp or an explicit error. For any one
 * stream they never observe a timestamp smaller than one they previously
 * received.</p>
 */
public interface TimestampOracle
{
    /**
     * Reserves {@code count} consecutive timestamps on the given stream.
     *
     * @param stream stream to allocate from
     * @param count  number of timestamps, at least 1
     * @return the first timestamp of the reserved block
     * @throws NotLeaderException        this process does not serve the stream;
     *                                   re-resolve leadership and retry elsewhere
     * @throws StoreUnavailableException the checkpoint store is temporarily unavailable
     * @throws ClockAnomalyException     the clock could not be trusted; leadership was resigned
     * @throws UnknownStreamException    the stream is not served by this deployment
     */
    Timestamp getTimestamp(StreamKey stream, int count);

    /**
     * Returns {@code true} once the stream's allocator has completed initialization
     * under the current leadership term.
     */
    boolean isReady(StreamKey stream);
}

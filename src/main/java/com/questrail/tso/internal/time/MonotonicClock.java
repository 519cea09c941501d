package com.questrail.tso.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Elapsed-time source for bounded waits.
 *
 * <h2>Binding invariant</h2>
 * Every bound on a blocking wait (the clock catch-up wait, the forced-bump wait,
 * the checkpoint failure budget) is measured on this clock, never on the
 * {@link WallClock}: the wall clock is the very thing being waited on and may
 * jump.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds. Values are
     * only meaningful for elapsed time computations.
     */
    long nowNanos();
}

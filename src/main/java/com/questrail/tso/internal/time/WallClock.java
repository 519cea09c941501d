package com.questrail.tso.internal.time;

/**
 * WallClock
 * =============================================================================
 * Source of the physical component of issued timestamps.
 *
 * <p>This clock may stall or jump backward (NTP step, manual setting, VM
 * migration). Allocators never trust it to be monotonic: they only adopt a
 * reading that is ahead of their cursor, and they measure waits on the
 * {@link MonotonicClock}.</p>
 */
public interface WallClock
{
    /**
     * Returns the current wall-clock time in milliseconds since the epoch.
     */
    long nowMillis();
}

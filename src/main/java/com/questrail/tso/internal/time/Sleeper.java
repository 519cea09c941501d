package com.questrail.tso.internal.time;

import java.time.Duration;

/**
 * Blocking pause used by the bounded waits of the allocators.
 *
 * <p>Every wait is broken into short pauses through this interface so the
 * caller can re-check its cancellation conditions (leadership, interruption)
 * between pauses.</p>
 */
@FunctionalInterface
public interface Sleeper
{
    /**
     * Pauses the calling thread for roughly {@code duration}.
     *
     * @throws InterruptedException if the thread is interrupted while paused
     */
    void sleep(Duration duration) throws InterruptedException;
}

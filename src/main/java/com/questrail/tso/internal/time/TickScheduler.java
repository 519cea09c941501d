package com.questrail.tso.internal.time;

import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * TickScheduler
 * =============================================================================
 * Drives the periodic maintenance of a leadership term.
 *
 * <p>A term's maintenance is a single loop: each run starts {@code interval}
 * after the previous run <em>ended</em>, so a slow run (store I/O inside the
 * tick) delays the next one instead of piling up behind it. Runs of one loop
 * never overlap. The loop ends when a run returns {@code false}, when a run
 * throws, or when its handle is cancelled.</p>
 *
 * <p>Intervals are measured on a monotonic time base, never on the wall clock
 * the allocators are tracking.</p>
 */
public interface TickScheduler
{
    /**
     * Starts a maintenance loop. The first run happens one {@code interval}
     * from now.
     *
     * @param interval delay between the end of one run and the start of the next
     * @param tick     one maintenance run; returns whether the loop continues
     */
    Ticking start(Duration interval, BooleanSupplier tick);

    /**
     * Handle of a running maintenance loop.
     */
    interface Ticking
    {
        /**
         * Stops the loop. A run already in progress completes but is not
         * followed by another.
         *
         * @return {@code false} if the loop had already ended
         */
        boolean cancel();

        boolean isActive();
    }

    static void checkInterval(Duration interval)
    {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("tick interval must be > 0: " + interval);
        }
    }
}

package com.questrail.tso.internal.alloc;

import com.questrail.tso.api.Timestamp;
import com.questrail.tso.api.StreamKey;
import com.questrail.tso.election.LeaderLease;

/**
 * TsoAllocator
 * -----------------------------------------------------------------------------
 * One timestamp stream: an in-memory (physical, logical) cursor backed by a
 * persisted watermark.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   initialize(lease)  → load checkpoint, wait for the clock, persist, serve
 *   allocate(n) / tick() / advanceTo(p)
 *   reset()            → cursor zeroed, further allocations fail with NotLeader
 * </pre>
 */
public interface TsoAllocator
{
    /**
     * Value of {@link #currentPhysical()} while the allocator is not serving.
     */
    long NOT_SERVING = -1L;

    StreamKey stream();

    /**
     * Runs the initialization protocol under {@code lease}. Returns only after
     * the first watermark has been persisted; blocks while the wall clock is
     * behind the persisted watermark.
     */
    void initialize(LeaderLease lease);

    /**
     * Reserves {@code count} consecutive timestamps and returns the first.
     */
    Timestamp allocate(int count);

    /**
     * Periodic maintenance: advance physical time and refresh the watermark.
     */
    void tick();

    /**
     * Forces the cursor forward to at least {@code physical}. Never moves it
     * backward. Allocations after this call return a physical value no smaller
     * than {@code physical}.
     */
    void advanceTo(long physical);

    /**
     * Invalidates and zeroes the cursor. Takes effect before returning.
     */
    void reset();

    boolean isReady();

    /**
     * Physical component of the cursor, or {@link #NOT_SERVING}.
     */
    long currentPhysical();

    /**
     * Watermark most recently persisted by this allocator, or {@link #NOT_SERVING}.
     */
    long persistedWatermark();
}

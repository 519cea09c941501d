package com.questrail.tso.internal.alloc;

import com.questrail.tso.api.StreamKey;
import com.questrail.tso.config.TsoConfig;
import com.questrail.tso.election.LeadershipGuard;
import com.questrail.tso.internal.time.MonotonicClock;
import com.questrail.tso.internal.time.Sleeper;
import com.questrail.tso.internal.time.WallClock;
import com.questrail.tso.observability.TsoObservabilitySink;
import com.questrail.tso.store.CheckpointStore;

/**
 * Allocator of the single cluster-wide stream.
 */
public final class GlobalTsoAllocator extends AbstractTsoAllocator {

    public GlobalTsoAllocator(TsoConfig config,
                              CheckpointStore store,
                              LeadershipGuard guard,
                              WallClock wallClock,
                              MonotonicClock monotonicClock,
                              Sleeper sleeper,
                              TsoObservabilitySink observabilitySink)
    {
        super(StreamKey.GLOBAL, config, store, guard, wallClock, monotonicClock, sleeper, observabilitySink);
    }

    /**
     * Moves the global stream strictly past {@code localPhysical}, so that every
     * global timestamp issued afterwards is greater than any local timestamp
     * issued at or below that physical value.
     */
    public void fenceAbove(long localPhysical) {
        advanceTo(localPhysical + 1);
    }
}

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
 * Allocator of one region's stream.
 *
 * <p>Runs the same cursor algorithm as the global allocator and is additionally
 * pulled forward to the global stream's physical time by the synchronization
 * handshake of {@link TsoAllocatorManager}.</p>
 */
public final class LocalTsoAllocator extends AbstractTsoAllocator {

    public LocalTsoAllocator(String region,
                             TsoConfig config,
                             CheckpointStore store,
                             LeadershipGuard guard,
                             WallClock wallClock,
                             MonotonicClock monotonicClock,
                             Sleeper sleeper,
                             TsoObservabilitySink observabilitySink)
    {
        super(StreamKey.region(region), config, store, guard, wallClock, monotonicClock, sleeper, observabilitySink);
    }

    public String region() {
        return stream().region();
    }

    /**
     * Bumps this region forward to at least {@code globalPhysical}. One-directional:
     * a region ahead of the global stream is left untouched.
     */
    public void synchronizeWith(long globalPhysical) {
        advanceTo(globalPhysical);
    }
}

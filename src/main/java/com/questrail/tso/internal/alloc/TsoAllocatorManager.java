package com.questrail.tso.internal.alloc;

import com.questrail.tso.api.ClockAnomalyException;
import com.questrail.tso.api.StreamKey;
import com.questrail.tso.api.Timestamp;
import com.questrail.tso.api.TimestampOracle;
import com.questrail.tso.api.UnknownStreamException;
import com.questrail.tso.config.TsoConfig;
import com.questrail.tso.election.ElectionObserver;
import com.questrail.tso.election.LeaderLease;
import com.questrail.tso.election.LeadershipGuard;
import com.questrail.tso.internal.time.MonotonicClock;
import com.questrail.tso.internal.time.Sleeper;
import com.questrail.tso.internal.time.TickScheduler;
import com.questrail.tso.internal.time.WallClock;
import com.questrail.tso.observability.NullObservabilitySink;
import com.questrail.tso.observability.TsoErrorEvent;
import com.questrail.tso.observability.TsoObservabilitySink;
import com.questrail.tso.store.CheckpointStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * TsoAllocatorManager
 * =============================================================================
 * Owns the global allocator and the per-region allocators, binds their lifecycle
 * to leadership, runs their periodic maintenance and routes allocation requests.
 *
 * <h2>Leadership binding</h2>
 * <ul>
 *   <li><b>Acquired</b>: every allocator runs its initialization protocol, the
 *       regions are synchronized with the global stream, then the periodic tick
 *       starts. Any failure resets all allocators and resigns the term.</li>
 *   <li><b>Lost</b>: the tick is cancelled and every allocator is reset before
 *       the callback returns.</li>
 * </ul>
 *
 * <h2>Periodic tick</h2>
 * <p>Every {@code updatePhysicalInterval} the manager ticks the global allocator,
 * then each region, then runs the synchronization handshake. The maintenance
 * loop is tied to the epoch it was started for and ends on its first run under
 * a stale epoch. A version conflict or clock anomaly raised during the tick
 * resigns leadership.</p>
 *
 * <p>A failure is only ever charged to the term it was raised under: when a
 * newer term is already live, the allocators belong to it and are left alone.</p>
 *
 * <h2>Synchronization handshake</h2>
 * <ol>
 *   <li>If any region is at or ahead of the global stream, the global stream is
 *       moved strictly past the highest region (forward only).</li>
 *   <li>Every region behind the global stream is bumped to the global physical.</li>
 * </ol>
 * <p>After the handshake, a local timestamp issued before it is smaller than any
 * global timestamp issued after it, and no region issues a physical value below
 * the global one observed by the handshake.</p>
 */
public final class TsoAllocatorManager implements TimestampOracle, ElectionObserver {

    private final TsoConfig config;
    private final LeadershipGuard guard;
    private final WallClock wallClock;
    private final TickScheduler scheduler;
    private final TsoObservabilitySink observabilitySink;

    private final GlobalTsoAllocator global;
    private final Map<String, LocalTsoAllocator> locals;

    private final Object tickLock = new Object();
    private long tickEpoch = LeadershipGuard.NO_EPOCH;
    private TickScheduler.Ticking ticking;

    public TsoAllocatorManager(TsoConfig config,
                               CheckpointStore store,
                               LeadershipGuard guard,
                               WallClock wallClock,
                               MonotonicClock monotonicClock,
                               Sleeper sleeper,
                               TickScheduler scheduler,
                               TsoObservabilitySink observabilitySink)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.guard = Objects.requireNonNull(guard, "guard");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

        this.global = new GlobalTsoAllocator(
                config, store, guard, wallClock, monotonicClock, sleeper, this.observabilitySink);

        Map<String, LocalTsoAllocator> regions = new LinkedHashMap<>();
        if (config.enableLocalTso()) {
            for (String region : config.localRegions()) {
                regions.put(region, new LocalTsoAllocator(
                        region, config, store, guard, wallClock, monotonicClock, sleeper, this.observabilitySink));
            }
        }
        this.locals = Collections.unmodifiableMap(regions);

        guard.subscribe(this);
    }

    // -------------------------------------------------------------------------
    // TimestampOracle
    // -------------------------------------------------------------------------

    @Override
    public Timestamp getTimestamp(StreamKey stream, int count) {
        TsoAllocator allocator = allocatorFor(stream);
        long epochBefore = guard.currentEpoch();
        try {
            return allocator.allocate(count);
        } catch (ClockAnomalyException e) {
            long epoch = e.epoch() != ClockAnomalyException.UNKNOWN_EPOCH ? e.epoch() : epochBefore;
            abandonTerm(epoch, "Clock anomaly on stream " + stream + " under epoch " + epoch, e);
            throw e;
        }
    }

    @Override
    public boolean isReady(StreamKey stream) {
        Objects.requireNonNull(stream, "stream");
        TsoAllocator allocator = stream.isGlobal() ? global : locals.get(stream.region());
        return allocator != null && allocator.isReady();
    }

    /**
     * Readiness of every allocator owned by this manager.
     */
    public boolean isReady() {
        if (!global.isReady()) {
            return false;
        }
        for (LocalTsoAllocator local : locals.values()) {
            if (!local.isReady()) {
                return false;
            }
        }
        return true;
    }

    public TsoAllocator allocatorFor(StreamKey stream) {
        Objects.requireNonNull(stream, "stream");
        if (stream.isGlobal()) {
            return global;
        }
        LocalTsoAllocator local = locals.get(stream.region());
        if (local == null) {
            throw new UnknownStreamException(stream);
        }
        return local;
    }

    public Collection<LocalTsoAllocator> localAllocators() {
        return locals.values();
    }

    // -------------------------------------------------------------------------
    // ElectionObserver
    // -------------------------------------------------------------------------

    @Override
    public void onLeadershipAcquired(LeaderLease lease) {
        long epoch = lease.epoch();
        try {
            for (TsoAllocator allocator : allocators()) {
                allocator.initialize(lease);
            }
            synchronizeLocalAllocators();
            startTicking(epoch);
        } catch (RuntimeException e) {
            abandonTerm(epoch, "Allocator initialization failed under epoch " + epoch, e);
        }
    }

    @Override
    public void onLeadershipLost(LeaderLease lease) {
        stopTicking();
        resetAll();
    }

    // -------------------------------------------------------------------------
    // Maintenance
    // -------------------------------------------------------------------------

    /**
     * Runs the synchronization handshake between the global stream and every
     * region. Called after each tick; may also be called on demand before a
     * cross-region operation.
     */
    public void synchronizeLocalAllocators() {
        if (locals.isEmpty()) {
            return;
        }

        long maxLocal = TsoAllocator.NOT_SERVING;
        for (LocalTsoAllocator local : locals.values()) {
            maxLocal = Math.max(maxLocal, local.currentPhysical());
        }

        long globalPhysical = global.currentPhysical();
        if (globalPhysical == TsoAllocator.NOT_SERVING) {
            return;
        }
        if (maxLocal >= globalPhysical) {
            global.fenceAbove(maxLocal);
            globalPhysical = Math.max(global.currentPhysical(), globalPhysical);
        }

        for (LocalTsoAllocator local : locals.values()) {
            local.synchronizeWith(globalPhysical);
        }
    }

    private void startTicking(long epoch) {
        synchronized (tickLock) {
            cancelTickLocked();
            tickEpoch = epoch;
            ticking = scheduler.start(config.updatePhysicalInterval(), () -> runTick(epoch));
        }
    }

    private void stopTicking() {
        synchronized (tickLock) {
            cancelTickLocked();
            tickEpoch = LeadershipGuard.NO_EPOCH;
        }
    }

    private void cancelTickLocked() {
        if (ticking != null) {
            ticking.cancel();
            ticking = null;
        }
    }

    /**
     * One maintenance run of the term {@code epoch}.
     *
     * @return whether the term's maintenance loop continues
     */
    private boolean runTick(long epoch) {
        synchronized (tickLock) {
            if (tickEpoch != epoch) {
                return false;
            }
        }

        try {
            for (TsoAllocator allocator : allocators()) {
                allocator.tick();
            }
            synchronizeLocalAllocators();
        } catch (RuntimeException e) {
            abandonTerm(epoch, "Allocator maintenance failed under epoch " + epoch, e);
            return false;
        }
        return true;
    }

    /**
     * Drops every allocator and, if {@code epoch} is still the live term, resigns
     * it: this process can no longer guarantee monotonic output for the term.
     */
    private void abandonTerm(long epoch, String message, Throwable cause) {
        observabilitySink.onError(new TsoErrorEvent(Instant.ofEpochMilli(wallClock.nowMillis()), message, cause));
        if (guard.currentEpoch() > epoch) {
            return;
        }
        stopTicking();
        resetAll();
        if (guard.isLeader(epoch)) {
            guard.resign(message + ": " + cause.getMessage());
        }
    }

    private void resetAll() {
        for (TsoAllocator allocator : allocators()) {
            allocator.reset();
        }
    }

    private List<TsoAllocator> allocators() {
        List<TsoAllocator> all = new ArrayList<>(1 + locals.size());
        all.add(global);
        all.addAll(locals.values());
        return all;
    }

    /**
     * Stops maintenance and resets every allocator. Leadership itself is left to
     * the election capability.
     */
    public void shutdown() {
        stopTicking();
        resetAll();
    }
}

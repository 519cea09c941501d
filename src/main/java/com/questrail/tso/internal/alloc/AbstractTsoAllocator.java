package com.questrail.tso.internal.alloc;

import com.questrail.tso.api.ClockAnomalyException;
import com.questrail.tso.api.NotLeaderException;
import com.questrail.tso.api.StoreUnavailableException;
import com.questrail.tso.api.StreamKey;
import com.questrail.tso.api.Timestamp;
import com.questrail.tso.config.TsoConfig;
import com.questrail.tso.election.LeaderLease;
import com.questrail.tso.election.LeadershipGuard;
import com.questrail.tso.internal.time.MonotonicClock;
import com.questrail.tso.internal.time.Sleeper;
import com.questrail.tso.internal.time.WallClock;
import com.questrail.tso.observability.CheckpointPersistedEvent;
import com.questrail.tso.observability.LeadershipTransitionEvent;
import com.questrail.tso.observability.NullObservabilitySink;
import com.questrail.tso.observability.TsoErrorEvent;
import com.questrail.tso.observability.TsoObservabilitySink;
import com.questrail.tso.store.Checkpoint;
import com.questrail.tso.store.CheckpointStore;
import com.questrail.tso.store.VersionConflictException;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * AbstractTsoAllocator
 * =============================================================================
 * The cursor algorithm shared by the global and the per-region allocators.
 *
 * <h2>State</h2>
 * <ul>
 *   <li>{@code physical}, {@code logical}: the cursor</li>
 *   <li>{@code floor}: lowest physical the next allocation may use (raised by
 *       {@link #advanceTo(long)})</li>
 *   <li>{@code watermark}, {@code version}: last persisted checkpoint</li>
 *   <li>{@code epoch}, {@code serving}: the leadership term the cursor belongs to</li>
 * </ul>
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>Every issued physical value is strictly below the persisted watermark.
 *       A new leader seeds at {@code max(now, watermark)} and so always issues
 *       strictly greater timestamps than its predecessor.</li>
 *   <li>{@code physical} never decreases while serving; a physical advance resets
 *       {@code logical} to 0.</li>
 *   <li>{@code logical} never exceeds {@link Timestamp#MAX_LOGICAL}.</li>
 * </ul>
 *
 * <h2>Locking</h2>
 * <p>{@code cursorLock} guards all fields above and is held for arithmetic and
 * volatile reads only. Every allocation checks the cursor's epoch against the
 * guard inside it, so a lost term stops issuing before its loss notification
 * has been delivered.
 * {@code maintenanceLock} serializes initialization, ticks and forced advances,
 * which do store I/O <em>outside</em> {@code cursorLock} and commit the result
 * only if the cursor still belongs to the same epoch. {@link #reset()} takes only
 * {@code cursorLock}, so a leadership loss is never delayed by store I/O.</p>
 */
public abstract class AbstractTsoAllocator implements TsoAllocator {

    private final StreamKey stream;
    private final TsoConfig config;
    private final CheckpointWriter checkpoints;
    private final LeadershipGuard guard;
    private final WallClock wallClock;
    private final MonotonicClock monotonicClock;
    private final Sleeper sleeper;
    private final TsoObservabilitySink observabilitySink;

    private final long persistAheadMillis;
    private final long saveSafetyMarginMillis;

    private final ReentrantLock cursorLock = new ReentrantLock();
    private final ReentrantLock maintenanceLock = new ReentrantLock();

    // Guarded by cursorLock.
    private boolean serving;
    private LeaderLease lease;
    private long physical;
    private long logical;
    private long floor;
    private long watermark;
    private long version;

    // Guarded by maintenanceLock.
    private long firstSaveFailureNanos = -1L;

    protected AbstractTsoAllocator(StreamKey stream,
                                   TsoConfig config,
                                   CheckpointStore store,
                                   LeadershipGuard guard,
                                   WallClock wallClock,
                                   MonotonicClock monotonicClock,
                                   Sleeper sleeper,
                                   TsoObservabilitySink observabilitySink)
    {
        this.stream = Objects.requireNonNull(stream, "stream");
        this.config = Objects.requireNonNull(config, "config");
        this.guard = Objects.requireNonNull(guard, "guard");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.monotonicClock = Objects.requireNonNull(monotonicClock, "monotonicClock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.checkpoints = new CheckpointWriter(
                Objects.requireNonNull(store, "store"),
                sleeper,
                config.storeRetryAttempts(),
                config.storeRetryBackoff());

        this.persistAheadMillis = Math.max(1, config.persistAheadMargin().toMillis());
        this.saveSafetyMarginMillis = config.saveSafetyMargin().toMillis();
    }

    @Override
    public final StreamKey stream() {
        return stream;
    }

    // -------------------------------------------------------------------------
    // Initialization
    // -------------------------------------------------------------------------

    @Override
    public void initialize(LeaderLease lease) {
        Objects.requireNonNull(lease, "lease");
        maintenanceLock.lock();
        try {
            reset();
            long epoch = lease.epoch();
            ensureLeader(epoch);

            Optional<Checkpoint> checkpoint = checkpoints.load(stream.streamId());
            long saved = checkpoint.map(Checkpoint::savedPhysical).orElse(0L);
            long expectedVersion = checkpoint.map(Checkpoint::version).orElse(CheckpointStore.NO_VERSION);

            long now = awaitClockCatchUp(saved, epoch);
            long seed = Math.max(now, saved);

            long newWatermark = seed + persistAheadMillis;
            long newVersion = checkpoints.save(stream.streamId(), newWatermark, expectedVersion);

            cursorLock.lock();
            try {
                ensureLeader(epoch);
                this.lease = lease;
                this.physical = seed;
                this.logical = 0;
                this.floor = seed;
                this.watermark = newWatermark;
                this.version = newVersion;
                this.serving = true;
            } finally {
                cursorLock.unlock();
            }
            firstSaveFailureNanos = -1L;

            observabilitySink.onCheckpointPersisted(new CheckpointPersistedEvent(
                    now(), stream.streamId(), newWatermark, newVersion));
            observabilitySink.onLeadershipTransition(new LeadershipTransitionEvent(
                    now(), LeadershipTransitionEvent.Kind.ALLOCATOR_READY, lease, stream));
        } finally {
            maintenanceLock.unlock();
        }
    }

    /**
     * Blocks until the wall clock reaches {@code saved}, bounded by
     * {@code maxResetTsGap}. Pauses last at most {@code updatePhysicalInterval},
     * and leadership is re-checked after each one, so losing the term ends the
     * wait promptly.
     *
     * @return the first wall-clock reading not behind {@code saved}
     */
    private long awaitClockCatchUp(long saved, long epoch) {
        long now = wallClock.nowMillis();
        if (now >= saved) {
            return now;
        }

        long deadline = monotonicClock.nowNanos() + config.maxResetTsGap().toNanos();
        while (now < saved) {
            long remaining = deadline - monotonicClock.nowNanos();
            if (remaining <= 0) {
                throw new ClockAnomalyException("Wall clock " + now + " still behind watermark "
                        + saved + " of stream " + stream + " after " + config.maxResetTsGap(), epoch);
            }
            ensureLeader(epoch);
            long behindNanos = Duration.ofMillis(saved - now).toNanos();
            long sliceNanos = config.updatePhysicalInterval().toNanos();
            pause(Duration.ofNanos(Math.min(sliceNanos, Math.min(remaining, behindNanos))));
            now = wallClock.nowMillis();
        }
        return now;
    }

    // -------------------------------------------------------------------------
    // Allocation
    // -------------------------------------------------------------------------

    @Override
    public Timestamp allocate(int count) {
        if (count < 1 || count > config.maxAllocateCount()) {
            throw new IllegalArgumentException("count must be in [1, " + config.maxAllocateCount() + "]: " + count);
        }

        long deadline = 0L;
        int attempt = 0;
        while (true) {
            long epoch;
            LeaderLease stale = null;
            cursorLock.lock();
            try {
                if (!serving) {
                    throw new NotLeaderException("Allocator for stream " + stream + " is not serving");
                }
                epoch = lease.epoch();
                if (!guard.isLeader(epoch)) {
                    // The loss notification may still be queued behind another callback.
                    stale = lease;
                    clearLocked();
                } else {
                    if (physical < floor && floor < watermark) {
                        physical = floor;
                        logical = 0;
                    }
                    if (physical >= floor && logical + count <= Timestamp.MAX_LOGICAL) {
                        return reserve(count);
                    }
                    if (physical >= floor && tryBumpLocked(attempt >= config.allocateRetryAttempts())) {
                        return reserve(count);
                    }
                }
            } finally {
                cursorLock.unlock();
            }
            if (stale != null) {
                publishReset(stale);
                throw new NotLeaderException("Leadership term " + epoch + " of stream " + stream + " is no longer current");
            }

            // Logical space exhausted, or the floor is above the watermark: wait
            // for the tick to move physical time and persist a new watermark.
            long nowNanos = monotonicClock.nowNanos();
            if (attempt == 0) {
                deadline = nowNanos + config.maxResetTsGap().toNanos();
            } else if (nowNanos - deadline >= 0) {
                invalidate(epoch);
                ClockAnomalyException e = new ClockAnomalyException("Stream " + stream
                        + " could not advance physical time within " + config.maxResetTsGap(), epoch);
                reportError(e.getMessage(), e);
                throw e;
            }
            ensureLeader(epoch);
            pause(backoff(attempt++));
        }
    }

    /**
     * Moves physical forward when the logical counter is exhausted. Adopts the
     * wall clock if it has advanced; otherwise, when {@code synthetic} is set,
     * advances by one millisecond. Never reaches the watermark.
     */
    private boolean tryBumpLocked(boolean synthetic) {
        long now = wallClock.nowMillis();
        long next;
        if (now > physical) {
            next = now;
        } else if (synthetic) {
            next = physical + 1;
        } else {
            return false;
        }
        if (next >= watermark) {
            return false;
        }
        physical = next;
        logical = 0;
        return true;
    }

    private Timestamp reserve(int count) {
        long base = logical;
        logical += count;
        return new Timestamp(physical, base);
    }

    private Duration backoff(int attempt) {
        long millis = 1L << Math.min(attempt, 10);
        Duration d = Duration.ofMillis(millis);
        return d.compareTo(config.updatePhysicalInterval()) > 0 ? config.updatePhysicalInterval() : d;
    }

    // -------------------------------------------------------------------------
    // Maintenance
    // -------------------------------------------------------------------------

    @Override
    public void tick() {
        maintenanceLock.lock();
        try {
            long epoch;
            long prevPhysical;
            long prevLogical;
            long currentFloor;
            long currentWatermark;
            long currentVersion;
            cursorLock.lock();
            try {
                if (!serving) {
                    return;
                }
                epoch = lease.epoch();
                prevPhysical = physical;
                prevLogical = logical;
                currentFloor = floor;
                currentWatermark = watermark;
                currentVersion = version;
            } finally {
                cursorLock.unlock();
            }

            long now = wallClock.nowMillis();
            long next;
            if (now > prevPhysical) {
                next = now;
            } else if (prevLogical > Timestamp.MAX_LOGICAL / 2) {
                // Clock stalled with more than half the logical space used.
                next = prevPhysical + 1;
            } else {
                next = prevPhysical;
            }
            next = Math.max(next, currentFloor);

            if (currentWatermark - next <= saveSafetyMarginMillis) {
                if (!persistAhead(epoch, next, currentVersion)) {
                    next = Math.min(next, currentWatermark - 1);
                }
            }

            if (next > prevPhysical) {
                cursorLock.lock();
                try {
                    if (serving && lease.epoch() == epoch && next > physical && next < watermark) {
                        physical = next;
                        logical = 0;
                    }
                } finally {
                    cursorLock.unlock();
                }
            }
        } finally {
            maintenanceLock.unlock();
        }
    }

    @Override
    public void advanceTo(long target) {
        maintenanceLock.lock();
        try {
            long epoch;
            long currentWatermark;
            long currentVersion;
            cursorLock.lock();
            try {
                if (!serving || physical >= target) {
                    return;
                }
                floor = Math.max(floor, target);
                epoch = lease.epoch();
                currentWatermark = watermark;
                currentVersion = version;
            } finally {
                cursorLock.unlock();
            }

            if (currentWatermark - target <= saveSafetyMarginMillis) {
                // The raised floor stays in place; allocations wait until a later
                // tick manages to persist.
                if (!persistAhead(epoch, target, currentVersion)) {
                    return;
                }
            }

            cursorLock.lock();
            try {
                if (serving && lease.epoch() == epoch && physical < floor && floor < watermark) {
                    physical = floor;
                    logical = 0;
                }
            } finally {
                cursorLock.unlock();
            }
        } finally {
            maintenanceLock.unlock();
        }
    }

    /**
     * Persists {@code base + persistAheadMargin} as the new watermark.
     *
     * @return {@code false} if the store is unavailable but the failure budget
     *         ({@code saveInterval}) is not yet spent
     * @throws VersionConflictException another process wrote the checkpoint; the
     *                                  cursor has been invalidated
     * @throws ClockAnomalyException    the store stayed unavailable for longer than
     *                                  {@code saveInterval}; the cursor has been invalidated
     */
    private boolean persistAhead(long epoch, long base, long expectedVersion) {
        long target = base + persistAheadMillis;
        long newVersion;
        try {
            newVersion = checkpoints.save(stream.streamId(), target, expectedVersion);
        } catch (VersionConflictException e) {
            invalidate(epoch);
            reportError("Checkpoint of stream " + stream + " was written by another process", e);
            throw e;
        } catch (StoreUnavailableException e) {
            long nowNanos = monotonicClock.nowNanos();
            if (firstSaveFailureNanos < 0) {
                firstSaveFailureNanos = nowNanos;
            }
            if (nowNanos - firstSaveFailureNanos >= config.saveInterval().toNanos()) {
                invalidate(epoch);
                ClockAnomalyException anomaly = new ClockAnomalyException("Watermark of stream " + stream
                        + " could not be persisted within " + config.saveInterval(), epoch, e);
                reportError(anomaly.getMessage(), e);
                throw anomaly;
            }
            reportError("Checkpoint save of stream " + stream + " failed, will retry", e);
            return false;
        }

        firstSaveFailureNanos = -1L;
        cursorLock.lock();
        try {
            if (serving && lease.epoch() == epoch) {
                watermark = target;
                version = newVersion;
            }
        } finally {
            cursorLock.unlock();
        }
        observabilitySink.onCheckpointPersisted(new CheckpointPersistedEvent(
                now(), stream.streamId(), target, newVersion));
        return true;
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    @Override
    public void reset() {
        LeaderLease previous;
        cursorLock.lock();
        try {
            previous = serving ? lease : null;
            clearLocked();
        } finally {
            cursorLock.unlock();
        }
        if (previous != null) {
            publishReset(previous);
        }
    }

    /**
     * Resets the cursor only if it still belongs to {@code epoch}.
     */
    private void invalidate(long epoch) {
        LeaderLease previous = null;
        cursorLock.lock();
        try {
            if (serving && lease.epoch() == epoch) {
                previous = lease;
                clearLocked();
            }
        } finally {
            cursorLock.unlock();
        }
        if (previous != null) {
            publishReset(previous);
        }
    }

    private void publishReset(LeaderLease previous) {
        observabilitySink.onLeadershipTransition(new LeadershipTransitionEvent(
                now(), LeadershipTransitionEvent.Kind.ALLOCATOR_RESET, previous, stream));
    }

    private void clearLocked() {
        serving = false;
        lease = null;
        physical = 0;
        logical = 0;
        floor = 0;
        watermark = 0;
        version = CheckpointStore.NO_VERSION;
    }

    @Override
    public boolean isReady() {
        cursorLock.lock();
        try {
            return serving;
        } finally {
            cursorLock.unlock();
        }
    }

    @Override
    public long currentPhysical() {
        cursorLock.lock();
        try {
            return serving ? physical : NOT_SERVING;
        } finally {
            cursorLock.unlock();
        }
    }

    @Override
    public long persistedWatermark() {
        cursorLock.lock();
        try {
            return serving ? watermark : NOT_SERVING;
        } finally {
            cursorLock.unlock();
        }
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private void ensureLeader(long epoch) {
        if (!guard.isLeader(epoch)) {
            throw new NotLeaderException("Leadership term " + epoch + " of stream " + stream + " is no longer current");
        }
    }

    private void pause(Duration duration) {
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NotLeaderException("Interrupted while waiting on stream " + stream, e);
        }
    }

    private void reportError(String message, Throwable cause) {
        observabilitySink.onError(new TsoErrorEvent(now(), message, cause));
    }

    private Instant now() {
        return Instant.ofEpochMilli(wallClock.nowMillis());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + stream + "]";
    }
}

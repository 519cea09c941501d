package com.questrail.tso.election;

import com.questrail.tso.internal.time.WallClock;
import com.questrail.tso.observability.LeadershipTransitionEvent;
import com.questrail.tso.observability.NullObservabilitySink;
import com.questrail.tso.observability.TsoObservabilitySink;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * LeadershipGuard
 * =============================================================================
 * Tracks whether this process currently holds allocator leadership and fans the
 * transitions out to subscribers.
 *
 * <h2>Ordering</h2>
 * <p>The current lease is swapped atomically <em>before</em> subscribers are
 * notified. A long-running acquisition callback (allocator initialization may
 * wait for the clock) therefore observes a concurrent loss immediately through
 * {@link #isLeader(long)}, even though the loss notification itself is queued
 * behind the acquisition callback.</p>
 *
 * <h2>Staleness</h2>
 * <p>Acquisitions whose epoch is not newer than the highest epoch seen are
 * ignored. Loss notifications for a lease that is not current are ignored.</p>
 */
public final class LeadershipGuard implements ElectionObserver {

    public static final long NO_EPOCH = -1L;

    private final LeaderElection election;
    private final WallClock wallClock;
    private final TsoObservabilitySink observabilitySink;

    private final AtomicReference<LeaderLease> current = new AtomicReference<>();
    private final List<ElectionObserver> subscribers = new CopyOnWriteArrayList<>();
    private final Object notifyLock = new Object();

    private volatile long highestEpoch = NO_EPOCH;

    public LeadershipGuard(LeaderElection election, WallClock wallClock, TsoObservabilitySink observabilitySink) {
        this.election = Objects.requireNonNull(election, "election");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    /**
     * Registers this guard with the election capability. Call once, after all
     * subscribers are in place.
     */
    public void start() {
        election.register(this);
    }

    public void subscribe(ElectionObserver subscriber) {
        subscribers.add(Objects.requireNonNull(subscriber, "subscriber"));
    }

    public boolean isLeader() {
        return current.get() != null;
    }

    /**
     * Whether {@code epoch} is the live leadership term.
     */
    public boolean isLeader(long epoch) {
        LeaderLease lease = current.get();
        return lease != null && lease.epoch() == epoch;
    }

    /**
     * Epoch of the live term, or {@link #NO_EPOCH}.
     */
    public long currentEpoch() {
        LeaderLease lease = current.get();
        return lease != null ? lease.epoch() : NO_EPOCH;
    }

    public LeaderLease currentLease() {
        return current.get();
    }

    /**
     * Invalidates the live term locally, then asks the election capability to
     * hand leadership to another process.
     */
    public void resign(String reason) {
        LeaderLease lease = current.get();
        if (lease == null) {
            return;
        }
        onLeadershipLost(lease);
        election.resign(lease, reason);
    }

    @Override
    public void onLeadershipAcquired(LeaderLease lease) {
        Objects.requireNonNull(lease, "lease");

        LeaderLease previous;
        synchronized (this) {
            if (lease.epoch() <= highestEpoch) {
                return;
            }
            highestEpoch = lease.epoch();
            previous = current.getAndSet(lease);
        }

        synchronized (notifyLock) {
            if (previous != null) {
                notifyLost(previous);
            }
            if (current.get() != lease) {
                // Lost again before we got to announce it.
                return;
            }
            observabilitySink.onLeadershipTransition(new LeadershipTransitionEvent(
                now(), LeadershipTransitionEvent.Kind.LEADERSHIP_ACQUIRED, lease, null));
            for (ElectionObserver subscriber : subscribers) {
                subscriber.onLeadershipAcquired(lease);
            }
        }
    }

    @Override
    public void onLeadershipLost(LeaderLease lease) {
        Objects.requireNonNull(lease, "lease");
        if (!current.compareAndSet(lease, null)) {
            return;
        }
        synchronized (notifyLock) {
            notifyLost(lease);
        }
    }

    private void notifyLost(LeaderLease lease) {
        observabilitySink.onLeadershipTransition(new LeadershipTransitionEvent(
            now(), LeadershipTransitionEvent.Kind.LEADERSHIP_LOST, lease, null));
        for (ElectionObserver subscriber : subscribers) {
            subscriber.onLeadershipLost(lease);
        }
    }

    private Instant now() {
        return Instant.ofEpochMilli(wallClock.nowMillis());
    }
}

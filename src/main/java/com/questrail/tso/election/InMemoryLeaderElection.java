package com.questrail.tso.election;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process {@link LeaderElection}.
 *
 * <p>Grants leadership on {@link #campaign(String)} and revokes it on
 * {@link #revoke()} or {@link #resign(LeaderLease, String)}. Used for single-node
 * deployments, where the process is always the leader, and by tests that drive
 * handovers explicitly. Epochs increase with every grant.</p>
 */
public final class InMemoryLeaderElection implements LeaderElection {

    private final List<ElectionObserver> observers = new CopyOnWriteArrayList<>();

    private long epoch;
    private LeaderLease current;
    private String lastResignReason;

    @Override
    public void register(ElectionObserver observer) {
        observers.add(Objects.requireNonNull(observer, "observer"));
    }

    /**
     * Grants a new term to {@code leaderId}, revoking the previous term first.
     */
    public LeaderLease campaign(String leaderId) {
        LeaderLease previous;
        LeaderLease granted;
        synchronized (this) {
            previous = current;
            granted = LeaderLease.unbounded(leaderId, ++epoch);
            current = granted;
        }
        if (previous != null) {
            observers.forEach(o -> o.onLeadershipLost(previous));
        }
        observers.forEach(o -> o.onLeadershipAcquired(granted));
        return granted;
    }

    /**
     * Revokes the current term, as a lease expiry would.
     */
    public void revoke() {
        LeaderLease previous;
        synchronized (this) {
            previous = current;
            current = null;
        }
        if (previous != null) {
            observers.forEach(o -> o.onLeadershipLost(previous));
        }
    }

    @Override
    public void resign(LeaderLease lease, String reason) {
        synchronized (this) {
            if (!Objects.equals(current, lease)) {
                return;
            }
            lastResignReason = reason;
        }
        revoke();
    }

    public synchronized Optional<LeaderLease> current() {
        return Optional.ofNullable(current);
    }

    public synchronized Optional<String> lastResignReason() {
        return Optional.ofNullable(lastResignReason);
    }
}

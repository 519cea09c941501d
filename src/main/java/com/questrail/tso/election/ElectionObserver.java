package com.questrail.tso.election;

/**
 * Callback sink for leadership transitions.
 *
 * <p>Implemented by the {@link LeadershipGuard} (fed by the external election
 * capability) and by everything that subscribes to the guard. Callbacks for one
 * source are delivered serially.</p>
 */
public interface ElectionObserver
{
    /**
     * This process became leader for {@code lease}.
     */
    void onLeadershipAcquired(LeaderLease lease);

    /**
     * This process no longer holds {@code lease}. Implementations must drop all
     * state tied to the lease before returning.
     */
    void onLeadershipLost(LeaderLease lease);
}

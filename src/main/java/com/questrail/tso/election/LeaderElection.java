package com.questrail.tso.election;

/**
 * LeaderElection
 * -----------------------------------------------------------------------------
 * Port to the cluster leader-election capability. The capability itself
 * (campaigning, lease renewal, fencing in the metadata store) lives outside the
 * allocation engine.
 */
public interface LeaderElection
{
    /**
     * Registers the observer that receives this process's leadership transitions.
     */
    void register(ElectionObserver observer);

    /**
     * Voluntarily gives up {@code lease}. No-op if the lease is no longer current.
     *
     * @param reason diagnostic text
     */
    void resign(LeaderLease lease, String reason);
}

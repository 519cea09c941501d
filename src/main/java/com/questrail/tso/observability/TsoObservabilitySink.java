package com.questrail.tso.observability;

/**
 * Receiver of timestamp-oracle observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface TsoObservabilitySink {
    /**
     * Called when leadership is acquired or lost, or when an allocator becomes
     * ready or is reset.
     */
    void onLeadershipTransition(LeadershipTransitionEvent event);

    /**
     * Called after a new watermark has been written to the checkpoint store.
     */
    void onCheckpointPersisted(CheckpointPersistedEvent event);

    /**
     * Called when an error or anomaly occurs (failed initialization, lost
     * checkpoint race, clock anomaly).
     */
    void onError(TsoErrorEvent event);
}

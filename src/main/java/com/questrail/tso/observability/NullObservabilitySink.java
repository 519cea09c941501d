package com.questrail.tso.observability;

/**
 * No-op implementation of TsoObservabilitySink.
 */
public final class NullObservabilitySink implements TsoObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onLeadershipTransition(LeadershipTransitionEvent event) {}

    @Override
    public void onCheckpointPersisted(CheckpointPersistedEvent event) {}

    @Override
    public void onError(TsoErrorEvent event) {}
}

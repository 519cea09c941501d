package com.questrail.tso.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of TsoObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jTsoObservabilitySink implements TsoObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jTsoObservabilitySink.class);

    @Override
    public void onLeadershipTransition(LeadershipTransitionEvent event) {
        var lease = event.lease();
        switch (event.kind()) {
            case LEADERSHIP_ACQUIRED, LEADERSHIP_LOST ->
                log.info("TSO {}: leader={} epoch={}",
                    event.kind(),
                    lease != null ? lease.leaderId() : "-",
                    lease != null ? lease.epoch() : -1);
            case ALLOCATOR_READY, ALLOCATOR_RESET ->
                log.info("TSO allocator {}: stream={} epoch={}",
                    event.kind() == LeadershipTransitionEvent.Kind.ALLOCATOR_READY ? "ready" : "reset",
                    event.stream(),
                    lease != null ? lease.epoch() : -1);
        }
    }

    @Override
    public void onCheckpointPersisted(CheckpointPersistedEvent event) {
        log.debug("TSO checkpoint saved: stream={} savedPhysical={} version={}",
            event.streamId(), event.savedPhysical(), event.version());
    }

    @Override
    public void onError(TsoErrorEvent event) {
        log.error("TSO Error: {}", event.message(), event.cause());
    }
}

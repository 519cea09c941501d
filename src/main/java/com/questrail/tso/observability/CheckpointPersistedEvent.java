package com.questrail.tso.observability;

import java.time.Instant;

/**
 * Record of a successful watermark write.
 */
public record CheckpointPersistedEvent(
    Instant timestamp,
    String streamId,
    long savedPhysical,
    long version
) {
}

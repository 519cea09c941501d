package com.questrail.tso.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the allocation engine.
 */
public record TsoErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}

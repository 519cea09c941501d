package com.questrail.tso.observability;

import com.questrail.tso.api.StreamKey;
import com.questrail.tso.election.LeaderLease;

import java.time.Instant;

/**
 * Record of a leadership or allocator lifecycle transition.
 *
 * @param stream affected stream, or {@code null} for process-wide transitions
 */
public record LeadershipTransitionEvent(
    Instant timestamp,
    Kind kind,
    LeaderLease lease,
    StreamKey stream
) {
    public enum Kind {
        LEADERSHIP_ACQUIRED,
        LEADERSHIP_LOST,
        ALLOCATOR_READY,
        ALLOCATOR_RESET
    }
}

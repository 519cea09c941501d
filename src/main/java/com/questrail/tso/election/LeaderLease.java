package com.questrail.tso.election;

import java.util.Objects;

/**
 * A leadership term granted by the election capability.
 *
 * <p>The allocation engine treats {@code epoch} as an opaque, strictly increasing
 * token: every allocator cursor is tagged with the epoch under which it was
 * initialized, and a different epoch invalidates it. {@code expiryMillis} is
 * advisory; the election capability is responsible for revoking expired
 * leases.</p>
 *
 * @param leaderId     identity of the leader process
 * @param epoch        term number, strictly increasing across elections
 * @param expiryMillis wall-clock expiry, {@link Long#MAX_VALUE} if unbounded
 */
public record LeaderLease(String leaderId, long epoch, long expiryMillis)
{
    public LeaderLease {
        Objects.requireNonNull(leaderId, "leaderId");
        if (epoch < 1) {
            throw new IllegalArgumentException("epoch must be >= 1");
        }
    }

    public static LeaderLease unbounded(String leaderId, long epoch) {
        return new LeaderLease(leaderId, epoch, Long.MAX_VALUE);
    }
}

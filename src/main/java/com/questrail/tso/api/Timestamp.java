package com.questrail.tso.api;

/**
 * Timestamp
 * =============================================================================
 * A (physical, logical) pair issued by a timestamp allocator.
 *
 * <p>{@code physical} is wall-clock milliseconds since the epoch; {@code logical}
 * is a sequence counter within one physical millisecond. Ordering compares
 * {@code physical} first, then {@code logical}.</p>
 *
 * <p>An allocation of {@code count} timestamps returns the first element of a
 * reserved block; the remaining elements are obtained with {@link #next(int)}.</p>
 */
public record Timestamp(long physical, long logical) implements Comparable<Timestamp>
{
    /**
     * Number of bits the logical counter occupies in {@link #toComposed()}.
     */
    public static final int LOGICAL_BITS = 18;

    /**
     * Exclusive upper bound of the logical counter for one physical value.
     */
    public static final long MAX_LOGICAL = 1L << LOGICAL_BITS;

    public Timestamp {
        if (physical < 0) {
            throw new IllegalArgumentException("physical must be >= 0");
        }
        if (logical < 0 || logical >= MAX_LOGICAL) {
            throw new IllegalArgumentException("logical must be in [0, " + MAX_LOGICAL + ")");
        }
    }

    /**
     * Returns the timestamp {@code offset} logical steps after this one.
     *
     * @throws IllegalArgumentException if the result leaves the logical range
     */
    public Timestamp next(int offset) {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0");
        }
        return new Timestamp(physical, logical + offset);
    }

    /**
     * Packs this timestamp into a single long: {@code physical << 18 | logical}.
     */
    public long toComposed() {
        return (physical << LOGICAL_BITS) | logical;
    }

    public static Timestamp fromComposed(long composed) {
        return new Timestamp(composed >>> LOGICAL_BITS, composed & (MAX_LOGICAL - 1));
    }

    @Override
    public int compareTo(Timestamp other) {
        int c = Long.compare(physical, other.physical);
        return c != 0 ? c : Long.compare(logical, other.logical);
    }

    public boolean isAfter(Timestamp other) {
        return compareTo(other) > 0;
    }
}

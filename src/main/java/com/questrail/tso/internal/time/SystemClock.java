package com.questrail.tso.internal.time;

/**
 * Production clock pair: {@link System#currentTimeMillis()} for timestamp
 * physical values, {@link System#nanoTime()} for wait bounds.
 */
public enum SystemClock implements WallClock, MonotonicClock {
    INSTANCE;

    @Override
    public long nowMillis() {
        return System.currentTimeMillis();
    }

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}

package com.questrail.tso.internal.time;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Production {@link Sleeper} backed by {@link TimeUnit#sleep(long)}.
 */
public enum SystemSleeper implements Sleeper {
    INSTANCE;

    @Override
    public void sleep(Duration duration) throws InterruptedException {
        if (duration.isNegative() || duration.isZero()) {
            return;
        }
        TimeUnit.NANOSECONDS.sleep(duration.toNanos());
    }
}

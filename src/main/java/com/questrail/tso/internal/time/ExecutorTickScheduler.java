package com.questrail.tso.internal.time;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * ExecutorTickScheduler
 * =============================================================================
 * {@link TickScheduler} backed by a {@link ScheduledExecutorService}.
 *
 * <p>Each loop re-arms a one-shot task after every run rather than using
 * {@code scheduleWithFixedDelay}, so that a run can end its own loop by
 * returning {@code false}.</p>
 *
 * <h2>Executor Ownership</h2>
 * <p>This class does <strong>not</strong> own the executor. Once the executor is
 * shut down, running loops end quietly at their next re-arm.</p>
 */
public final class ExecutorTickScheduler implements TickScheduler {

    private final ScheduledExecutorService executor;

    public ExecutorTickScheduler(ScheduledExecutorService executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public Ticking start(Duration interval, BooleanSupplier tick) {
        Objects.requireNonNull(interval, "interval");
        Objects.requireNonNull(tick, "tick");
        TickScheduler.checkInterval(interval);

        Loop loop = new Loop(interval.toNanos(), tick);
        loop.arm();
        return loop;
    }

    private final class Loop implements Ticking, Runnable {
        private final long intervalNanos;
        private final BooleanSupplier tick;
        private final AtomicBoolean active = new AtomicBoolean(true);
        private volatile ScheduledFuture<?> next;

        private Loop(long intervalNanos, BooleanSupplier tick) {
            this.intervalNanos = intervalNanos;
            this.tick = tick;
        }

        private void arm() {
            if (!active.get()) {
                return;
            }
            try {
                next = executor.schedule(this, intervalNanos, TimeUnit.NANOSECONDS);
            } catch (RejectedExecutionException e) {
                // Executor shut down.
                active.set(false);
            }
        }

        @Override
        public void run() {
            if (!active.get()) {
                return;
            }
            boolean more = false;
            try {
                more = tick.getAsBoolean();
            } finally {
                if (!more) {
                    active.set(false);
                }
            }
            arm();
        }

        @Override
        public boolean cancel() {
            if (!active.compareAndSet(true, false)) {
                return false;
            }
            ScheduledFuture<?> f = next;
            if (f != null) {
                f.cancel(false);
            }
            return true;
        }

        @Override
        public boolean isActive() {
            return active.get();
        }
    }
}

package com.questrail.tso.internal.alloc;

import com.questrail.tso.api.NotLeaderException;
import com.questrail.tso.api.StoreUnavailableException;
import com.questrail.tso.internal.time.Sleeper;
import com.questrail.tso.store.Checkpoint;
import com.questrail.tso.store.CheckpointStore;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Checkpoint store access with bounded retry of transient failures.
 *
 * <ul>
 *   <li>{@link StoreUnavailableException} is retried up to the configured number
 *       of attempts, with a fixed backoff between attempts</li>
 *   <li>version conflicts are never retried</li>
 *   <li>an interrupted backoff aborts with {@link NotLeaderException}</li>
 * </ul>
 */
final class CheckpointWriter {

    private final CheckpointStore store;
    private final Sleeper sleeper;
    private final int attempts;
    private final Duration backoff;

    CheckpointWriter(CheckpointStore store, Sleeper sleeper, int attempts, Duration backoff) {
        this.store = Objects.requireNonNull(store, "store");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.attempts = attempts;
        this.backoff = Objects.requireNonNull(backoff, "backoff");
    }

    Optional<Checkpoint> load(String streamId) {
        return withRetry(() -> store.load(streamId));
    }

    long save(String streamId, long savedPhysical, long expectedVersion) {
        return withRetry(() -> store.save(streamId, savedPhysical, expectedVersion));
    }

    private <T> T withRetry(Supplier<T> call) {
        StoreUnavailableException last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return call.get();
            } catch (StoreUnavailableException e) {
                last = e;
                if (attempt < attempts) {
                    pause();
                }
            }
        }
        throw last;
    }

    private void pause() {
        try {
            sleeper.sleep(backoff);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NotLeaderException("Interrupted while retrying checkpoint store", e);
        }
    }
}

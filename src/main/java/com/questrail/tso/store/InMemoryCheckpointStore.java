package com.questrail.tso.store;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory linearizable {@link CheckpointStore}.
 *
 * <p>Suitable for single-node deployments and tests. Instances may be shared
 * between several allocator managers to simulate a cluster sharing one
 * metadata store.</p>
 */
public final class InMemoryCheckpointStore implements CheckpointStore {

    private final Map<String, Checkpoint> checkpoints = new ConcurrentHashMap<>();

    @Override
    public Optional<Checkpoint> load(String streamId) {
        Objects.requireNonNull(streamId, "streamId");
        return Optional.ofNullable(checkpoints.get(streamId));
    }

    @Override
    public long save(String streamId, long savedPhysical, long expectedVersion) {
        Objects.requireNonNull(streamId, "streamId");

        // compute() runs atomically per key.
        Checkpoint written = checkpoints.compute(streamId, (id, current) -> {
            long actual = current == null ? NO_VERSION : current.version();
            if (actual != expectedVersion) {
                throw new VersionConflictException(id, expectedVersion, actual);
            }
            return new Checkpoint(id, savedPhysical, actual + 1);
        });
        return written.version();
    }
}

package com.questrail.tso.store;

import com.questrail.tso.api.StoreUnavailableException;

import java.util.Optional;

/**
 * CheckpointStore
 * =============================================================================
 * Contract over a linearizable, versioned key-value backend holding one
 * {@link Checkpoint} per stream.
 *
 * <h2>Binding invariant</h2>
 * {@link #save(String, long, long)} succeeds only if no other save for the same
 * stream has succeeded since {@code expectedVersion} was read. This compare-and-swap
 * is the sole mechanism that prevents two processes from both believing they own a
 * stream. Implementations never perform blind overwrites.
 */
public interface CheckpointStore
{
    /**
     * Version to pass to {@link #save} when {@link #load} found no checkpoint.
     */
    long NO_VERSION = 0L;

    /**
     * Loads the checkpoint of a stream.
     *
     * @return the checkpoint, or empty if the stream was never saved
     * @throws StoreUnavailableException if the backend cannot be reached
     */
    Optional<Checkpoint> load(String streamId);

    /**
     * Compare-and-swap write of a new watermark.
     *
     * @param streamId        stream identifier
     * @param savedPhysical   new watermark
     * @param expectedVersion version last read, or {@link #NO_VERSION}
     * @return the new version
     * @throws VersionConflictException  if another save won since {@code expectedVersion}
     * @throws StoreUnavailableException if the backend cannot be reached
     */
    long save(String streamId, long savedPhysical, long expectedVersion);
}

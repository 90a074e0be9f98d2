package dk.cloudcreate.projections.checkpoint;

import dk.cloudcreate.projections.common.types.CheckpointKey;

import java.util.Optional;

/**
 * Stores the checkpoint (the last successfully processed position) per projection or projection partition.<br>
 * Implementations must guarantee atomic upsert semantics for concurrent writers.<br>
 * All operations may fail with a {@link CheckpointStoreException}
 *
 * @see CheckpointKey
 */
public interface CheckpointStore {
    /**
     * Get the last saved checkpoint
     *
     * @param checkpointKey the checkpoint key
     * @return the last saved position or {@link Optional#empty()} if no checkpoint has been saved
     */
    Optional<Long> getCheckpoint(CheckpointKey checkpointKey);

    /**
     * Save (insert or update) the checkpoint
     *
     * @param checkpointKey the checkpoint key
     * @param position      the position of the last successfully processed event
     */
    void saveCheckpoint(CheckpointKey checkpointKey, long position);

    /**
     * Delete the checkpoint. Deleting a checkpoint that doesn't exist is a no-op
     *
     * @param checkpointKey the checkpoint key
     */
    void resetCheckpoint(CheckpointKey checkpointKey);
}

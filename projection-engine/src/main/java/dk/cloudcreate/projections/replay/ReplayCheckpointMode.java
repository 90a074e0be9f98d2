package dk.cloudcreate.projections.replay;

/**
 * Controls when a replay writes its checkpoint
 */
public enum ReplayCheckpointMode {
    /**
     * Save a checkpoint every {@link ReplayOptions#batchSize} events and once more for a final partial batch
     */
    NORMAL,
    /**
     * Save a single checkpoint when the replay has completed
     */
    FINAL_ONLY,
    /**
     * Never touch the checkpoint. The existing checkpoint isn't reset either
     */
    NONE
}

package dk.cloudcreate.projections.options;

/**
 * Determines where a projection partition starts processing when its partition worker starts
 */
public enum ProjectionStartupMode {
    /**
     * Continue from the last saved checkpoint. If no checkpoint exists, start from position 0
     */
    RESUME,
    /**
     * Delete any existing checkpoint and rebuild the projection from position 0
     */
    REPLAY,
    /**
     * Start without looking up a checkpoint. On a live event bus this means that only events published
     * after the subscription started are processed
     */
    CATCH_UP,
    /**
     * Only process new events, without looking up a checkpoint
     */
    LIVE_ONLY
}

package dk.cloudcreate.projections.options;

/**
 * What to do when a partition worker's queue is full
 */
public enum BackpressureStrategy {
    /**
     * Block the producer until the partition worker has made room in its queue
     */
    BLOCK,
    /**
     * Discard the incoming event
     */
    DROP_NEWEST,
    /**
     * Discard the oldest queued event to make room for the incoming event
     */
    DROP_OLDEST
}

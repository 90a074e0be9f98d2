package dk.cloudcreate.projections.options;

public enum ErrorHandlingStrategy {
    /**
     * Retry the failed event with exponential backoff. When the retries are exhausted
     * the {@link ErrorHandlingOptions#fallbackStrategy} is applied
     */
    RETRY,
    /**
     * Log the failure and continue with the next event. The failed event isn't checkpointed
     */
    SKIP,
    /**
     * Halt the partition. All following events for the partition are discarded until the engine is restarted
     */
    STOP
}

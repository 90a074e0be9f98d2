package dk.cloudcreate.projections.common;

/**
 * Common process life cycle interface for the long running parts of the projection runtime,
 * such as the projection engine and its partition workers
 */
public interface Lifecycle {
    /**
     * Start the processing. This operation must be idempotent, such that duplicate calls
     * to {@link #start()} for an already started process (where {@link #isStarted()} returns true)
     * is ignored
     */
    void start();

    /**
     * Stop the processing. This operation must be idempotent, such that duplicate calls
     * to {@link #stop()} for an already stopped process (where {@link #isStarted()} returns false)
     * is ignored.<br>
     * Implementations are expected to finish the work they have already accepted before returning
     */
    void stop();

    /**
     * Returns true if the process is started and accepting work
     *
     * @return true if the process is started otherwise false
     */
    boolean isStarted();
}

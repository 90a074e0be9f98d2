package dk.cloudcreate.projections.engine;

/**
 * The states of a {@link ProjectionEngine}:<br>
 * <code>IDLE -&gt; RUNNING -&gt; DRAINING -&gt; STOPPED</code>
 */
public enum EngineState {
    /**
     * Created but not started
     */
    IDLE,
    /**
     * Subscribed to the event bus and routing events to the partition workers
     */
    RUNNING,
    /**
     * No longer accepting events. Partition workers are processing the remaining queued events and flushing their checkpoints
     */
    DRAINING,
    /**
     * All partition workers have finished. An engine instance cannot be restarted once it's stopped
     */
    STOPPED
}

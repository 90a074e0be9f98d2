package dk.cloudcreate.projections.handler;

/**
 * A projection handler updates a read model incrementally from the events it receives.<br>
 * All events for a (non-partitioned) projection handler are processed sequentially, in the order they were published.<br>
 * Handlers should be idempotent, since events that haven't been checkpointed may be processed again after a restart.
 *
 * @param <E> the type of event projected
 * @see PartitionedProjectionHandler
 * @see Projection
 */
public interface ProjectionHandler<E> {
    /**
     * Project the event into the read model
     *
     * @param event the event
     */
    void project(E event);
}

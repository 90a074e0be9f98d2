package dk.cloudcreate.projections.registry;

import dk.cloudcreate.projections.handler.*;

/**
 * The handler contract a {@link HandlerRegistration} was registered with
 */
public enum HandlerKind {
    /**
     * {@link ProjectionHandler} - all events are processed sequentially in a single partition
     */
    SEQUENTIAL,
    /**
     * {@link PartitionedProjectionHandler} - events are processed sequentially per partition
     */
    PARTITIONED
}

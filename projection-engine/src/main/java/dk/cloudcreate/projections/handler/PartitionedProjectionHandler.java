package dk.cloudcreate.projections.handler;

/**
 * A projection handler whose events are split into independent partitions (e.g. per customer or per aggregate id).<br>
 * Events within a partition are processed strictly in order, while different partitions may be processed in parallel,
 * bounded by {@link Projection#maxDegreeOfParallelism()}.
 *
 * @param <E> the type of event projected
 */
public interface PartitionedProjectionHandler<E> {
    /**
     * Resolve the partition the event belongs to
     *
     * @param event the event
     * @return the partition key. Must be non-null and non-empty
     */
    String partitionKey(E event);

    /**
     * Project the event into the read model
     *
     * @param event the event
     */
    void project(E event);
}

package dk.cloudcreate.projections.registry;

/**
 * Typed partition key resolution for a partitioned projection handler, created once at registration time
 *
 * @param <E> the type of event
 */
@FunctionalInterface
public interface PartitionKeyResolver<E> {
    String resolvePartitionKey(E event);
}

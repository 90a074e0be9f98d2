package dk.cloudcreate.projections.registry;

/**
 * Typed invocation of a projection handler, created once at registration time
 *
 * @param <E> the type of event
 */
@FunctionalInterface
public interface ProjectionInvoker<E> {
    void invoke(E event);
}

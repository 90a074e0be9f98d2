package dk.cloudcreate.projections.bus;

/**
 * Direct (synchronous) handler of events published on an {@link EventBus}.<br>
 * Direct handlers are called on the publishing thread as part of {@link EventBus#publish(Object)}
 *
 * @param <E> the type of event handled
 */
@FunctionalInterface
public interface EventHandler<E> {
    void handle(E event);
}

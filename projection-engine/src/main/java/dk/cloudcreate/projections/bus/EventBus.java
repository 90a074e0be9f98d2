package dk.cloudcreate.projections.bus;

import reactor.core.Disposable;
import reactor.core.publisher.Flux;

/**
 * In process publish/subscribe event bus.<br>
 * Events are matched against handlers and subscriptions on their exact Java type, i.e. the event's {@link Object#getClass()}
 */
public interface EventBus {
    /**
     * Publish an event.<br>
     * All direct {@link EventHandler}'s registered for the event's type are called synchronously
     * (a failing handler doesn't prevent the remaining handlers from being called), after which the
     * event is offered to every live subscription created using {@link #subscribe(Class)}
     *
     * @param event the event to publish
     * @param <E>   the type of event
     */
    <E> void publish(E event);

    /**
     * Subscribe to the live stream of events of the given type.<br>
     * Only events published after the returned {@link Flux} has been subscribed to will be delivered.
     * The subscription ends when the {@link Disposable} returned from subscribing to the {@link Flux} is disposed
     *
     * @param eventType the type of event to subscribe to
     * @param <E>       the type of event
     * @return the live stream of events
     */
    <E> Flux<E> subscribe(Class<E> eventType);

    <E> EventBus addSyncHandler(Class<E> eventType, EventHandler<E> handler);

    <E> EventBus removeSyncHandler(Class<E> eventType, EventHandler<E> handler);
}

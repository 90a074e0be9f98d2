package dk.cloudcreate.projections.engine;

import dk.cloudcreate.projections.registry.HandlerRegistration;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * A single event routed to a single projection handler, queued in the handler's partition worker
 */
final class WorkItem {
    final HandlerRegistration<?> registration;
    final Object                 event;

    WorkItem(HandlerRegistration<?> registration, Object event) {
        this.registration = requireNonNull(registration, "No registration provided");
        this.event = requireNonNull(event, "No event provided");
    }

    void invoke() {
        registration.invoke(event);
    }

    @Override
    public String toString() {
        return "WorkItem{" +
                "handlerType=" + registration.handlerType.getName() +
                ", eventType=" + event.getClass().getName() +
                '}';
    }
}

package dk.cloudcreate.projections.eventstore;

import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * An event together with the position it was assigned in its stream
 *
 * @param <E> the type of event
 */
public final class StoredEvent<E> {
    public final long position;
    public final E    event;

    public StoredEvent(long position, E event) {
        requireTrue(position >= 0, "position must be >= 0");
        this.position = position;
        this.event = requireNonNull(event, "No event provided");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StoredEvent<?> that = (StoredEvent<?>) o;
        return position == that.position && event.equals(that.event);
    }

    @Override
    public int hashCode() {
        return Objects.hash(position, event);
    }

    @Override
    public String toString() {
        return "StoredEvent{" +
                "position=" + position +
                ", eventType=" + event.getClass().getName() +
                '}';
    }
}

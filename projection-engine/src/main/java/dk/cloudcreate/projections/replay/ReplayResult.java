package dk.cloudcreate.projections.replay;

import java.util.*;

/**
 * Outcome of a {@link ReplayService#replay(String, ReplayOptions)} run
 */
@SuppressWarnings("OptionalUsedAsFieldOrParameterType")
public final class ReplayResult {
    /**
     * The number of events dispatched to the projection's handlers (including events where a handler failed)
     */
    public final long           eventsProcessed;
    /**
     * The number of failed handler invocations. Failures are logged and the replay continues
     */
    public final long           eventsFailed;
    /**
     * The stream position of the last event dispatched
     */
    public final Optional<Long> lastPosition;
    /**
     * The last checkpoint written by the replay
     */
    public final Optional<Long> checkpoint;
    /**
     * False if no {@link dk.cloudcreate.projections.eventstore.EventStore} was available or the replay was interrupted
     */
    public final boolean        completed;

    public ReplayResult(long eventsProcessed, long eventsFailed, Optional<Long> lastPosition, Optional<Long> checkpoint, boolean completed) {
        this.eventsProcessed = eventsProcessed;
        this.eventsFailed = eventsFailed;
        this.lastPosition = lastPosition;
        this.checkpoint = checkpoint;
        this.completed = completed;
    }

    static ReplayResult notStreamed() {
        return new ReplayResult(0, 0, Optional.empty(), Optional.empty(), false);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ReplayResult that = (ReplayResult) o;
        return eventsProcessed == that.eventsProcessed &&
                eventsFailed == that.eventsFailed &&
                completed == that.completed &&
                lastPosition.equals(that.lastPosition) &&
                checkpoint.equals(that.checkpoint);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventsProcessed, eventsFailed, lastPosition, checkpoint, completed);
    }

    @Override
    public String toString() {
        return "ReplayResult{" +
                "eventsProcessed=" + eventsProcessed +
                ", eventsFailed=" + eventsFailed +
                ", lastPosition=" + lastPosition +
                ", checkpoint=" + checkpoint +
                ", completed=" + completed +
                '}';
    }
}

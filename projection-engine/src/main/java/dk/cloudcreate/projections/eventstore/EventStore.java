package dk.cloudcreate.projections.eventstore;

import java.util.Optional;
import java.util.stream.Stream;

/**
 * Append-only store of events organized in named streams.<br>
 * Every event appended to a stream is assigned the next position in that stream, starting from 0.
 * Positions are never reused and are gap free within a stream.
 */
public interface EventStore {
    /**
     * Append an event to the end of a stream. The stream is created if it doesn't exist
     *
     * @param streamName the name of the stream
     * @param event      the event
     * @param <E>        the type of event
     * @return the position assigned to the event
     * @throws IllegalArgumentException if the streamName is null or blank or the event is null
     */
    <E> long append(String streamName, E event);

    /**
     * Read the events of a stream in position order
     *
     * @param streamName   the name of the stream
     * @param fromPosition the position of the first event returned (inclusive)
     * @return the events from <code>fromPosition</code> onwards. An unknown stream yields an empty stream
     */
    Stream<StoredEvent<Object>> read(String streamName, long fromPosition);

    /**
     * Read the events of a stream that are instances of <code>eventType</code> in position order
     *
     * @param eventType    the type of events to return
     * @param streamName   the name of the stream
     * @param fromPosition the position of the first event returned (inclusive)
     * @param <E>          the type of event
     * @return the matching events from <code>fromPosition</code> onwards
     */
    <E> Stream<StoredEvent<E>> read(Class<E> eventType, String streamName, long fromPosition);

    /**
     * @param streamName the name of the stream
     * @return the position of the last event appended to the stream or {@link Optional#empty()} if the stream doesn't exist
     */
    Optional<Long> getStreamPosition(String streamName);
}

package dk.cloudcreate.projections.eventstore;

import org.slf4j.*;

import java.util.*;
import java.util.concurrent.*;
import java.util.stream.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * {@link EventStore} that keeps all events in memory. Intended for tests, samples and replaying projections
 * in a single process. Reads return a snapshot of the stream taken when {@link #read(String, long)} is called.
 */
public class InMemoryEventStore implements EventStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStore.class);

    private final ConcurrentMap<String, EventStream> streams = new ConcurrentHashMap<>();

    @Override
    public <E> long append(String streamName, E event) {
        requireValidStreamName(streamName);
        if (event == null) {
            throw new IllegalArgumentException(msg("[{}] No event provided", streamName));
        }
        var position = streams.computeIfAbsent(streamName, name -> new EventStream()).append(event);
        log.trace("[{}] Appended event of type '{}' at position {}", streamName, event.getClass().getName(), position);
        return position;
    }

    @Override
    public Stream<StoredEvent<Object>> read(String streamName, long fromPosition) {
        return read(Object.class, streamName, fromPosition);
    }

    @Override
    public <E> Stream<StoredEvent<E>> read(Class<E> eventType, String streamName, long fromPosition) {
        requireNonNull(eventType, "No eventType provided");
        requireValidStreamName(streamName);
        var stream = streams.get(streamName);
        if (stream == null) {
            return Stream.empty();
        }
        return stream.snapshotFrom(fromPosition)
                     .stream()
                     .filter(storedEvent -> eventType.isInstance(storedEvent.event))
                     .map(storedEvent -> new StoredEvent<>(storedEvent.position, eventType.cast(storedEvent.event)));
    }

    @Override
    public Optional<Long> getStreamPosition(String streamName) {
        requireValidStreamName(streamName);
        return Optional.ofNullable(streams.get(streamName))
                       .flatMap(EventStream::currentPosition);
    }

    /**
     * Remove all streams
     */
    public void clear() {
        streams.clear();
    }

    public int getTotalEventCount() {
        return streams.values().stream().mapToInt(EventStream::size).sum();
    }

    public int getStreamEventCount(String streamName) {
        requireNonNull(streamName, "No streamName provided");
        return Optional.ofNullable(streams.get(streamName))
                       .map(EventStream::size)
                       .orElse(0);
    }

    private static void requireValidStreamName(String streamName) {
        if (streamName == null || streamName.isBlank()) {
            throw new IllegalArgumentException("streamName must not be null or blank");
        }
    }

    private static final class EventStream {
        private final List<StoredEvent<Object>> events = new ArrayList<>();

        synchronized long append(Object event) {
            var position = events.size();
            events.add(new StoredEvent<>(position, event));
            return position;
        }

        synchronized List<StoredEvent<Object>> snapshotFrom(long fromPosition) {
            if (fromPosition >= events.size()) {
                return List.of();
            }
            return List.copyOf(events.subList((int) Math.max(0, fromPosition), events.size()));
        }

        synchronized Optional<Long> currentPosition() {
            return events.isEmpty() ? Optional.empty() : Optional.of((long) events.size() - 1);
        }

        synchronized int size() {
            return events.size();
        }
    }
}

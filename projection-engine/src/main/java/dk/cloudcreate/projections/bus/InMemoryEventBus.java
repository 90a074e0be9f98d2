package dk.cloudcreate.projections.bus;

import org.slf4j.*;
import reactor.core.publisher.*;

import java.util.*;
import java.util.concurrent.*;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Simple in memory {@link EventBus}.<br>
 * Each subscription created using {@link #subscribe(Class)} has its own bounded buffer. When a subscriber
 * doesn't keep up and the buffer is full, the <b>oldest</b> buffered event is dropped, so that a slow
 * subscriber never blocks the publisher.
 */
public class InMemoryEventBus implements EventBus {
    private static final Logger log                              = LoggerFactory.getLogger(InMemoryEventBus.class);
    public static final  int    DEFAULT_SUBSCRIPTION_BUFFER_SIZE = 100;

    private final String                                                 busName;
    private final int                                                    subscriptionBufferSize;
    private final ConcurrentMap<Class<?>, List<EventHandler<Object>>>    syncHandlers  = new ConcurrentHashMap<>();
    private final ConcurrentMap<Class<?>, List<FluxSink<Object>>>        subscriptions = new ConcurrentHashMap<>();

    public InMemoryEventBus() {
        this("InMemoryEventBus", Optional.empty());
    }

    /**
     * @param busName                the name of the bus (used for logging)
     * @param subscriptionBufferSize the number of events each subscription can buffer before the oldest event is dropped.
     *                               If {@link Optional#empty()} then {@link #DEFAULT_SUBSCRIPTION_BUFFER_SIZE} is used
     */
    @SuppressWarnings("OptionalUsedAsFieldOrParameterType")
    public InMemoryEventBus(String busName, Optional<Integer> subscriptionBufferSize) {
        this.busName = requireNonNull(busName, "No busName provided");
        requireNonNull(subscriptionBufferSize, "No subscriptionBufferSize option provided");
        this.subscriptionBufferSize = subscriptionBufferSize.orElse(DEFAULT_SUBSCRIPTION_BUFFER_SIZE);
        requireTrue(this.subscriptionBufferSize >= 1, "subscriptionBufferSize must be >= 1");
    }

    @Override
    public <E> void publish(E event) {
        requireNonNull(event, "No event provided");
        var eventType = event.getClass();
        log.debug("[{}] Publishing event of type '{}'", busName, eventType.getName());

        var handlers = syncHandlers.getOrDefault(eventType, List.of());
        for (var handler : handlers) {
            try {
                handler.handle(event);
            } catch (Exception e) {
                log.error(msg("[{}] Direct handler {} failed to handle event of type '{}'",
                              busName,
                              handler.getClass().getName(),
                              eventType.getName()), e);
            }
        }

        var sinks = subscriptions.getOrDefault(eventType, List.of());
        if (sinks.isEmpty()) {
            log.trace("[{}] No subscribers for event type '{}'", busName, eventType.getName());
            return;
        }
        sinks.forEach(sink -> sink.next(event));
    }

    @SuppressWarnings("unchecked")
    @Override
    public <E> Flux<E> subscribe(Class<E> eventType) {
        requireNonNull(eventType, "No eventType provided");
        return Flux.<E>create(sink -> {
                       var untypedSink = (FluxSink<Object>) (FluxSink<?>) sink;
                       var sinks       = subscriptions.computeIfAbsent(eventType, type -> new CopyOnWriteArrayList<>());
                       sinks.add(untypedSink);
                       log.debug("[{}] Created subscription for event type '{}'. Number of subscriptions: {}",
                                 busName,
                                 eventType.getName(),
                                 sinks.size());
                       sink.onDispose(() -> {
                           sinks.remove(untypedSink);
                           log.debug("[{}] Subscription for event type '{}' terminated", busName, eventType.getName());
                       });
                   })
                   .onBackpressureBuffer(subscriptionBufferSize,
                                         dropped -> log.debug("[{}] Subscription buffer for event type '{}' is full. Dropped the oldest event",
                                                              busName,
                                                              eventType.getName()),
                                         BufferOverflowStrategy.DROP_OLDEST);
    }

    @SuppressWarnings("unchecked")
    @Override
    public <E> EventBus addSyncHandler(Class<E> eventType, EventHandler<E> handler) {
        requireNonNull(eventType, "No eventType provided");
        requireNonNull(handler, "No handler provided");
        syncHandlers.computeIfAbsent(eventType, type -> new CopyOnWriteArrayList<>())
                    .add((EventHandler<Object>) (EventHandler<?>) handler);
        return this;
    }

    @SuppressWarnings("unchecked")
    @Override
    public <E> EventBus removeSyncHandler(Class<E> eventType, EventHandler<E> handler) {
        requireNonNull(eventType, "No eventType provided");
        requireNonNull(handler, "No handler provided");
        var handlers = syncHandlers.get(eventType);
        if (handlers != null) {
            handlers.remove((EventHandler<Object>) (EventHandler<?>) handler);
        }
        return this;
    }

    int numberOfSubscriptions(Class<?> eventType) {
        return subscriptions.getOrDefault(eventType, List.of()).size();
    }

    @Override
    public String toString() {
        return "InMemoryEventBus{" +
                "busName='" + busName + '\'' +
                ", subscriptionBufferSize=" + subscriptionBufferSize +
                '}';
    }
}

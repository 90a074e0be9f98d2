package dk.cloudcreate.projections.registry;

import dk.cloudcreate.projections.handler.*;
import dk.cloudcreate.projections.options.ProjectionOptions;

import java.util.*;
import java.util.function.Supplier;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Registration of a projection handler for a single event type.<br>
 * A handler class that projects several event types has one registration per event type.<br>
 * The registration is the dispatch table entry for the handler: it knows how to create the handler (using the
 * handler factory supplied at registration time) and how to invoke it with a correctly typed event.
 *
 * @param <E> the type of event
 */
public final class HandlerRegistration<E> {
    /**
     * Partition key used for all events of a {@link HandlerKind#SEQUENTIAL} handler
     */
    public static final String DEFAULT_PARTITION_KEY = "_default";

    public final  Class<E>                          eventType;
    /**
     * The concrete handler class. Used for the default projection name and the {@link Projection} annotation lookup
     */
    public final  Class<?>                          handlerType;
    public final  HandlerKind                       kind;
    /**
     * Options explicitly supplied when registering the handler
     */
    public final  Optional<ProjectionOptions>       options;
    private final ProjectionInvoker<E>              invoker;
    private final Optional<PartitionKeyResolver<E>> partitionKeyResolver;

    @SuppressWarnings("OptionalUsedAsFieldOrParameterType")
    private HandlerRegistration(Class<E> eventType,
                                Class<?> handlerType,
                                HandlerKind kind,
                                Optional<ProjectionOptions> options,
                                ProjectionInvoker<E> invoker,
                                Optional<PartitionKeyResolver<E>> partitionKeyResolver) {
        this.eventType = requireNonNull(eventType, "No eventType provided");
        this.handlerType = requireNonNull(handlerType, "No handlerType provided");
        this.kind = requireNonNull(kind, "No kind provided");
        this.options = requireNonNull(options, "No options provided");
        this.invoker = requireNonNull(invoker, "No invoker provided");
        this.partitionKeyResolver = requireNonNull(partitionKeyResolver, "No partitionKeyResolver provided");
    }

    /**
     * Create a registration for a {@link ProjectionHandler}
     *
     * @param eventType      the type of event the handler projects
     * @param handlerType    the concrete handler class
     * @param handlerFactory creates the handler instance used for each invocation (may return the same instance every time)
     * @param options        the options explicitly supplied or {@link Optional#empty()}
     * @param <E>            the type of event
     * @return the registration
     */
    @SuppressWarnings("OptionalUsedAsFieldOrParameterType")
    public static <E> HandlerRegistration<E> forProjection(Class<E> eventType,
                                                           Class<?> handlerType,
                                                           Supplier<? extends ProjectionHandler<? super E>> handlerFactory,
                                                           Optional<ProjectionOptions> options) {
        requireNonNull(handlerFactory, "No handlerFactory provided");
        return new HandlerRegistration<E>(eventType,
                                         handlerType,
                                         HandlerKind.SEQUENTIAL,
                                         options,
                                         event -> handlerFactory.get().project(event),
                                         Optional.empty());
    }

    /**
     * Create a registration for a {@link PartitionedProjectionHandler}
     *
     * @param eventType      the type of event the handler projects
     * @param handlerType    the concrete handler class
     * @param handlerFactory creates the handler instance used for each invocation (may return the same instance every time)
     * @param options        the options explicitly supplied or {@link Optional#empty()}
     * @param <E>            the type of event
     * @return the registration
     */
    @SuppressWarnings("OptionalUsedAsFieldOrParameterType")
    public static <E> HandlerRegistration<E> forPartitionedProjection(Class<E> eventType,
                                                                      Class<?> handlerType,
                                                                      Supplier<? extends PartitionedProjectionHandler<? super E>> handlerFactory,
                                                                      Optional<ProjectionOptions> options) {
        requireNonNull(handlerFactory, "No handlerFactory provided");
        return new HandlerRegistration<E>(eventType,
                                         handlerType,
                                         HandlerKind.PARTITIONED,
                                         options,
                                         event -> handlerFactory.get().project(event),
                                         Optional.<PartitionKeyResolver<E>>of(event -> handlerFactory.get().partitionKey(event)));
    }

    public boolean isPartitioned() {
        return kind == HandlerKind.PARTITIONED;
    }

    /**
     * Resolve the partition the event belongs to
     *
     * @param event the event
     * @return {@link #DEFAULT_PARTITION_KEY} for {@link HandlerKind#SEQUENTIAL} handlers, otherwise the
     * partition key returned by the {@link PartitionedProjectionHandler}
     * @throws InvalidPartitionKeyException if the partitioned handler returned a null or empty partition key
     */
    public String resolvePartitionKey(Object event) {
        if (partitionKeyResolver.isEmpty()) {
            return DEFAULT_PARTITION_KEY;
        }
        var partitionKey = partitionKeyResolver.get().resolvePartitionKey(eventType.cast(event));
        if (partitionKey == null || partitionKey.isEmpty()) {
            throw new InvalidPartitionKeyException(msg("Projection handler '{}' returned an invalid partition key '{}' for event type '{}'. Partition keys must be non-null, non-empty strings",
                                                       handlerType.getName(),
                                                       partitionKey,
                                                       eventType.getName()));
        }
        return partitionKey;
    }

    /**
     * Invoke the projection handler
     *
     * @param event the event, which must be an instance of {@link #eventType}
     */
    public void invoke(Object event) {
        invoker.invoke(eventType.cast(event));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        HandlerRegistration<?> that = (HandlerRegistration<?>) o;
        return eventType.equals(that.eventType) && handlerType.equals(that.handlerType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventType, handlerType);
    }

    @Override
    public String toString() {
        return "HandlerRegistration{" +
                "eventType=" + eventType.getName() +
                ", handlerType=" + handlerType.getName() +
                ", kind=" + kind +
                ", options=" + options +
                '}';
    }
}

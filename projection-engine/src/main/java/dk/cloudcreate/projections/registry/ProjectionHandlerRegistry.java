package dk.cloudcreate.projections.registry;

import dk.cloudcreate.projections.handler.*;
import dk.cloudcreate.projections.options.ProjectionOptions;
import org.slf4j.*;

import java.util.*;
import java.util.concurrent.*;
import java.util.function.Supplier;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Registry of the projection handlers and the event types they project.<br>
 * The registry is populated once while the application is being composed (before the projection engine is started)
 * and is only read afterwards. Registration is additive and idempotent: registering the same handler class for the
 * same event type more than once is ignored.<br>
 * The same registry instance must be supplied to the projection engine and the projection rebuilder.
 */
public class ProjectionHandlerRegistry {
    private static final Logger log = LoggerFactory.getLogger(ProjectionHandlerRegistry.class);

    /**
     * Key: event type<br>
     * Value: the handler registrations for the event type, in registration order
     */
    private final ConcurrentMap<Class<?>, List<HandlerRegistration<?>>> handlers          = new ConcurrentHashMap<>();
    /**
     * Key: projection name<br>
     * Value: the options explicitly registered for the projection
     */
    private final ConcurrentMap<String, ProjectionOptions>              projectionOptions = new ConcurrentHashMap<>();

    /**
     * Register a handler
     *
     * @param registration the registration
     * @return this registry
     * @throws IllegalArgumentException if the resolved projection name contains {@link dk.cloudcreate.projections.common.types.CheckpointKey#SEPARATOR}
     */
    public ProjectionHandlerRegistry register(HandlerRegistration<?> registration) {
        requireNonNull(registration, "No registration provided");
        var projectionName = ProjectionOptionsResolver.projectionNameFor(registration.handlerType, registration.options);
        handlers.compute(registration.eventType, (eventType, registrations) -> {
            var updatedRegistrations = registrations != null ? registrations : new CopyOnWriteArrayList<HandlerRegistration<?>>();
            if (updatedRegistrations.contains(registration)) {
                log.debug("Ignoring duplicate registration of handler '{}' for event type '{}'",
                          registration.handlerType.getName(),
                          eventType.getName());
            } else {
                updatedRegistrations.add(registration);
                log.debug("Registered {} handler '{}' for event type '{}'",
                          registration.kind,
                          registration.handlerType.getName(),
                          eventType.getName());
            }
            return updatedRegistrations;
        });

        registration.options.ifPresent(options -> projectionOptions.put(projectionName, options.withProjectionName(projectionName)));
        return this;
    }

    public <E> ProjectionHandlerRegistry registerProjection(Class<E> eventType, ProjectionHandler<? super E> handler) {
        requireNonNull(handler, "No handler provided");
        return register(HandlerRegistration.forProjection(eventType, handler.getClass(), () -> handler, Optional.empty()));
    }

    public <E> ProjectionHandlerRegistry registerProjection(Class<E> eventType, ProjectionHandler<? super E> handler, ProjectionOptions options) {
        requireNonNull(handler, "No handler provided");
        requireNonNull(options, "No options provided");
        return register(HandlerRegistration.forProjection(eventType, handler.getClass(), () -> handler, Optional.of(options)));
    }

    /**
     * Register a {@link ProjectionHandler} where a new handler instance is created for every event
     *
     * @param eventType      the type of event projected
     * @param handlerType    the concrete handler class
     * @param handlerFactory the handler factory
     * @param options        the explicit options or {@link Optional#empty()}
     * @param <E>            the type of event
     * @return this registry
     */
    @SuppressWarnings("OptionalUsedAsFieldOrParameterType")
    public <E> ProjectionHandlerRegistry registerProjection(Class<E> eventType,
                                                            Class<?> handlerType,
                                                            Supplier<? extends ProjectionHandler<? super E>> handlerFactory,
                                                            Optional<ProjectionOptions> options) {
        return register(HandlerRegistration.forProjection(eventType, handlerType, handlerFactory, options));
    }

    public <E> ProjectionHandlerRegistry registerPartitionedProjection(Class<E> eventType, PartitionedProjectionHandler<? super E> handler) {
        requireNonNull(handler, "No handler provided");
        return register(HandlerRegistration.forPartitionedProjection(eventType, handler.getClass(), () -> handler, Optional.empty()));
    }

    public <E> ProjectionHandlerRegistry registerPartitionedProjection(Class<E> eventType, PartitionedProjectionHandler<? super E> handler, ProjectionOptions options) {
        requireNonNull(handler, "No handler provided");
        requireNonNull(options, "No options provided");
        return register(HandlerRegistration.forPartitionedProjection(eventType, handler.getClass(), () -> handler, Optional.of(options)));
    }

    /**
     * Register a {@link PartitionedProjectionHandler} where a new handler instance is created for every invocation
     *
     * @param eventType      the type of event projected
     * @param handlerType    the concrete handler class
     * @param handlerFactory the handler factory
     * @param options        the explicit options or {@link Optional#empty()}
     * @param <E>            the type of event
     * @return this registry
     */
    @SuppressWarnings("OptionalUsedAsFieldOrParameterType")
    public <E> ProjectionHandlerRegistry registerPartitionedProjection(Class<E> eventType,
                                                                       Class<?> handlerType,
                                                                       Supplier<? extends PartitionedProjectionHandler<? super E>> handlerFactory,
                                                                       Optional<ProjectionOptions> options) {
        return register(HandlerRegistration.forPartitionedProjection(eventType, handlerType, handlerFactory, options));
    }

    /**
     * @return the distinct event types that have at least one handler registered
     */
    public Set<Class<?>> getEventTypes() {
        return Set.copyOf(handlers.keySet());
    }

    /**
     * @param eventType the event type
     * @return the handler registrations for the event type (empty if no handlers are registered)
     */
    public List<HandlerRegistration<?>> getHandlers(Class<?> eventType) {
        requireNonNull(eventType, "No eventType provided");
        return List.copyOf(handlers.getOrDefault(eventType, List.of()));
    }

    public Optional<HandlerRegistration<?>> getHandlerRegistration(Class<?> eventType, Class<?> handlerType) {
        requireNonNull(eventType, "No eventType provided");
        requireNonNull(handlerType, "No handlerType provided");
        return handlers.getOrDefault(eventType, List.of())
                       .stream()
                       .filter(registration -> registration.handlerType.equals(handlerType))
                       .findFirst();
    }

    /**
     * @return all registrations across all event types
     */
    public List<HandlerRegistration<?>> getAllRegistrations() {
        var allRegistrations = new ArrayList<HandlerRegistration<?>>();
        handlers.values().forEach(allRegistrations::addAll);
        return allRegistrations;
    }

    /**
     * Get the options that were explicitly registered for a projection
     *
     * @param projectionName the name of the projection
     * @return the registered options or {@link Optional#empty()}
     */
    public Optional<ProjectionOptions> getProjectionOptions(String projectionName) {
        requireNonNull(projectionName, "No projectionName provided");
        return Optional.ofNullable(projectionOptions.get(projectionName));
    }
}

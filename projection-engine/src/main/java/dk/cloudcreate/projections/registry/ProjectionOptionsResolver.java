package dk.cloudcreate.projections.registry;

import dk.cloudcreate.projections.common.types.CheckpointKey;
import dk.cloudcreate.projections.handler.Projection;
import dk.cloudcreate.projections.options.*;

import java.util.*;
import java.util.concurrent.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Resolves the effective {@link ProjectionOptions} for a {@link HandlerRegistration} using the following precedence:
 * <ol>
 *     <li>The options supplied together with the registration</li>
 *     <li>Options registered in the {@link ProjectionHandlerRegistry} for the projection name</li>
 *     <li>The {@link Projection} annotation on the concrete handler class</li>
 *     <li>{@link ProjectionOptions#defaults()}</li>
 * </ol>
 * The resolved options always carry a projection name. If no name has been specified explicitly or using the
 * {@link Projection} annotation, the simple name of the concrete handler class is used.<br>
 * Resolved options are cached per registration, since the registry doesn't change after the engine has started.
 */
public class ProjectionOptionsResolver {
    private final ProjectionHandlerRegistry                                 registry;
    private final ConcurrentMap<HandlerRegistration<?>, ProjectionOptions> resolvedOptions = new ConcurrentHashMap<>();

    public ProjectionOptionsResolver(ProjectionHandlerRegistry registry) {
        this.registry = requireNonNull(registry, "No registry provided");
    }

    /**
     * Resolve the effective options for the registration
     *
     * @param registration the handler registration
     * @return the resolved options, which always has a projection name
     */
    public ProjectionOptions resolve(HandlerRegistration<?> registration) {
        requireNonNull(registration, "No registration provided");
        return resolvedOptions.computeIfAbsent(registration, this::resolveOptions);
    }

    /**
     * Resolve the projection name for the registration
     *
     * @param registration the handler registration
     * @return the projection name
     */
    public String resolveProjectionName(HandlerRegistration<?> registration) {
        return resolve(registration).projectionName;
    }

    private ProjectionOptions resolveOptions(HandlerRegistration<?> registration) {
        var annotation     = Optional.ofNullable(registration.handlerType.getAnnotation(Projection.class));
        var projectionName = projectionNameFor(registration.handlerType, registration.options);

        if (registration.options.isPresent()) {
            return registration.options.get().withProjectionName(projectionName);
        }
        var registeredOptions = registry.getProjectionOptions(projectionName);
        if (registeredOptions.isPresent()) {
            return registeredOptions.get();
        }
        return annotation.map(projection -> fromAnnotation(projection, projectionName))
                         .orElseGet(() -> ProjectionOptions.defaults().withProjectionName(projectionName));
    }

    /**
     * Resolve the projection name: the name in the explicitly supplied options, then the {@link Projection#projectionName()}
     * and finally the {@link #defaultProjectionName(Class)}
     *
     * @param handlerType the concrete handler class
     * @param options     the explicitly supplied options
     * @return the projection name
     * @throws IllegalArgumentException if the resolved name contains {@link CheckpointKey#SEPARATOR}
     */
    @SuppressWarnings("OptionalUsedAsFieldOrParameterType")
    public static String projectionNameFor(Class<?> handlerType, Optional<ProjectionOptions> options) {
        requireNonNull(handlerType, "No handlerType provided");
        requireNonNull(options, "No options provided");
        if (options.isPresent() && options.get().hasProjectionName()) {
            return options.get().projectionName;
        }
        var projectionName = Optional.ofNullable(handlerType.getAnnotation(Projection.class))
                                     .map(Projection::projectionName)
                                     .filter(name -> !name.isBlank())
                                     .orElseGet(() -> defaultProjectionName(handlerType));
        CheckpointKey.requireValidProjectionName(projectionName);
        return projectionName;
    }

    private static ProjectionOptions fromAnnotation(Projection projection, String projectionName) {
        return ProjectionOptions.builder()
                                .projectionName(projectionName)
                                .maxDegreeOfParallelism(projection.maxDegreeOfParallelism())
                                .checkpointBatchSize(projection.checkpointBatchSize())
                                .startupMode(projection.startupMode())
                                .queueCapacity(projection.queueCapacity())
                                .backpressureStrategy(projection.backpressureStrategy())
                                .build();
    }

    /**
     * The projection name used when no name has been specified
     *
     * @param handlerType the concrete handler class
     * @return the simple name of the handler class (or the fully qualified name for anonymous classes)
     */
    public static String defaultProjectionName(Class<?> handlerType) {
        requireNonNull(handlerType, "No handlerType provided");
        var simpleName = handlerType.getSimpleName();
        return simpleName.isEmpty() ? handlerType.getName() : simpleName;
    }
}

package dk.cloudcreate.projections.engine;

import dk.cloudcreate.essentials.shared.concurrent.ThreadFactoryBuilder;
import dk.cloudcreate.projections.bus.EventBus;
import dk.cloudcreate.projections.checkpoint.CheckpointStore;
import dk.cloudcreate.projections.common.types.CheckpointKey;
import dk.cloudcreate.projections.monitor.ProjectionMonitor;
import dk.cloudcreate.projections.options.ProjectionOptions;
import dk.cloudcreate.projections.registry.*;
import org.slf4j.*;
import reactor.core.*;
import reactor.core.scheduler.*;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicReference;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Default {@link ProjectionEngine}.<br>
 * For every event type in the {@link ProjectionHandlerRegistry} the engine subscribes to the {@link EventBus}
 * and consumes the live stream on a dedicated stream pump thread. Every received event is routed to every handler
 * registered for the event type by enqueuing a {@link WorkItem} in the handler's {@link PartitionWorker}.
 * Partition workers are created lazily on the first event for a <code>(projection, partition)</code> and live
 * until the engine is stopped.<br>
 * Checkpoint keys:
 * <ul>
 *     <li>Non-partitioned handlers: the bare projection name</li>
 *     <li>Partitioned handlers: <code>{projectionName}:{partitionKey}</code></li>
 * </ul>
 */
public class DefaultProjectionEngine implements ProjectionEngine {
    private static final Logger   log                      = LoggerFactory.getLogger(DefaultProjectionEngine.class);
    public static final  Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

    private final ProjectionHandlerRegistry   registry;
    private final ProjectionOptionsResolver   optionsResolver;
    private final EventBus                    eventBus;
    private final CheckpointStore             checkpointStore;
    private final Optional<ProjectionMonitor> monitor;
    private final Duration                    shutdownTimeout;

    private final AtomicReference<EngineState> state       = new AtomicReference<>(EngineState.IDLE);
    private final CompletableFuture<Void>      termination = new CompletableFuture<>();
    private final ConcurrentMap<PartitionWorkerKey, PartitionWorker> workers               = new ConcurrentHashMap<>();
    /**
     * Key: projection name<br>
     * Value: the semaphore bounding the concurrent handler invocations across all partitions of the projection
     */
    private final ConcurrentMap<String, Semaphore>                   parallelismSemaphores = new ConcurrentHashMap<>();

    private ExecutorService      streamPumpExecutor;
    private ExecutorService      workerExecutor;
    private Disposable.Composite subscriptions;

    public DefaultProjectionEngine(ProjectionHandlerRegistry registry,
                                   EventBus eventBus,
                                   CheckpointStore checkpointStore) {
        this(registry, eventBus, checkpointStore, Optional.empty(), Optional.empty());
    }

    /**
     * @param registry        the registry containing the projection handlers
     * @param eventBus        the event bus the engine subscribes to
     * @param checkpointStore the store for the partition checkpoints
     * @param monitor         optional monitor receiving the runtime measurements
     * @param shutdownTimeout the maximum time {@link #stop()} waits for the partition workers to drain.
     *                        If {@link Optional#empty()} then {@link #DEFAULT_SHUTDOWN_TIMEOUT} is used
     */
    @SuppressWarnings("OptionalUsedAsFieldOrParameterType")
    public DefaultProjectionEngine(ProjectionHandlerRegistry registry,
                                   EventBus eventBus,
                                   CheckpointStore checkpointStore,
                                   Optional<ProjectionMonitor> monitor,
                                   Optional<Duration> shutdownTimeout) {
        this.registry = requireNonNull(registry, "No registry provided");
        this.eventBus = requireNonNull(eventBus, "No eventBus provided");
        this.checkpointStore = requireNonNull(checkpointStore, "No checkpointStore provided");
        this.monitor = requireNonNull(monitor, "No monitor option provided");
        this.shutdownTimeout = requireNonNull(shutdownTimeout, "No shutdownTimeout option provided").orElse(DEFAULT_SHUTDOWN_TIMEOUT);
        this.optionsResolver = new ProjectionOptionsResolver(registry);
    }

    @Override
    public void start() {
        if (!state.compareAndSet(EngineState.IDLE, EngineState.RUNNING)) {
            log.debug("Projection engine was already started. State: {}", state.get());
            return;
        }

        var eventTypes = registry.getEventTypes();
        if (eventTypes.isEmpty()) {
            log.info("No projection handlers registered. The projection engine has nothing to do");
            state.set(EngineState.STOPPED);
            termination.complete(null);
            return;
        }

        log.info("Starting projection engine for {} event type(s): {}", eventTypes.size(), eventTypes);
        streamPumpExecutor = Executors.newFixedThreadPool(eventTypes.size(),
                                                          ThreadFactoryBuilder.builder()
                                                                              .nameFormat("Projection-StreamPump-%d")
                                                                              .daemon(true)
                                                                              .build());
        workerExecutor = Executors.newCachedThreadPool(ThreadFactoryBuilder.builder()
                                                                           .nameFormat("Projection-PartitionWorker-%d")
                                                                           .daemon(true)
                                                                           .build());
        var streamPumpScheduler = Schedulers.fromExecutorService(streamPumpExecutor, "Projection-StreamPump");
        subscriptions = Disposables.composite();
        eventTypes.forEach(eventType -> subscriptions.add(subscribe(eventType, streamPumpScheduler)));
        log.info("Started projection engine");
    }

    private Disposable subscribe(Class<?> eventType, Scheduler streamPumpScheduler) {
        log.debug("Subscribing to event type '{}'", eventType.getName());
        return eventBus.subscribe(eventType)
                       .publishOn(streamPumpScheduler, 1)
                       .subscribe(this::route,
                                  error -> onSubscriptionError(eventType, error),
                                  () -> log.debug("Subscription for event type '{}' completed", eventType.getName()));
    }

    /**
     * Route the event to every handler registered for the event's type. A routing failure only affects the
     * handler it occurred for. Only fatal errors (as defined by {@link Exceptions#throwIfFatal(Throwable)})
     * escape and end the subscription
     */
    private void route(Object event) {
        var eventType = event.getClass();
        for (var registration : registry.getHandlers(eventType)) {
            try {
                var options        = optionsResolver.resolve(registration);
                var partitionKey   = registration.resolvePartitionKey(event);
                var worker         = getOrCreateWorker(registration, options, partitionKey);
                log.trace("[{}:{}] Routing event of type '{}'", worker.projectionName, partitionKey, eventType.getName());
                worker.enqueue(new WorkItem(registration, event));
            } catch (Throwable e) {
                Exceptions.throwIfFatal(e);
                log.error(msg("Failed to route event of type '{}' to handler '{}'",
                              eventType.getName(),
                              registration.handlerType.getName()), e);
            }
        }
    }

    private PartitionWorker getOrCreateWorker(HandlerRegistration<?> registration, ProjectionOptions options, String partitionKey) {
        var projectionName = options.projectionName;
        return workers.computeIfAbsent(new PartitionWorkerKey(projectionName, partitionKey), workerKey -> {
            var checkpointKey = registration.isPartitioned() ?
                                CheckpointKey.forPartition(projectionName, partitionKey) :
                                CheckpointKey.forProjection(projectionName);
            var semaphore = parallelismSemaphores.computeIfAbsent(projectionName,
                                                                  name -> new Semaphore(options.effectiveMaxDegreeOfParallelism()));
            var worker = new PartitionWorker(projectionName,
                                             partitionKey,
                                             checkpointKey,
                                             options,
                                             semaphore,
                                             checkpointStore,
                                             monitor);
            log.debug("[{}:{}] Creating partition worker with checkpoint key '{}' and options {}", projectionName, partitionKey, checkpointKey, options);
            workerExecutor.execute(worker);
            var workerCount = numberOfWorkers(projectionName) + 1;
            monitor.ifPresent(m -> {
                try {
                    m.recordWorkerCount(projectionName, workerCount);
                } catch (RuntimeException e) {
                    log.warn(msg("[{}] Projection monitor '{}' failed to record the worker count", projectionName, m.getClass().getName()), e);
                }
            });
            return worker;
        });
    }

    private int numberOfWorkers(String projectionName) {
        return (int) workers.values()
                            .stream()
                            .filter(worker -> worker.projectionName.equals(projectionName))
                            .count();
    }

    private void onSubscriptionError(Class<?> eventType, Throwable error) {
        log.error(msg("Subscription for event type '{}' failed. Shutting down the projection engine", eventType.getName()), error);
        var cause = new ProjectionEngineException(msg("Subscription for event type '{}' failed", eventType.getName()), error);
        // The subscription callback runs on a stream pump thread, which is shut down as part of draining
        var shutdownThread = ThreadFactoryBuilder.builder()
                                                 .nameFormat("Projection-Shutdown-%d")
                                                 .daemon(false)
                                                 .build()
                                                 .newThread(() -> shutdown(Optional.of(cause)));
        shutdownThread.start();
    }

    @Override
    public void stop() {
        shutdown(Optional.empty());
        // Wait for a concurrent shutdown (e.g. after a subscription error) to finish. The outcome is reported through termination()
        termination.handle((result, error) -> null).join();
    }

    @SuppressWarnings("OptionalUsedAsFieldOrParameterType")
    private void shutdown(Optional<ProjectionEngineException> failure) {
        if (state.compareAndSet(EngineState.IDLE, EngineState.STOPPED)) {
            log.info("Projection engine stopped before it was started");
            termination.complete(null);
            return;
        }
        if (!state.compareAndSet(EngineState.RUNNING, EngineState.DRAINING)) {
            log.debug("Projection engine is already {}", state.get());
            return;
        }

        log.info("Stopping projection engine. Draining {} partition worker(s)", workers.size());
        try {
            subscriptions.dispose();
            awaitExecutorShutdown(streamPumpExecutor, "stream pumps");

            workers.values().forEach(PartitionWorker::close);
            var deadline = System.nanoTime() + shutdownTimeout.toNanos();
            for (var worker : workers.values()) {
                var remaining = Duration.ofNanos(Math.max(0, deadline - System.nanoTime()));
                if (!worker.awaitTermination(remaining)) {
                    log.warn("[{}:{}] Partition worker didn't finish draining within {}. {} event(s) remain queued",
                             worker.projectionName,
                             worker.partitionKey,
                             shutdownTimeout,
                             worker.queueSize());
                }
            }
            awaitExecutorShutdown(workerExecutor, "partition workers");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while draining the projection engine");
            streamPumpExecutor.shutdownNow();
            workerExecutor.shutdownNow();
        } finally {
            parallelismSemaphores.clear();
            state.set(EngineState.STOPPED);
            failure.ifPresentOrElse(termination::completeExceptionally,
                                    () -> termination.complete(null));
            log.info("Stopped projection engine");
        }
    }

    private void awaitExecutorShutdown(ExecutorService executor, String description) throws InterruptedException {
        executor.shutdown();
        if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
            log.warn("The {} didn't terminate within {}. Forcing shutdown", description, shutdownTimeout);
            executor.shutdownNow();
        }
    }

    @Override
    public boolean isStarted() {
        return state.get() == EngineState.RUNNING;
    }

    @Override
    public EngineState state() {
        return state.get();
    }

    @Override
    public CompletableFuture<Void> termination() {
        return termination;
    }

    /**
     * @return the position of the partition worker or {@link Optional#empty()} if the worker doesn't exist
     */
    Optional<Long> partitionPosition(String projectionName, String partitionKey) {
        return Optional.ofNullable(workers.get(new PartitionWorkerKey(projectionName, partitionKey)))
                       .map(PartitionWorker::position);
    }

    /**
     * @return the number of partition workers created for the projection
     */
    int numberOfPartitionWorkers(String projectionName) {
        return numberOfWorkers(projectionName);
    }
}

package dk.cloudcreate.projections.replay;

import dk.cloudcreate.projections.checkpoint.CheckpointStore;
import dk.cloudcreate.projections.common.types.CheckpointKey;
import dk.cloudcreate.projections.eventstore.*;
import dk.cloudcreate.projections.monitor.ProjectionMonitor;
import dk.cloudcreate.projections.registry.*;
import org.slf4j.*;
import reactor.core.Exceptions;

import java.util.*;
import java.util.function.Consumer;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Default {@link ReplayService}.<br>
 * Events are read from the {@link EventStore} stream named after the projection and dispatched in stream position order
 * to every registration of the projection whose event type matches. A failing handler is logged and the replay continues
 * with the next handler and event.<br>
 * Checkpoints use the same convention as the projection engine: the saved value is the position of the next event to
 * process, i.e. the position of the last replayed event + 1. The checkpoint key is the projection name, or
 * <code>projectionName:partition</code> when {@link ReplayOptions#partition} is specified.
 */
public class DefaultReplayService implements ReplayService {
    private static final Logger log = LoggerFactory.getLogger(DefaultReplayService.class);

    private final ProjectionHandlerRegistry   registry;
    private final ProjectionOptionsResolver   optionsResolver;
    private final CheckpointStore             checkpointStore;
    private final Optional<EventStore>        eventStore;
    private final Optional<ProjectionMonitor> monitor;

    /**
     * @param registry        the handler registry
     * @param checkpointStore the checkpoint store shared with the projection engine
     * @param eventStore      the event store the events are replayed from. If {@link Optional#empty()} a replay only
     *                        validates its options and prepares the checkpoint
     * @param monitor         the optional monitor that receives lag, failure and checkpoint metrics
     */
    @SuppressWarnings("OptionalUsedAsFieldOrParameterType")
    public DefaultReplayService(ProjectionHandlerRegistry registry,
                                CheckpointStore checkpointStore,
                                Optional<EventStore> eventStore,
                                Optional<ProjectionMonitor> monitor) {
        this.registry = requireNonNull(registry, "No registry provided");
        this.checkpointStore = requireNonNull(checkpointStore, "No checkpointStore provided");
        this.eventStore = requireNonNull(eventStore, "No eventStore option provided");
        this.monitor = requireNonNull(monitor, "No monitor option provided");
        this.optionsResolver = new ProjectionOptionsResolver(registry);
    }

    @Override
    public ReplayResult replay(String projectionName, ReplayOptions options) {
        if (projectionName == null || projectionName.isBlank()) {
            throw new IllegalArgumentException("projectionName must not be null or blank");
        }
        requireNonNull(options, "No options provided");
        log.info("[{}] Starting replay with {}", projectionName, options);

        var registrations = registrationsFor(projectionName);
        var checkpointKey = options.partition.map(partition -> CheckpointKey.forPartition(projectionName, partition))
                                             .orElseGet(() -> CheckpointKey.forProjection(projectionName));
        var startPosition = resolveStartPosition(checkpointKey, options);

        if (!options.fromCheckpoint && options.writesCheckpoints()) {
            log.info("[{}] Resetting checkpoint before replay", checkpointKey);
            checkpointStore.resetCheckpoint(checkpointKey);
        }
        log.info("[{}] Replaying events from position {} to {}",
                 checkpointKey,
                 startPosition,
                 options.toPosition.map(position -> "position " + position).orElse("the end of the stream"));
        if (options.dryRun) {
            log.warn("[{}] Replay is a dry run. No checkpoints will be written", checkpointKey);
        } else if (options.checkpointMode != ReplayCheckpointMode.NORMAL) {
            log.info("[{}] Replay uses checkpoint mode {}", checkpointKey, options.checkpointMode);
        }

        if (eventStore.isEmpty()) {
            log.warn("[{}] No EventStore is configured. The replay options were validated but no events can be replayed. " +
                             "Restart the projection engine with startup mode REPLAY to rebuild from live events instead",
                     checkpointKey);
            return ReplayResult.notStreamed();
        }

        var batchSize = options.batchSize.orElseGet(() -> optionsResolver.resolve(registrations.get(0)).checkpointBatchSize);
        var replay    = new Replay(projectionName, checkpointKey, registrations, options, batchSize);
        var result    = replay.run(eventStore.get(), startPosition);
        log.info("[{}] Replay {} after {} event(s) with {} failure(s). {}",
                 checkpointKey,
                 result.completed ? "completed" : "was interrupted",
                 result.eventsProcessed,
                 result.eventsFailed,
                 result.checkpoint.map(position -> "Checkpoint is at position " + position).orElse("No checkpoint was written"));
        return result;
    }

    private List<HandlerRegistration<?>> registrationsFor(String projectionName) {
        var registrationsPerProjection = registry.getAllRegistrations()
                                                 .stream()
                                                 .collect(Collectors.groupingBy(optionsResolver::resolveProjectionName,
                                                                                TreeMap::new,
                                                                                Collectors.toList()));
        var registrations = registrationsPerProjection.get(projectionName);
        if (registrations == null) {
            var registeredProjections = new ArrayList<>(registrationsPerProjection.keySet());
            throw new ProjectionReplayException(msg("Projection '{}' is not registered. Registered projections: {}",
                                                    projectionName,
                                                    registeredProjections),
                                                projectionName,
                                                registeredProjections);
        }
        return registrations;
    }

    private long resolveStartPosition(CheckpointKey checkpointKey, ReplayOptions options) {
        if (options.fromPosition.isPresent()) {
            return options.fromPosition.get();
        }
        if (options.fromCheckpoint) {
            var checkpoint = checkpointStore.getCheckpoint(checkpointKey).orElse(0L);
            log.info("[{}] Replay resumes from checkpoint position {}", checkpointKey, checkpoint);
            return checkpoint;
        }
        return 0;
    }

    private void recordMetric(Consumer<ProjectionMonitor> metric) {
        monitor.ifPresent(projectionMonitor -> {
            try {
                metric.accept(projectionMonitor);
            } catch (RuntimeException e) {
                log.warn(msg("Projection monitor '{}' failed to record a replay metric", projectionMonitor.getClass().getName()), e);
            }
        });
    }

    /**
     * State of a single replay run
     */
    @SuppressWarnings("OptionalUsedAsFieldOrParameterType")
    private class Replay {
        private final String                        projectionName;
        private final CheckpointKey                 checkpointKey;
        private final List<HandlerRegistration<?>> registrations;
        private final ReplayOptions                 options;
        private final int                           batchSize;
        private final String                        partitionKey;

        private long           eventsProcessed;
        private long           eventsFailed;
        private Optional<Long> lastPosition = Optional.empty();
        private Optional<Long> checkpoint   = Optional.empty();

        private Replay(String projectionName,
                       CheckpointKey checkpointKey,
                       List<HandlerRegistration<?>> registrations,
                       ReplayOptions options,
                       int batchSize) {
            this.projectionName = projectionName;
            this.checkpointKey = checkpointKey;
            this.registrations = registrations;
            this.options = options;
            this.batchSize = batchSize;
            this.partitionKey = options.partition.orElse(HandlerRegistration.DEFAULT_PARTITION_KEY);
        }

        ReplayResult run(EventStore eventStore, long startPosition) {
            var interrupted = false;
            try (var events = eventStore.read(projectionName, startPosition)) {
                var iterator = events.iterator();
                while (iterator.hasNext()) {
                    if (Thread.currentThread().isInterrupted()) {
                        log.warn("[{}] Replay was interrupted after {} event(s)", checkpointKey, eventsProcessed);
                        interrupted = true;
                        break;
                    }
                    var storedEvent = iterator.next();
                    if (options.toPosition.isPresent() && storedEvent.position > options.toPosition.get()) {
                        log.debug("[{}] Reached toPosition {}", checkpointKey, options.toPosition.get());
                        break;
                    }
                    if (replayEvent(storedEvent) &&
                            options.checkpointMode == ReplayCheckpointMode.NORMAL &&
                            eventsProcessed % batchSize == 0) {
                        saveCheckpoint(eventStore);
                    }
                }
            }

            var partialBatch = options.checkpointMode == ReplayCheckpointMode.NORMAL && eventsProcessed % batchSize != 0;
            var finalOnly    = options.checkpointMode == ReplayCheckpointMode.FINAL_ONLY && !interrupted;
            if (partialBatch || finalOnly) {
                saveCheckpoint(eventStore);
            }
            recordLag(eventStore);
            return new ReplayResult(eventsProcessed, eventsFailed, lastPosition, checkpoint, !interrupted);
        }

        /**
         * @return true if the event was dispatched to the projection's handlers
         */
        private boolean replayEvent(StoredEvent<Object> storedEvent) {
            var event = storedEvent.event;
            var handlers = registrations.stream()
                                        .filter(registration -> registration.eventType.isInstance(event))
                                        .collect(Collectors.toList());
            if (handlers.isEmpty() || !belongsToPartition(storedEvent, handlers)) {
                return false;
            }
            for (var registration : handlers) {
                try {
                    registration.invoke(event);
                } catch (Throwable e) {
                    Exceptions.throwIfJvmFatal(e);
                    log.error(msg("[{}] Handler '{}' failed to replay event of type '{}' at position {}",
                                  checkpointKey,
                                  registration.handlerType.getName(),
                                  event.getClass().getName(),
                                  storedEvent.position), e);
                    eventsFailed++;
                    recordMetric(m -> m.recordEventFailed(projectionName, partitionKey));
                }
            }
            eventsProcessed++;
            lastPosition = Optional.of(storedEvent.position);
            return true;
        }

        private boolean belongsToPartition(StoredEvent<Object> storedEvent, List<HandlerRegistration<?>> handlers) {
            if (options.partition.isEmpty()) {
                return true;
            }
            for (var registration : handlers) {
                if (!registration.isPartitioned()) {
                    continue;
                }
                try {
                    if (!options.partition.get().equals(registration.resolvePartitionKey(storedEvent.event))) {
                        return false;
                    }
                } catch (Throwable e) {
                    Exceptions.throwIfJvmFatal(e);
                    log.error(msg("[{}] Handler '{}' failed to resolve the partition key of event of type '{}' at position {}. Skipping the event",
                                  checkpointKey,
                                  registration.handlerType.getName(),
                                  storedEvent.event.getClass().getName(),
                                  storedEvent.position), e);
                    eventsFailed++;
                    recordMetric(m -> m.recordEventFailed(projectionName, partitionKey));
                    return false;
                }
            }
            return true;
        }

        private void saveCheckpoint(EventStore eventStore) {
            if (!options.writesCheckpoints() || lastPosition.isEmpty()) {
                return;
            }
            var positionToSave = lastPosition.get() + 1;
            checkpointStore.saveCheckpoint(checkpointKey, positionToSave);
            checkpoint = Optional.of(positionToSave);
            log.debug("[{}] Saved replay checkpoint at position {} after {} event(s)", checkpointKey, positionToSave, eventsProcessed);
            recordMetric(m -> m.recordCheckpointWritten(projectionName, partitionKey, positionToSave));
            recordLag(eventStore);
        }

        private void recordLag(EventStore eventStore) {
            lastPosition.ifPresent(position -> {
                var latestEventPosition = eventStore.getStreamPosition(projectionName);
                recordMetric(m -> m.recordLag(projectionName, partitionKey, position, latestEventPosition));
            });
        }
    }
}

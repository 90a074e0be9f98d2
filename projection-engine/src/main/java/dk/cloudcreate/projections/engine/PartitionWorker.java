package dk.cloudcreate.projections.engine;

import dk.cloudcreate.projections.checkpoint.CheckpointStore;
import dk.cloudcreate.projections.common.types.CheckpointKey;
import dk.cloudcreate.projections.monitor.ProjectionMonitor;
import dk.cloudcreate.projections.options.*;
import org.slf4j.*;
import reactor.core.Exceptions;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.*;
import java.util.function.Consumer;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Processes the {@link WorkItem}'s of a single <code>(projection, partition)</code> strictly in the order they were enqueued.<br>
 * The worker owns a bounded queue, a running position (the number of successfully processed events) and the number
 * of events processed since the last checkpoint was saved. The position is saved in the {@link CheckpointStore}
 * every {@link ProjectionOptions#checkpointBatchSize} events and once more when the worker is closed and a partial
 * batch is pending.<br>
 * A permit from the projection's shared {@link Semaphore} is held while the handler is invoked, which bounds
 * the number of concurrent handler invocations across all partitions of the projection.<br>
 * Handler failures, including non JVM fatal {@link Error}'s, are handled according to the {@link ErrorHandlingOptions}.
 * Failures thrown by the {@link ProjectionMonitor} are logged and never affect the processing.
 * Once the worker has terminated it rejects new work, so callers are never blocked by a queue that nobody drains.
 */
final class PartitionWorker implements Runnable {
    private static final Logger   log                        = LoggerFactory.getLogger(PartitionWorker.class);
    private static final Duration QUEUE_POLLING_INTERVAL     = Duration.ofMillis(100);

    final         String                       projectionName;
    final         String                       partitionKey;
    final         CheckpointKey                checkpointKey;
    private final ProjectionOptions            options;
    private final Semaphore                    parallelismSemaphore;
    private final CheckpointStore              checkpointStore;
    private final Optional<ProjectionMonitor>  monitor;
    private final LinkedBlockingDeque<WorkItem> queue;
    private final CountDownLatch               terminated = new CountDownLatch(1);

    private volatile boolean closed;
    /**
     * Set when the handler failed and the {@link ErrorHandlingStrategy#STOP} strategy applied or when the
     * starting position couldn't be resolved. A halted worker discards every item it dequeues
     */
    private volatile boolean halted;
    private volatile long    position;
    /**
     * Only accessed by the worker thread
     */
    private          int     eventsSinceLastCheckpoint;

    @SuppressWarnings("OptionalUsedAsFieldOrParameterType")
    PartitionWorker(String projectionName,
                    String partitionKey,
                    CheckpointKey checkpointKey,
                    ProjectionOptions options,
                    Semaphore parallelismSemaphore,
                    CheckpointStore checkpointStore,
                    Optional<ProjectionMonitor> monitor) {
        this.projectionName = requireNonNull(projectionName, "No projectionName provided");
        this.partitionKey = requireNonNull(partitionKey, "No partitionKey provided");
        this.checkpointKey = requireNonNull(checkpointKey, "No checkpointKey provided");
        this.options = requireNonNull(options, "No options provided");
        this.parallelismSemaphore = requireNonNull(parallelismSemaphore, "No parallelismSemaphore provided");
        this.checkpointStore = requireNonNull(checkpointStore, "No checkpointStore provided");
        this.monitor = requireNonNull(monitor, "No monitor option provided");
        this.queue = new LinkedBlockingDeque<>(options.queueCapacity);
    }

    /**
     * Enqueue a work item according to the {@link ProjectionOptions#backpressureStrategy}
     *
     * @param workItem the work item
     * @return true if the work item was enqueued, false if it was dropped
     * @throws IllegalStateException if the worker has been closed
     */
    boolean enqueue(WorkItem workItem) {
        requireNonNull(workItem, "No workItem provided");
        if (closed) {
            throw new IllegalStateException(msg("[{}:{}] Partition worker is closed and doesn't accept new work", projectionName, partitionKey));
        }
        if (isTerminated()) {
            throw new IllegalStateException(msg("[{}:{}] Partition worker has terminated and doesn't accept new work", projectionName, partitionKey));
        }
        boolean enqueued;
        switch (options.backpressureStrategy) {
            case BLOCK:
                enqueued = enqueueBlocking(workItem);
                break;
            case DROP_NEWEST:
                enqueued = queue.offer(workItem);
                if (!enqueued) {
                    log.warn("[{}:{}] Queue is full (capacity {}). Dropping the newest event of type '{}'",
                             projectionName,
                             partitionKey,
                             options.queueCapacity,
                             workItem.event.getClass().getName());
                    recordEventDropped();
                }
                break;
            case DROP_OLDEST:
                while (!queue.offer(workItem)) {
                    var droppedWorkItem = queue.pollFirst();
                    if (droppedWorkItem != null) {
                        log.warn("[{}:{}] Queue is full (capacity {}). Dropping the oldest event of type '{}'",
                                 projectionName,
                                 partitionKey,
                                 options.queueCapacity,
                                 droppedWorkItem.event.getClass().getName());
                        recordEventDropped();
                    }
                }
                enqueued = true;
                break;
            default:
                throw new IllegalStateException(msg("Unsupported backpressure strategy {}", options.backpressureStrategy));
        }
        var queueDepth = queue.size();
        recordMetric(m -> m.recordQueueDepth(projectionName, partitionKey, queueDepth));
        return enqueued;
    }

    /**
     * Wait for queue capacity while the worker is alive
     *
     * @throws IllegalStateException if the worker terminates while waiting
     */
    private boolean enqueueBlocking(WorkItem workItem) {
        try {
            while (!queue.offer(workItem, QUEUE_POLLING_INTERVAL.toMillis(), TimeUnit.MILLISECONDS)) {
                if (isTerminated()) {
                    throw new IllegalStateException(msg("[{}:{}] Partition worker terminated while waiting for queue capacity", projectionName, partitionKey));
                }
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[{}:{}] Interrupted while waiting for queue capacity. Dropping event of type '{}'",
                     projectionName,
                     partitionKey,
                     workItem.event.getClass().getName());
            recordEventDropped();
            return false;
        }
    }

    /**
     * Signal that no more work items will be enqueued. The worker finishes the already queued items,
     * flushes its checkpoint and terminates
     */
    void close() {
        if (!closed) {
            log.debug("[{}:{}] Closing partition worker with {} queued event(s)", projectionName, partitionKey, queue.size());
            closed = true;
        }
    }

    /**
     * Wait for the worker to terminate after {@link #close()} has been called
     *
     * @param timeout the maximum time to wait
     * @return true if the worker terminated within the timeout
     */
    boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * @return the number of events processed successfully (including the starting position)
     */
    long position() {
        return position;
    }

    boolean isHalted() {
        return halted;
    }

    boolean isTerminated() {
        return terminated.getCount() == 0;
    }

    int queueSize() {
        return queue.size();
    }

    @Override
    public void run() {
        try {
            resolveStartingPosition();
            processQueue();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[{}:{}] Partition worker was interrupted with {} queued event(s) remaining", projectionName, partitionKey, queue.size());
        } catch (Throwable e) {
            halted = true;
            log.error(msg("[{}:{}] Partition worker failed unexpectedly with {} queued event(s) remaining", projectionName, partitionKey, queue.size()), e);
            throw e;
        } finally {
            flushCheckpoint();
            log.debug("[{}:{}] Partition worker terminated at position {}", projectionName, partitionKey, position);
            terminated.countDown();
        }
    }

    /**
     * Resolve the position processing starts from. When the {@link CheckpointStore} fails and the {@link ErrorHandlingStrategy#RETRY}
     * strategy applies, the lookup is retried with the same backoff as failed events. If the position still can't be
     * resolved the partition is halted, because processing from an unknown position would corrupt the checkpoint
     */
    private void resolveStartingPosition() throws InterruptedException {
        var errorHandling = options.errorHandling;
        var retries       = 0;
        while (true) {
            try {
                position = loadStartingPosition();
                return;
            } catch (RuntimeException e) {
                if (errorHandling.strategy == ErrorHandlingStrategy.RETRY && retries < errorHandling.maxRetryAttempts) {
                    var retryDelay = errorHandling.calculateNextRetryDelay(retries);
                    retries++;
                    log.warn(msg("[{}:{}] Failed to resolve the starting position in {} mode. Retry {} of {} in {}",
                                 projectionName,
                                 partitionKey,
                                 options.startupMode,
                                 retries,
                                 errorHandling.maxRetryAttempts,
                                 retryDelay), e);
                    Thread.sleep(retryDelay.toMillis());
                    continue;
                }
                log.error(msg("[{}:{}] Failed to resolve the starting position in {} mode. Halting the partition worker", projectionName, partitionKey, options.startupMode), e);
                halted = true;
                return;
            }
        }
    }

    private long loadStartingPosition() {
        switch (options.startupMode) {
            case RESUME:
                var checkpoint = checkpointStore.getCheckpoint(checkpointKey).orElse(0L);
                log.info("[{}:{}] Partition worker started in {} mode from position {}", projectionName, partitionKey, options.startupMode, checkpoint);
                return checkpoint;
            case REPLAY:
                checkpointStore.resetCheckpoint(checkpointKey);
                log.info("[{}:{}] Partition worker started in {} mode. Checkpoint was reset and processing starts from position 0", projectionName, partitionKey, options.startupMode);
                return 0;
            case CATCH_UP:
            case LIVE_ONLY:
                log.info("[{}:{}] Partition worker started in {} mode. Only events published after the engine subscribed are processed", projectionName, partitionKey, options.startupMode);
                return 0;
            default:
                throw new IllegalStateException(msg("Unsupported startup mode {}", options.startupMode));
        }
    }

    private void processQueue() throws InterruptedException {
        while (true) {
            var workItem = queue.poll(QUEUE_POLLING_INTERVAL.toMillis(), TimeUnit.MILLISECONDS);
            if (workItem == null) {
                if (closed && queue.isEmpty()) {
                    return;
                }
                continue;
            }
            var queueDepth = queue.size();
            recordMetric(m -> m.recordQueueDepth(projectionName, partitionKey, queueDepth));

            if (halted) {
                log.warn("[{}:{}] Partition worker is halted. Discarding event of type '{}'", projectionName, partitionKey, workItem.event.getClass().getName());
                recordEventDropped();
                continue;
            }

            if (project(workItem)) {
                position++;
                eventsSinceLastCheckpoint++;
                var processedPosition = position;
                recordMetric(m -> m.recordEventProcessed(projectionName, partitionKey, processedPosition));
                if (eventsSinceLastCheckpoint >= options.checkpointBatchSize) {
                    saveCheckpoint();
                }
            }
        }
    }

    /**
     * Invoke the handler and apply the {@link ErrorHandlingOptions} if it fails
     *
     * @return true if the event was projected successfully
     */
    private boolean project(WorkItem workItem) throws InterruptedException {
        var errorHandling = options.errorHandling;
        var retries       = 0;
        while (true) {
            try {
                invokeHandler(workItem);
                if (retries > 0) {
                    log.info("[{}:{}] Event of type '{}' was projected after {} retries", projectionName, partitionKey, workItem.event.getClass().getName(), retries);
                }
                return true;
            } catch (InterruptedException e) {
                throw e;
            } catch (Throwable e) {
                Exceptions.throwIfJvmFatal(e);
                if (errorHandling.strategy == ErrorHandlingStrategy.RETRY && retries < errorHandling.maxRetryAttempts) {
                    var retryDelay = errorHandling.calculateNextRetryDelay(retries);
                    retries++;
                    log.warn(msg("[{}:{}] {} failed to project event of type '{}'. Retry {} of {} in {}",
                                 projectionName,
                                 partitionKey,
                                 workItem.registration.handlerType.getName(),
                                 workItem.event.getClass().getName(),
                                 retries,
                                 errorHandling.maxRetryAttempts,
                                 retryDelay), e);
                    Thread.sleep(retryDelay.toMillis());
                    continue;
                }
                handleFailure(workItem, e, errorHandling.strategy == ErrorHandlingStrategy.RETRY ? errorHandling.fallbackStrategy : errorHandling.strategy);
                return false;
            }
        }
    }

    private void invokeHandler(WorkItem workItem) throws InterruptedException {
        parallelismSemaphore.acquire();
        try {
            workItem.invoke();
        } finally {
            parallelismSemaphore.release();
        }
    }

    private void handleFailure(WorkItem workItem, Throwable cause, ErrorHandlingStrategy strategy) {
        recordMetric(m -> m.recordEventFailed(projectionName, partitionKey));
        if (strategy == ErrorHandlingStrategy.STOP) {
            log.error(msg("[{}:{}] {} failed to project event of type '{}'. Halting the partition at position {}",
                          projectionName,
                          partitionKey,
                          workItem.registration.handlerType.getName(),
                          workItem.event.getClass().getName(),
                          position), cause);
            halted = true;
            flushCheckpoint();
        } else {
            log.error(msg("[{}:{}] {} failed to project event of type '{}'. Skipping the event. The position remains {}",
                          projectionName,
                          partitionKey,
                          workItem.registration.handlerType.getName(),
                          workItem.event.getClass().getName(),
                          position), cause);
        }
    }

    private void flushCheckpoint() {
        if (eventsSinceLastCheckpoint > 0) {
            log.debug("[{}:{}] Flushing partial checkpoint batch of {} event(s)", projectionName, partitionKey, eventsSinceLastCheckpoint);
            saveCheckpoint();
        }
    }

    /**
     * A failed save is logged and the batch counter is kept, so the save is attempted again after the next event (or at the final flush)
     */
    private void saveCheckpoint() {
        var positionToSave = position;
        try {
            checkpointStore.saveCheckpoint(checkpointKey, positionToSave);
            eventsSinceLastCheckpoint = 0;
            log.debug("[{}:{}] Saved checkpoint at position {}", projectionName, partitionKey, positionToSave);
            recordMetric(m -> m.recordCheckpointWritten(projectionName, partitionKey, positionToSave));
        } catch (Exception e) {
            log.error(msg("[{}:{}] Failed to save checkpoint at position {}", projectionName, partitionKey, positionToSave), e);
        }
    }

    private void recordEventDropped() {
        recordMetric(m -> m.recordEventDropped(projectionName, partitionKey));
    }

    private void recordMetric(Consumer<ProjectionMonitor> measurement) {
        monitor.ifPresent(m -> {
            try {
                measurement.accept(m);
            } catch (RuntimeException e) {
                log.warn(msg("[{}:{}] Projection monitor '{}' failed to record a measurement", projectionName, partitionKey, m.getClass().getName()), e);
            }
        });
    }

    @Override
    public String toString() {
        return "PartitionWorker{" +
                "projectionName='" + projectionName + '\'' +
                ", partitionKey='" + partitionKey + '\'' +
                ", checkpointKey=" + checkpointKey +
                ", position=" + position +
                ", halted=" + halted +
                ", closed=" + closed +
                '}';
    }
}

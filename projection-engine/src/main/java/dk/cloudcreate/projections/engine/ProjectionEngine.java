package dk.cloudcreate.projections.engine;

import dk.cloudcreate.projections.common.Lifecycle;

import java.util.concurrent.CompletableFuture;

/**
 * Subscribes to the live event stream of every event type that has a registered projection handler and
 * routes each event to every handler registered for the event type.<br>
 * Events are processed sequentially per <code>(projection, partition)</code> by a dedicated partition worker,
 * the number of concurrent handler invocations per projection is bounded by
 * {@link dk.cloudcreate.projections.options.ProjectionOptions#maxDegreeOfParallelism} and each partition's
 * position is checkpointed in batches of {@link dk.cloudcreate.projections.options.ProjectionOptions#checkpointBatchSize}.<br>
 * <br>
 * {@link #start()} subscribes and returns immediately. {@link #stop()} stops receiving new events, lets every
 * partition worker finish its already queued events, flushes the last partial checkpoint batches and returns
 * when the engine is {@link EngineState#STOPPED}.
 */
public interface ProjectionEngine extends Lifecycle {
    /**
     * @return the current state of the engine
     */
    EngineState state();

    /**
     * The future completes when the engine reaches {@link EngineState#STOPPED}.<br>
     * It completes normally after a graceful {@link #stop()} (or when there's nothing to project) and
     * exceptionally with a {@link ProjectionEngineException} if an event bus subscription failed.
     * In both cases every partition worker has been drained and flushed before the future completes.
     *
     * @return the termination future
     */
    CompletableFuture<Void> termination();
}

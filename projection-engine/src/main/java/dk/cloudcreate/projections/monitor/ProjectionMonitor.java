package dk.cloudcreate.projections.monitor;

import java.util.*;

/**
 * Receives runtime measurements from the projection engine and its partition workers.<br>
 * Implementations are called concurrently from all partition workers and must be thread safe and fast,
 * since they're called for every event processed.
 */
public interface ProjectionMonitor {
    /**
     * An event was projected successfully
     *
     * @param projectionName  the name of the projection
     * @param partitionKey    the partition key
     * @param currentPosition the partition's position after the event was processed
     */
    void recordEventProcessed(String projectionName, String partitionKey, long currentPosition);

    /**
     * The projection handler failed to project an event and the event was skipped or the partition was stopped
     */
    void recordEventFailed(String projectionName, String partitionKey);

    void recordCheckpointWritten(String projectionName, String partitionKey, long position);

    /**
     * @param projectionName the name of the projection
     * @param workerCount    the number of partition workers that currently exist for the projection
     */
    void recordWorkerCount(String projectionName, int workerCount);

    void recordQueueDepth(String projectionName, String partitionKey, int queueDepth);

    /**
     * An event was discarded without being projected (queue overflow or a stopped partition)
     */
    void recordEventDropped(String projectionName, String partitionKey);

    /**
     * Record how far a projection partition is behind the latest event available in the event source
     *
     * @param projectionName      the name of the projection
     * @param partitionKey        the partition key
     * @param currentPosition     the partition's current position
     * @param latestEventPosition the latest position available or {@link Optional#empty()} if it's unknown
     */
    @SuppressWarnings("OptionalUsedAsFieldOrParameterType")
    void recordLag(String projectionName, String partitionKey, long currentPosition, Optional<Long> latestEventPosition);

    Optional<ProjectionMetrics> getMetrics(String projectionName, String partitionKey);

    List<ProjectionMetrics> getAllMetrics();
}

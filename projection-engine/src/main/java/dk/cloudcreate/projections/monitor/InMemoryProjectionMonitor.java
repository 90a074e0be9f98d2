package dk.cloudcreate.projections.monitor;

import java.util.*;
import java.util.concurrent.*;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * {@link ProjectionMonitor} that keeps the {@link ProjectionMetrics} of every projection partition in memory
 */
public class InMemoryProjectionMonitor implements ProjectionMonitor {
    /**
     * Key: projection name<br>
     * Value: the metrics per partition key
     */
    private final ConcurrentMap<String, ConcurrentMap<String, ProjectionMetrics>> metrics      = new ConcurrentHashMap<>();
    /**
     * Key: projection name<br>
     * Value: the last reported worker count
     */
    private final ConcurrentMap<String, Integer>                                  workerCounts = new ConcurrentHashMap<>();

    @Override
    public void recordEventProcessed(String projectionName, String partitionKey, long currentPosition) {
        metricsFor(projectionName, partitionKey).eventProcessed(currentPosition);
    }

    @Override
    public void recordEventFailed(String projectionName, String partitionKey) {
        metricsFor(projectionName, partitionKey).eventFailed();
    }

    @Override
    public void recordCheckpointWritten(String projectionName, String partitionKey, long position) {
        metricsFor(projectionName, partitionKey).checkpointWritten(position);
    }

    @Override
    public void recordWorkerCount(String projectionName, int workerCount) {
        requireNonNull(projectionName, "No projectionName provided");
        workerCounts.put(projectionName, workerCount);
        metrics.getOrDefault(projectionName, new ConcurrentHashMap<>())
               .values()
               .forEach(partitionMetrics -> partitionMetrics.workerCount(workerCount));
    }

    @Override
    public void recordQueueDepth(String projectionName, String partitionKey, int queueDepth) {
        metricsFor(projectionName, partitionKey).queueDepth(queueDepth);
    }

    @Override
    public void recordEventDropped(String projectionName, String partitionKey) {
        metricsFor(projectionName, partitionKey).eventDropped();
    }

    @SuppressWarnings("OptionalUsedAsFieldOrParameterType")
    @Override
    public void recordLag(String projectionName, String partitionKey, long currentPosition, Optional<Long> latestEventPosition) {
        requireNonNull(latestEventPosition, "No latestEventPosition option provided");
        metricsFor(projectionName, partitionKey).positions(currentPosition, latestEventPosition);
    }

    @Override
    public Optional<ProjectionMetrics> getMetrics(String projectionName, String partitionKey) {
        requireNonNull(projectionName, "No projectionName provided");
        requireNonNull(partitionKey, "No partitionKey provided");
        return Optional.ofNullable(metrics.getOrDefault(projectionName, new ConcurrentHashMap<>()).get(partitionKey));
    }

    @Override
    public List<ProjectionMetrics> getAllMetrics() {
        return metrics.values()
                      .stream()
                      .flatMap(partitionMetrics -> partitionMetrics.values().stream())
                      .sorted(Comparator.comparing((ProjectionMetrics m) -> m.projectionName)
                                        .thenComparing(m -> m.partitionKey))
                      .collect(Collectors.toList());
    }

    private ProjectionMetrics metricsFor(String projectionName, String partitionKey) {
        requireNonNull(projectionName, "No projectionName provided");
        requireNonNull(partitionKey, "No partitionKey provided");
        return metrics.computeIfAbsent(projectionName, name -> new ConcurrentHashMap<>())
                      .computeIfAbsent(partitionKey, key -> {
                          var partitionMetrics = new ProjectionMetrics(projectionName, partitionKey);
                          partitionMetrics.workerCount(workerCounts.getOrDefault(projectionName, 0));
                          return partitionMetrics;
                      });
    }
}

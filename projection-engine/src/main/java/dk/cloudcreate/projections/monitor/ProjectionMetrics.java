package dk.cloudcreate.projections.monitor;

import java.time.*;
import java.util.Optional;
import java.util.concurrent.atomic.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Live metrics for a single projection partition, maintained by the {@link InMemoryProjectionMonitor}
 */
public class ProjectionMetrics {
    public final String projectionName;
    public final String partitionKey;

    private final AtomicLong                      currentPosition        = new AtomicLong();
    private final AtomicReference<Long>           latestEventPosition    = new AtomicReference<>();
    private final AtomicLong                      eventsProcessed        = new AtomicLong();
    private final AtomicLong                      eventsFailed           = new AtomicLong();
    private final AtomicLong                      eventsDropped          = new AtomicLong();
    private final AtomicLong                      checkpointsWritten     = new AtomicLong();
    private final AtomicInteger                   workerCount            = new AtomicInteger();
    private final AtomicInteger                   queueDepth             = new AtomicInteger();
    private final AtomicReference<OffsetDateTime> processingStartTime    = new AtomicReference<>();
    private final AtomicReference<OffsetDateTime> lastEventProcessedTime = new AtomicReference<>();
    private final AtomicReference<OffsetDateTime> lastCheckpointTime     = new AtomicReference<>();

    public ProjectionMetrics(String projectionName, String partitionKey) {
        this.projectionName = requireNonNull(projectionName, "No projectionName provided");
        this.partitionKey = requireNonNull(partitionKey, "No partitionKey provided");
    }

    void eventProcessed(long position) {
        var now = now();
        processingStartTime.compareAndSet(null, now);
        lastEventProcessedTime.set(now);
        currentPosition.set(position);
        eventsProcessed.incrementAndGet();
    }

    void eventFailed() {
        eventsFailed.incrementAndGet();
    }

    void eventDropped() {
        eventsDropped.incrementAndGet();
    }

    void checkpointWritten(long position) {
        lastCheckpointTime.set(now());
        checkpointsWritten.incrementAndGet();
    }

    void positions(long currentPosition, Optional<Long> latestEventPosition) {
        this.currentPosition.set(currentPosition);
        this.latestEventPosition.set(latestEventPosition.orElse(null));
    }

    void workerCount(int workerCount) {
        this.workerCount.set(workerCount);
    }

    void queueDepth(int queueDepth) {
        this.queueDepth.set(queueDepth);
    }

    public long getCurrentPosition() {
        return currentPosition.get();
    }

    public Optional<Long> getLatestEventPosition() {
        return Optional.ofNullable(latestEventPosition.get());
    }

    /**
     * @return the number of events the partition is behind the latest event position, or 0 if the latest event position is unknown
     */
    public long getLag() {
        var latest = latestEventPosition.get();
        return latest != null ? Math.max(0, latest - currentPosition.get()) : 0;
    }

    public long getEventsProcessed() {
        return eventsProcessed.get();
    }

    public long getEventsFailed() {
        return eventsFailed.get();
    }

    public long getEventsDropped() {
        return eventsDropped.get();
    }

    public long getCheckpointsWritten() {
        return checkpointsWritten.get();
    }

    public int getWorkerCount() {
        return workerCount.get();
    }

    public int getQueueDepth() {
        return queueDepth.get();
    }

    public Optional<OffsetDateTime> getProcessingStartTime() {
        return Optional.ofNullable(processingStartTime.get());
    }

    public Optional<OffsetDateTime> getLastEventProcessedTime() {
        return Optional.ofNullable(lastEventProcessedTime.get());
    }

    public Optional<OffsetDateTime> getLastCheckpointTime() {
        return Optional.ofNullable(lastCheckpointTime.get());
    }

    /**
     * @return the average number of events processed per second since the first event was processed
     */
    public double getEventsPerSecond() {
        var startTime = processingStartTime.get();
        var processed = eventsProcessed.get();
        if (startTime == null || processed == 0) {
            return 0;
        }
        var elapsedMs = Duration.between(startTime, now()).toMillis();
        return elapsedMs > 0 ? processed * 1000.0 / elapsedMs : 0;
    }

    private static OffsetDateTime now() {
        return OffsetDateTime.now(ZoneOffset.UTC);
    }

    @Override
    public String toString() {
        return "ProjectionMetrics{" +
                "projectionName='" + projectionName + '\'' +
                ", partitionKey='" + partitionKey + '\'' +
                ", currentPosition=" + currentPosition +
                ", latestEventPosition=" + latestEventPosition +
                ", eventsProcessed=" + eventsProcessed +
                ", eventsFailed=" + eventsFailed +
                ", eventsDropped=" + eventsDropped +
                ", checkpointsWritten=" + checkpointsWritten +
                ", workerCount=" + workerCount +
                ", queueDepth=" + queueDepth +
                '}';
    }
}

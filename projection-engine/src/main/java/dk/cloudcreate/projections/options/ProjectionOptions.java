package dk.cloudcreate.projections.options;

import dk.cloudcreate.projections.common.types.CheckpointKey;

import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * Per projection configuration.<br>
 * Options are resolved by the {@link dk.cloudcreate.projections.registry.ProjectionOptionsResolver} with the following precedence:
 * <ol>
 *     <li>options supplied together with the handler registration</li>
 *     <li>options registered in the {@link dk.cloudcreate.projections.registry.ProjectionHandlerRegistry} for the projection name</li>
 *     <li>the {@link dk.cloudcreate.projections.handler.Projection} annotation on the handler class</li>
 *     <li>the defaults (parallelism 1, checkpoint batch size 100, {@link ProjectionStartupMode#RESUME})</li>
 * </ol>
 * A projection name may not contain {@link CheckpointKey#SEPARATOR}.
 */
public class ProjectionOptions {
    public static final int DEFAULT_MAX_DEGREE_OF_PARALLELISM = 1;
    public static final int DEFAULT_CHECKPOINT_BATCH_SIZE     = 100;
    public static final int DEFAULT_QUEUE_CAPACITY            = 1000;
    /**
     * Ceiling used when {@link #maxDegreeOfParallelism} is 0 or negative (i.e. unbounded)
     */
    public static final int MAX_PARALLELISM_CEILING           = 1000;

    /**
     * The identity of the projection. Used in checkpoint keys and to group partition workers.
     * An empty name means that the name hasn't been resolved yet (see {@link #withProjectionName(String)})
     */
    public final String                projectionName;
    /**
     * The maximum number of concurrent handler invocations across all partitions of the projection.
     * 0 or a negative value means unbounded, which is capped at {@link #MAX_PARALLELISM_CEILING}
     */
    public final int                   maxDegreeOfParallelism;
    /**
     * The number of successfully processed events between durable checkpoint writes
     */
    public final int                   checkpointBatchSize;
    public final ProjectionStartupMode startupMode;
    /**
     * The capacity of each partition worker's queue
     */
    public final int                   queueCapacity;
    public final BackpressureStrategy  backpressureStrategy;
    public final ErrorHandlingOptions  errorHandling;

    public ProjectionOptions(String projectionName,
                             int maxDegreeOfParallelism,
                             int checkpointBatchSize,
                             ProjectionStartupMode startupMode,
                             int queueCapacity,
                             BackpressureStrategy backpressureStrategy,
                             ErrorHandlingOptions errorHandling) {
        this.projectionName = requireNonNull(projectionName, "You must specify a projectionName (use an empty String to use the default name)");
        if (!projectionName.isBlank()) {
            CheckpointKey.requireValidProjectionName(projectionName);
        }
        this.startupMode = requireNonNull(startupMode, "You must specify a startupMode");
        this.backpressureStrategy = requireNonNull(backpressureStrategy, "You must specify a backpressureStrategy");
        this.errorHandling = requireNonNull(errorHandling, "You must specify the errorHandling options");
        requireTrue(checkpointBatchSize >= 1, "checkpointBatchSize must be >= 1");
        requireTrue(queueCapacity >= 1, "queueCapacity must be >= 1");
        this.maxDegreeOfParallelism = maxDegreeOfParallelism;
        this.checkpointBatchSize = checkpointBatchSize;
        this.queueCapacity = queueCapacity;
    }

    public static ProjectionOptionsBuilder builder() {
        return new ProjectionOptionsBuilder();
    }

    public static ProjectionOptions defaults() {
        return builder().build();
    }

    /**
     * The number of permits for the projection's parallelism semaphore
     *
     * @return {@link #maxDegreeOfParallelism} or {@link #MAX_PARALLELISM_CEILING} if it is 0 or negative
     */
    public int effectiveMaxDegreeOfParallelism() {
        return maxDegreeOfParallelism > 0 ? maxDegreeOfParallelism : MAX_PARALLELISM_CEILING;
    }

    public boolean hasProjectionName() {
        return !projectionName.isBlank();
    }

    /**
     * Create a copy of these options with another projection name
     *
     * @param projectionName the new projection name
     * @return the copy
     */
    public ProjectionOptions withProjectionName(String projectionName) {
        return new ProjectionOptions(projectionName,
                                     maxDegreeOfParallelism,
                                     checkpointBatchSize,
                                     startupMode,
                                     queueCapacity,
                                     backpressureStrategy,
                                     errorHandling);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProjectionOptions that = (ProjectionOptions) o;
        return maxDegreeOfParallelism == that.maxDegreeOfParallelism &&
                checkpointBatchSize == that.checkpointBatchSize &&
                queueCapacity == that.queueCapacity &&
                projectionName.equals(that.projectionName) &&
                startupMode == that.startupMode &&
                backpressureStrategy == that.backpressureStrategy &&
                errorHandling.equals(that.errorHandling);
    }

    @Override
    public int hashCode() {
        return Objects.hash(projectionName, maxDegreeOfParallelism, checkpointBatchSize, startupMode, queueCapacity, backpressureStrategy);
    }

    @Override
    public String toString() {
        return "ProjectionOptions{" +
                "projectionName='" + projectionName + '\'' +
                ", maxDegreeOfParallelism=" + maxDegreeOfParallelism +
                ", checkpointBatchSize=" + checkpointBatchSize +
                ", startupMode=" + startupMode +
                ", queueCapacity=" + queueCapacity +
                ", backpressureStrategy=" + backpressureStrategy +
                ", errorHandling=" + errorHandling +
                '}';
    }

    public static class ProjectionOptionsBuilder {
        private String                projectionName         = "";
        private int                   maxDegreeOfParallelism = DEFAULT_MAX_DEGREE_OF_PARALLELISM;
        private int                   checkpointBatchSize    = DEFAULT_CHECKPOINT_BATCH_SIZE;
        private ProjectionStartupMode startupMode            = ProjectionStartupMode.RESUME;
        private int                   queueCapacity          = DEFAULT_QUEUE_CAPACITY;
        private BackpressureStrategy  backpressureStrategy   = BackpressureStrategy.BLOCK;
        private ErrorHandlingOptions  errorHandling          = ErrorHandlingOptions.DEFAULT;

        public ProjectionOptionsBuilder projectionName(String projectionName) {
            this.projectionName = projectionName;
            return this;
        }

        public ProjectionOptionsBuilder maxDegreeOfParallelism(int maxDegreeOfParallelism) {
            this.maxDegreeOfParallelism = maxDegreeOfParallelism;
            return this;
        }

        public ProjectionOptionsBuilder checkpointBatchSize(int checkpointBatchSize) {
            this.checkpointBatchSize = checkpointBatchSize;
            return this;
        }

        public ProjectionOptionsBuilder startupMode(ProjectionStartupMode startupMode) {
            this.startupMode = startupMode;
            return this;
        }

        public ProjectionOptionsBuilder queueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
            return this;
        }

        public ProjectionOptionsBuilder backpressureStrategy(BackpressureStrategy backpressureStrategy) {
            this.backpressureStrategy = backpressureStrategy;
            return this;
        }

        public ProjectionOptionsBuilder errorHandling(ErrorHandlingOptions errorHandling) {
            this.errorHandling = errorHandling;
            return this;
        }

        public ProjectionOptions build() {
            return new ProjectionOptions(projectionName,
                                         maxDegreeOfParallelism,
                                         checkpointBatchSize,
                                         startupMode,
                                         queueCapacity,
                                         backpressureStrategy,
                                         errorHandling);
        }
    }
}

package dk.cloudcreate.projections.handler;

import dk.cloudcreate.projections.options.*;

import java.lang.annotation.*;

/**
 * Declarative {@link ProjectionOptions} for a projection handler class.<br>
 * Options explicitly supplied when registering the handler take precedence over this annotation.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Projection {
    /**
     * The name of the projection. Blank means the simple name of the handler class
     */
    String projectionName() default "";

    int maxDegreeOfParallelism() default ProjectionOptions.DEFAULT_MAX_DEGREE_OF_PARALLELISM;

    int checkpointBatchSize() default ProjectionOptions.DEFAULT_CHECKPOINT_BATCH_SIZE;

    ProjectionStartupMode startupMode() default ProjectionStartupMode.RESUME;

    int queueCapacity() default ProjectionOptions.DEFAULT_QUEUE_CAPACITY;

    BackpressureStrategy backpressureStrategy() default BackpressureStrategy.BLOCK;
}

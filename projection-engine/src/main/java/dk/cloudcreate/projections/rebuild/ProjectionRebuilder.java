package dk.cloudcreate.projections.rebuild;

import java.util.List;

/**
 * Resets projection checkpoints so that projections are rebuilt.<br>
 * Resetting a checkpoint doesn't affect a running projection engine. The engine must be restarted to pick up the reset checkpoints.
 */
public interface ProjectionRebuilder {
    /**
     * Delete the checkpoint stored under the bare projection name
     *
     * @param projectionName the name of the projection
     * @throws IllegalArgumentException if the projectionName is null or blank
     */
    void resetProjection(String projectionName);

    /**
     * Delete the checkpoint of a single partition of a partitioned projection.
     * The checkpoints of the projection's other partitions are unaffected
     *
     * @param projectionName the name of the projection
     * @param partitionKey   the partition key
     * @throws IllegalArgumentException if the projectionName or partitionKey is null or blank
     */
    void resetPartition(String projectionName, String partitionKey);

    /**
     * Reset every projection returned by {@link #getRegisteredProjections()}.<br>
     * All projections are attempted even if resetting one of them fails
     *
     * @throws ProjectionResetException if one or more projections couldn't be reset
     */
    void resetAllProjections();

    /**
     * @return the distinct names of all registered projections sorted lexicographically
     */
    List<String> getRegisteredProjections();
}

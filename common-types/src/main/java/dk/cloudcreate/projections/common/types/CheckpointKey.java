package dk.cloudcreate.projections.common.types;

import dk.cloudcreate.essentials.types.*;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * The key under which the checkpoint (the last successfully processed position) of a projection is stored.<br>
 * <ul>
 *     <li>Non-partitioned projections use the bare projection name, e.g. <b>OrderSummaryProjection</b></li>
 *     <li>Partitioned projections use <code>{projectionName}:{partitionKey}</code>, e.g. <b>UserActivityProjection:user-1</b></li>
 * </ul>
 * Projection names may not contain the {@link #SEPARATOR}, whereas partition keys may. This keeps every key unambiguous:
 * the projection name is everything before the first separator.
 */
public class CheckpointKey extends CharSequenceType<CheckpointKey> implements Identifier {
    public static final String SEPARATOR = ":";

    public CheckpointKey(CharSequence value) {
        super(value);
    }

    public static CheckpointKey of(CharSequence value) {
        requireNonNull(value, "No checkpoint key value provided");
        requireTrue(value.length() > 0, "Checkpoint key value must not be empty");
        return new CheckpointKey(value);
    }

    /**
     * Create the key for a non-partitioned projection
     *
     * @param projectionName the name of the projection
     * @return the checkpoint key consisting of the bare projection name
     */
    public static CheckpointKey forProjection(String projectionName) {
        requireValidProjectionName(projectionName);
        return new CheckpointKey(projectionName);
    }

    /**
     * Create the key for a single partition of a partitioned projection
     *
     * @param projectionName the name of the projection
     * @param partitionKey   the partition key
     * @return the checkpoint key <code>{projectionName}:{partitionKey}</code>
     */
    public static CheckpointKey forPartition(String projectionName, String partitionKey) {
        requireValidProjectionName(projectionName);
        requireNonBlank(partitionKey, "partitionKey");
        return new CheckpointKey(projectionName + SEPARATOR + partitionKey);
    }

    /**
     * Verify that the projection name can be used in a checkpoint key
     *
     * @param projectionName the projection name
     * @throws IllegalArgumentException if the name is null, blank or contains the {@link #SEPARATOR}
     */
    public static void requireValidProjectionName(String projectionName) {
        requireNonBlank(projectionName, "projectionName");
        requireTrue(!projectionName.contains(SEPARATOR), msg("projectionName '{}' must not contain '{}'", projectionName, SEPARATOR));
    }

    private static void requireNonBlank(String value, String parameterName) {
        requireNonNull(value, parameterName + " is missing");
        requireTrue(!value.isBlank(), parameterName + " must not be blank");
    }
}

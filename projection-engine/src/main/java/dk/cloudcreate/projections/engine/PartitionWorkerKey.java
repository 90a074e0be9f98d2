package dk.cloudcreate.projections.engine;

import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Identifies a {@link PartitionWorker} by its <code>(projection, partition)</code> pair
 */
final class PartitionWorkerKey {
    final String projectionName;
    final String partitionKey;

    PartitionWorkerKey(String projectionName, String partitionKey) {
        this.projectionName = requireNonNull(projectionName, "No projectionName provided");
        this.partitionKey = requireNonNull(partitionKey, "No partitionKey provided");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PartitionWorkerKey that = (PartitionWorkerKey) o;
        return projectionName.equals(that.projectionName) && partitionKey.equals(that.partitionKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(projectionName, partitionKey);
    }

    @Override
    public String toString() {
        return "[" + projectionName + ", " + partitionKey + "]";
    }
}

package dk.cloudcreate.projections.replay;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Configuration of a single {@link ReplayService#replay(String, ReplayOptions)} run.<br>
 * The starting position is resolved as: {@link #fromPosition} if specified, otherwise the saved checkpoint if
 * {@link #fromCheckpoint} is true, otherwise position 0.
 */
@SuppressWarnings("OptionalUsedAsFieldOrParameterType")
public class ReplayOptions {
    /**
     * Continue from the saved checkpoint instead of resetting it
     */
    public final boolean              fromCheckpoint;
    /**
     * The first stream position to replay (inclusive). Takes precedence over {@link #fromCheckpoint}
     */
    public final Optional<Long>       fromPosition;
    /**
     * The last stream position to replay (inclusive)
     */
    public final Optional<Long>       toPosition;
    /**
     * The number of events between checkpoint writes in {@link ReplayCheckpointMode#NORMAL} mode.
     * If empty the projection's resolved {@link dk.cloudcreate.projections.options.ProjectionOptions#checkpointBatchSize} is used
     */
    public final Optional<Integer>    batchSize;
    /**
     * Only replay the events that a partitioned projection assigns to this partition
     */
    public final Optional<String>     partition;
    /**
     * Invoke the handlers without resetting or writing any checkpoint
     */
    public final boolean              dryRun;
    public final ReplayCheckpointMode checkpointMode;

    public ReplayOptions(boolean fromCheckpoint,
                         Optional<Long> fromPosition,
                         Optional<Long> toPosition,
                         Optional<Integer> batchSize,
                         Optional<String> partition,
                         boolean dryRun,
                         ReplayCheckpointMode checkpointMode) {
        this.fromCheckpoint = fromCheckpoint;
        this.fromPosition = requireNonNull(fromPosition, "No fromPosition option provided");
        this.toPosition = requireNonNull(toPosition, "No toPosition option provided");
        this.batchSize = requireNonNull(batchSize, "No batchSize option provided");
        this.partition = requireNonNull(partition, "No partition option provided");
        this.dryRun = dryRun;
        this.checkpointMode = requireNonNull(checkpointMode, "You must specify a checkpointMode");
        validate();
    }

    public static ReplayOptionsBuilder builder() {
        return new ReplayOptionsBuilder();
    }

    /**
     * Replay everything from position 0 with {@link ReplayCheckpointMode#NORMAL} checkpointing
     */
    public static ReplayOptions defaults() {
        return builder().build();
    }

    /**
     * @return true if the replay may reset and write checkpoints
     */
    public boolean writesCheckpoints() {
        return !dryRun && checkpointMode != ReplayCheckpointMode.NONE;
    }

    private void validate() {
        fromPosition.ifPresent(position -> requireTrue(position >= 0, msg("fromPosition must be >= 0. Got: {}", position)));
        toPosition.ifPresent(position -> requireTrue(position >= 0, msg("toPosition must be >= 0. Got: {}", position)));
        if (fromPosition.isPresent() && toPosition.isPresent()) {
            requireTrue(fromPosition.get() <= toPosition.get(),
                        msg("fromPosition ({}) cannot be greater than toPosition ({})", fromPosition.get(), toPosition.get()));
        }
        batchSize.ifPresent(size -> requireTrue(size >= 1, msg("batchSize must be >= 1. Got: {}", size)));
        partition.ifPresent(partitionKey -> requireTrue(!partitionKey.isEmpty(), "partition must not be empty"));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ReplayOptions that = (ReplayOptions) o;
        return fromCheckpoint == that.fromCheckpoint &&
                dryRun == that.dryRun &&
                fromPosition.equals(that.fromPosition) &&
                toPosition.equals(that.toPosition) &&
                batchSize.equals(that.batchSize) &&
                partition.equals(that.partition) &&
                checkpointMode == that.checkpointMode;
    }

    @Override
    public int hashCode() {
        return Objects.hash(fromCheckpoint, fromPosition, toPosition, batchSize, partition, dryRun, checkpointMode);
    }

    @Override
    public String toString() {
        return "ReplayOptions{" +
                "fromCheckpoint=" + fromCheckpoint +
                ", fromPosition=" + fromPosition +
                ", toPosition=" + toPosition +
                ", batchSize=" + batchSize +
                ", partition=" + partition.orElse("(all)") +
                ", dryRun=" + dryRun +
                ", checkpointMode=" + checkpointMode +
                '}';
    }

    public static class ReplayOptionsBuilder {
        private boolean              fromCheckpoint;
        private Optional<Long>       fromPosition   = Optional.empty();
        private Optional<Long>       toPosition     = Optional.empty();
        private Optional<Integer>    batchSize      = Optional.empty();
        private Optional<String>     partition      = Optional.empty();
        private boolean              dryRun;
        private ReplayCheckpointMode checkpointMode = ReplayCheckpointMode.NORMAL;

        public ReplayOptionsBuilder fromCheckpoint(boolean fromCheckpoint) {
            this.fromCheckpoint = fromCheckpoint;
            return this;
        }

        public ReplayOptionsBuilder fromPosition(long fromPosition) {
            this.fromPosition = Optional.of(fromPosition);
            return this;
        }

        public ReplayOptionsBuilder toPosition(long toPosition) {
            this.toPosition = Optional.of(toPosition);
            return this;
        }

        public ReplayOptionsBuilder batchSize(int batchSize) {
            this.batchSize = Optional.of(batchSize);
            return this;
        }

        public ReplayOptionsBuilder partition(String partition) {
            this.partition = Optional.ofNullable(partition);
            return this;
        }

        public ReplayOptionsBuilder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public ReplayOptionsBuilder checkpointMode(ReplayCheckpointMode checkpointMode) {
            this.checkpointMode = checkpointMode;
            return this;
        }

        public ReplayOptions build() {
            return new ReplayOptions(fromCheckpoint,
                                     fromPosition,
                                     toPosition,
                                     batchSize,
                                     partition,
                                     dryRun,
                                     checkpointMode);
        }
    }
}

package dk.cloudcreate.projections.checkpoint;

import dk.cloudcreate.projections.common.types.CheckpointKey;
import org.slf4j.*;

import java.util.*;
import java.util.concurrent.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Non-durable {@link CheckpointStore}, intended for tests and for projections that are rebuilt on every start
 */
public class InMemoryCheckpointStore implements CheckpointStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryCheckpointStore.class);

    private final ConcurrentMap<CheckpointKey, Long> checkpoints = new ConcurrentHashMap<>();

    @Override
    public Optional<Long> getCheckpoint(CheckpointKey checkpointKey) {
        requireNonNull(checkpointKey, "No checkpointKey provided");
        return Optional.ofNullable(checkpoints.get(checkpointKey));
    }

    @Override
    public void saveCheckpoint(CheckpointKey checkpointKey, long position) {
        requireNonNull(checkpointKey, "No checkpointKey provided");
        checkpoints.put(checkpointKey, position);
        log.trace("[{}] Saved checkpoint {}", checkpointKey, position);
    }

    @Override
    public void resetCheckpoint(CheckpointKey checkpointKey) {
        requireNonNull(checkpointKey, "No checkpointKey provided");
        var previous = checkpoints.remove(checkpointKey);
        log.trace("[{}] Reset checkpoint. Previous checkpoint: {}", checkpointKey, previous);
    }
}

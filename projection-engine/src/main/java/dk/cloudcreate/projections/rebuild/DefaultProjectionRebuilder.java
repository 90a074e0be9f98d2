package dk.cloudcreate.projections.rebuild;

import dk.cloudcreate.projections.checkpoint.CheckpointStore;
import dk.cloudcreate.projections.common.types.CheckpointKey;
import dk.cloudcreate.projections.registry.*;
import org.slf4j.*;

import java.util.*;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

public class DefaultProjectionRebuilder implements ProjectionRebuilder {
    private static final Logger log = LoggerFactory.getLogger(DefaultProjectionRebuilder.class);

    private final ProjectionHandlerRegistry registry;
    private final ProjectionOptionsResolver optionsResolver;
    private final CheckpointStore           checkpointStore;

    public DefaultProjectionRebuilder(ProjectionHandlerRegistry registry, CheckpointStore checkpointStore) {
        this.registry = requireNonNull(registry, "No registry provided");
        this.checkpointStore = requireNonNull(checkpointStore, "No checkpointStore provided");
        this.optionsResolver = new ProjectionOptionsResolver(registry);
    }

    @Override
    public void resetProjection(String projectionName) {
        requireNonBlank(projectionName, "projectionName");
        log.info("[{}] Resetting projection checkpoint", projectionName);
        checkpointStore.resetCheckpoint(CheckpointKey.forProjection(projectionName));
    }

    @Override
    public void resetPartition(String projectionName, String partitionKey) {
        requireNonBlank(projectionName, "projectionName");
        requireNonBlank(partitionKey, "partitionKey");
        log.info("[{}:{}] Resetting partition checkpoint", projectionName, partitionKey);
        checkpointStore.resetCheckpoint(CheckpointKey.forPartition(projectionName, partitionKey));
    }

    @Override
    public void resetAllProjections() {
        var projectionNames = getRegisteredProjections();
        log.info("Resetting {} projection(s): {}", projectionNames.size(), projectionNames);
        var failures          = new ArrayList<Exception>();
        var failedProjections = new ArrayList<String>();
        for (var projectionName : projectionNames) {
            try {
                resetProjection(projectionName);
            } catch (Exception e) {
                log.error(msg("[{}] Failed to reset projection checkpoint", projectionName), e);
                failures.add(e);
                failedProjections.add(projectionName);
            }
        }
        if (!failures.isEmpty()) {
            var exception = new ProjectionResetException(msg("Failed to reset {} of {} projection(s): {}",
                                                             failedProjections.size(),
                                                             projectionNames.size(),
                                                             failedProjections),
                                                         failedProjections);
            failures.forEach(exception::addSuppressed);
            throw exception;
        }
    }

    @Override
    public List<String> getRegisteredProjections() {
        return registry.getAllRegistrations()
                       .stream()
                       .map(optionsResolver::resolveProjectionName)
                       .distinct()
                       .sorted()
                       .collect(Collectors.toList());
    }

    private static void requireNonBlank(String value, String parameterName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(msg("{} must not be null or blank", parameterName));
        }
    }
}

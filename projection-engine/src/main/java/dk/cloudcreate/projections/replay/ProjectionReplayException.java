package dk.cloudcreate.projections.replay;

import java.util.List;

/**
 * Thrown when a replay can't be started, e.g. because the projection isn't registered
 */
public class ProjectionReplayException extends RuntimeException {
    public final String       projectionName;
    public final List<String> registeredProjections;

    public ProjectionReplayException(String message, String projectionName, List<String> registeredProjections) {
        super(message);
        this.projectionName = projectionName;
        this.registeredProjections = List.copyOf(registeredProjections);
    }
}

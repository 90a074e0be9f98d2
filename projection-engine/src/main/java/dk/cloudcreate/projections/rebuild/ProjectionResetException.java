package dk.cloudcreate.projections.rebuild;

import java.util.List;

/**
 * Thrown by {@link ProjectionRebuilder#resetAllProjections()} when one or more projections couldn't be reset.
 * Each individual failure is added as a suppressed exception
 */
public class ProjectionResetException extends RuntimeException {
    public final List<String> failedProjections;

    public ProjectionResetException(String message, List<String> failedProjections) {
        super(message);
        this.failedProjections = List.copyOf(failedProjections);
    }
}

package dk.cloudcreate.projections.engine;

public class ProjectionEngineException extends RuntimeException {
    public ProjectionEngineException(String message) {
        super(message);
    }

    public ProjectionEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}

package dk.cloudcreate.projections.registry;

/**
 * Thrown when a {@link dk.cloudcreate.projections.handler.PartitionedProjectionHandler} returns a null or empty partition key
 */
public class InvalidPartitionKeyException extends RuntimeException {
    public InvalidPartitionKeyException(String message) {
        super(message);
    }

    public InvalidPartitionKeyException(String message, Throwable cause) {
        super(message, cause);
    }
}

package dk.cloudcreate.projections.checkpoint;

import dk.cloudcreate.projections.common.types.CheckpointKey;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

public class CheckpointStoreException extends RuntimeException {
    public final CheckpointKey checkpointKey;

    public CheckpointStoreException(String message, CheckpointKey checkpointKey) {
        this(message, null, checkpointKey);
    }

    public CheckpointStoreException(String message, Throwable cause, CheckpointKey checkpointKey) {
        super(enrichMessage(message, checkpointKey), cause);
        this.checkpointKey = checkpointKey;
    }

    private static String enrichMessage(String message, CheckpointKey checkpointKey) {
        String messageToLog = message != null ? " " + message : "";
        return msg("[{}]{}", checkpointKey, messageToLog);
    }
}

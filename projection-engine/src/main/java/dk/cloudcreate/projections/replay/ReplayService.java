package dk.cloudcreate.projections.replay;

/**
 * Replays the historical events of a projection from an {@link dk.cloudcreate.projections.eventstore.EventStore}
 * through the projection's registered handlers, independently of the projection engine.<br>
 * The events are read from the stream named after the projection. A running engine isn't affected by a replay,
 * but both write the same checkpoints, so a projection should not be replayed while the engine is projecting it.
 */
public interface ReplayService {
    /**
     * Replay a projection
     *
     * @param projectionName the name of the projection
     * @param options        the replay options
     * @return the outcome of the replay
     * @throws IllegalArgumentException   if the projectionName is null or blank
     * @throws ProjectionReplayException  if no projection with the given name is registered
     * @throws dk.cloudcreate.projections.checkpoint.CheckpointStoreException if the checkpoint can't be read, reset or saved
     */
    ReplayResult replay(String projectionName, ReplayOptions options);
}

package dk.cloudcreate.projections.checkpoint.postgresql;

import dk.cloudcreate.projections.checkpoint.*;
import dk.cloudcreate.projections.common.types.CheckpointKey;
import org.jdbi.v3.core.Jdbi;
import org.slf4j.*;

import java.time.*;
import java.util.Optional;
import java.util.regex.Pattern;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Postgresql version of the {@link CheckpointStore} interface.<br>
 * Checkpoints are stored in a single table (default name {@value #DEFAULT_CHECKPOINTS_TABLE_NAME}), which is created if it doesn't exist.
 * Saving a checkpoint is an atomic upsert (<code>INSERT ... ON CONFLICT ... DO UPDATE</code>), so concurrent writers
 * never fail with a duplicate key.
 */
public class PostgresqlCheckpointStore implements CheckpointStore {
    private static final Logger  log                            = LoggerFactory.getLogger(PostgresqlCheckpointStore.class);
    public static final  String  DEFAULT_CHECKPOINTS_TABLE_NAME = "projection_checkpoints";
    private static final Pattern VALID_TABLE_NAME               = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");

    private final Jdbi   jdbi;
    private final String checkpointsTableName;

    public PostgresqlCheckpointStore(Jdbi jdbi) {
        this(jdbi, Optional.empty());
    }

    /**
     * @param jdbi                 the jdbi instance
     * @param checkpointsTableName the name of the table where the checkpoints will be stored. If {@link Optional#empty()} then {@link #DEFAULT_CHECKPOINTS_TABLE_NAME} is used
     */
    @SuppressWarnings("OptionalUsedAsFieldOrParameterType")
    public PostgresqlCheckpointStore(Jdbi jdbi, Optional<String> checkpointsTableName) {
        this.jdbi = requireNonNull(jdbi, "You must supply a jdbi instance");
        requireNonNull(checkpointsTableName, "No checkpointsTableName option provided");
        this.checkpointsTableName = checkpointsTableName.orElse(DEFAULT_CHECKPOINTS_TABLE_NAME);
        requireTrue(VALID_TABLE_NAME.matcher(this.checkpointsTableName).matches(),
                    msg("Invalid checkpointsTableName '{}'. Only letters, digits and underscores are allowed", this.checkpointsTableName));
        initializeCheckpointsTable();
    }

    protected void initializeCheckpointsTable() {
        jdbi.useTransaction(handle -> {
            handle.execute("CREATE TABLE IF NOT EXISTS " + checkpointsTableName + " (\n" +
                                   "checkpoint_key TEXT NOT NULL,\n" +                 // projectionName or projectionName:partitionKey
                                   "position BIGINT NOT NULL,\n" +                     // the position of the last successfully processed event
                                   "updated_ts TIMESTAMP WITH TIME ZONE NOT NULL,\n" +
                                   "PRIMARY KEY (checkpoint_key)\n" +
                                   ")");
            log.info("Ensured the '{}' checkpoints table exists", checkpointsTableName);

            var indexName = checkpointsTableName + "_updated_ts_index";
            handle.execute("CREATE INDEX IF NOT EXISTS " + indexName + " ON " + checkpointsTableName + " (updated_ts)");
            log.debug("Ensured the '{}' index on checkpoints table '{}' exists", indexName, checkpointsTableName);
        });
    }

    @Override
    public Optional<Long> getCheckpoint(CheckpointKey checkpointKey) {
        requireNonNull(checkpointKey, "No checkpointKey provided");
        try {
            return jdbi.withHandle(handle -> handle.createQuery("SELECT position FROM " + checkpointsTableName + " WHERE checkpoint_key = :checkpoint_key")
                                                   .bind("checkpoint_key", checkpointKey.toString())
                                                   .mapTo(Long.class)
                                                   .findOne());
        } catch (Exception e) {
            throw new CheckpointStoreException("Failed to get checkpoint", e, checkpointKey);
        }
    }

    @Override
    public void saveCheckpoint(CheckpointKey checkpointKey, long position) {
        requireNonNull(checkpointKey, "No checkpointKey provided");
        try {
            jdbi.useHandle(handle -> handle.createUpdate("INSERT INTO " + checkpointsTableName + " (checkpoint_key, position, updated_ts)\n" +
                                                                 "VALUES (:checkpoint_key, :position, :updated_ts)\n" +
                                                                 "ON CONFLICT (checkpoint_key) DO UPDATE SET\n" +
                                                                 "position = EXCLUDED.position, updated_ts = EXCLUDED.updated_ts")
                                           .bind("checkpoint_key", checkpointKey.toString())
                                           .bind("position", position)
                                           .bind("updated_ts", OffsetDateTime.now(Clock.systemUTC()))
                                           .execute());
            log.trace("[{}] Saved checkpoint {}", checkpointKey, position);
        } catch (Exception e) {
            throw new CheckpointStoreException(msg("Failed to save checkpoint {}", position), e, checkpointKey);
        }
    }

    @Override
    public void resetCheckpoint(CheckpointKey checkpointKey) {
        requireNonNull(checkpointKey, "No checkpointKey provided");
        try {
            var rowsUpdated = jdbi.withHandle(handle -> handle.createUpdate("DELETE FROM " + checkpointsTableName + " WHERE checkpoint_key = :checkpoint_key")
                                                              .bind("checkpoint_key", checkpointKey.toString())
                                                              .execute());
            log.debug("[{}] Reset checkpoint. Deleted {} row(s)", checkpointKey, rowsUpdated);
        } catch (Exception e) {
            throw new CheckpointStoreException("Failed to reset checkpoint", e, checkpointKey);
        }
    }
}

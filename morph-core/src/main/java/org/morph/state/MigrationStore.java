package org.morph.state;

import org.morph.model.MigrationRecord;
import org.morph.model.MigrationStatus;
import org.morph.model.Schema;

import java.util.List;
import java.util.Optional;

/**
 * Durable, append-mostly history of migrations per schema.
 */
public interface MigrationStore {

    /**
     * Creates the structures the store needs. Safe to call on an initialized store.
     */
    void init();

    /**
     * Inserts a new record, or updates the status and completed snapshot of an existing one.
     * The write is a single atomic statement.
     *
     * @return the record as stored, with id, parent and timestamps populated
     * @throws org.morph.exception.AlreadyActiveException if inserting would create a second
     *         in-progress record for the schema
     */
    MigrationRecord save(MigrationRecord record);

    Optional<MigrationRecord> latest(String schemaName);

    Optional<MigrationRecord> latestCompleted(String schemaName);

    /**
     * Moves the in-progress record of {@code schemaName} to a terminal status.
     *
     * @throws org.morph.exception.NoActiveMigrationException if no record is in progress
     */
    void setStatus(String schemaName, MigrationStatus status, Schema completedSchema);

    /**
     * @return every record of the schema, oldest first
     */
    List<MigrationRecord> history(String schemaName);
}

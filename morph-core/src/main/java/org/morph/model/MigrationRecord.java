package org.morph.model;

import lombok.Builder;
import lombok.Value;
import org.morph.migration.Migration;

import java.time.Instant;

/**
 * One migration attempt against a schema, as persisted by the migration store.
 * {@code id}, {@code parent} and the timestamps are assigned by the store on insert.
 */
@Value
@Builder(toBuilder = true)
public class MigrationRecord {
    Long id;
    String schemaName;
    String name;
    String parent;
    Migration migration;
    MigrationStatus status;
    Schema startedSchema;
    Schema completedSchema;
    Instant createdAt;
    Instant updatedAt;

    public boolean isInProgress() {
        return status == MigrationStatus.IN_PROGRESS;
    }

    public boolean isNew() {
        return id == null;
    }
}

package org.morph.state;

import lombok.extern.slf4j.Slf4j;
import org.morph.exception.AlreadyActiveException;
import org.morph.exception.InvalidMigrationException;
import org.morph.exception.NoActiveMigrationException;
import org.morph.exception.NotFoundException;
import org.morph.introspect.PostgresSchemaIntrospector;
import org.morph.introspect.SchemaIntrospector;
import org.morph.migration.Migration;
import org.morph.model.MigrationRecord;
import org.morph.model.MigrationStatus;
import org.morph.model.Schema;
import org.morph.model.SchemaStatus;
import org.morph.model.SchemaVerification;
import org.morph.state.guard.AdvisoryLockGuard;
import org.morph.state.guard.ConcurrencyGuard;
import org.morph.state.guard.GuardLease;

import javax.sql.DataSource;
import java.util.List;
import java.util.Optional;

/**
 * Migration lifecycle per schema: {@code start} opens a migration against the live
 * schema, {@code complete} or {@code rollback} closes it. At most one migration is in
 * progress per schema at any time.
 *
 * <p>The guard lease only covers the check-and-insert inside {@link #start}; between
 * {@code start} and {@code complete}/{@code rollback} the in-progress record itself
 * marks the schema as busy.
 */
@Slf4j
public class MigrationState {

    private final SchemaIntrospector introspector;
    private final MigrationStore store;
    private final ConcurrencyGuard guard;
    private final SnapshotCodec codec;

    public MigrationState(SchemaIntrospector introspector, MigrationStore store, ConcurrencyGuard guard) {
        this.introspector = introspector;
        this.store = store;
        this.guard = guard;
        this.codec = new SnapshotCodec();
    }

    /**
     * Wires the PostgreSQL implementations over one data source.
     */
    public static MigrationState postgres(DataSource dataSource, String stateSchema, int queryTimeoutSeconds) {
        return new MigrationState(
                new PostgresSchemaIntrospector(dataSource, queryTimeoutSeconds),
                new JdbcMigrationStore(dataSource, stateSchema, queryTimeoutSeconds),
                new AdvisoryLockGuard(dataSource));
    }

    public void init() {
        store.init();
        log.info("Migration state initialized");
    }

    /**
     * Opens a migration on {@code schemaName} and returns the live schema it starts from.
     * The caller applies the migration's DDL and then calls {@link #complete} or {@link #rollback}.
     */
    public Schema start(String schemaName, Migration migration) {
        String operation = "start migration";
        requireSchemaName(schemaName, operation);
        if (migration == null) {
            throw new InvalidMigrationException(schemaName, operation, List.of("migration is required"));
        }
        List<String> problems = migration.validate();
        if (!problems.isEmpty()) {
            throw new InvalidMigrationException(schemaName, operation, problems);
        }

        try (GuardLease lease = guard.acquire(schemaName)) {
            if (store.latest(schemaName).filter(MigrationRecord::isInProgress).isPresent()) {
                throw new AlreadyActiveException(schemaName, operation);
            }
            if (isApplied(schemaName, migration.getName())) {
                throw new InvalidMigrationException(schemaName, operation,
                        List.of("migration '" + migration.getName() + "' has already been applied"));
            }

            Schema baseline = introspector.readSchema(schemaName);
            MigrationRecord record = store.save(MigrationRecord.builder()
                    .schemaName(schemaName)
                    .name(migration.getName())
                    .migration(migration)
                    .status(MigrationStatus.IN_PROGRESS)
                    .startedSchema(baseline)
                    .build());

            log.info("Started migration '{}' on schema '{}' with {} operations (parent: {})",
                    record.getName(), schemaName, migration.getOperations().size(), record.getParent());
            return baseline;
        }
    }

    /**
     * Records the active migration as complete, storing the live schema it produced.
     */
    public Schema complete(String schemaName) {
        requireSchemaName(schemaName, "complete migration");
        MigrationRecord active = activeMigration(schemaName)
                .orElseThrow(() -> new NoActiveMigrationException(schemaName, "complete migration"));

        Schema result = introspector.readSchema(schemaName);
        store.setStatus(schemaName, MigrationStatus.COMPLETE, result);

        log.info("Completed migration '{}' on schema '{}'", active.getName(), schemaName);
        return result;
    }

    /**
     * Records the active migration as rolled back. Undoing its DDL is the executor's job.
     */
    public void rollback(String schemaName) {
        requireSchemaName(schemaName, "roll back migration");
        store.setStatus(schemaName, MigrationStatus.ROLLED_BACK, null);
        log.info("Rolled back active migration on schema '{}'", schemaName);
    }

    public Schema readSchema(String schemaName) {
        return introspector.readSchema(schemaName);
    }

    public Optional<MigrationRecord> activeMigration(String schemaName) {
        return store.latest(schemaName).filter(MigrationRecord::isInProgress);
    }

    public boolean isActiveMigrationPeriod(String schemaName) {
        return activeMigration(schemaName).isPresent();
    }

    /**
     * @return name of the latest completed migration
     */
    public Optional<String> latestVersion(String schemaName) {
        return store.latestCompleted(schemaName).map(MigrationRecord::getName);
    }

    /**
     * @return name of the completed migration before the latest one
     */
    public Optional<String> previousVersion(String schemaName) {
        List<MigrationRecord> completed = store.history(schemaName).stream()
                .filter(r -> r.getStatus() == MigrationStatus.COMPLETE)
                .toList();
        if (completed.size() < 2) {
            return Optional.empty();
        }
        return Optional.of(completed.get(completed.size() - 2).getName());
    }

    public List<MigrationRecord> history(String schemaName) {
        return store.history(schemaName);
    }

    public SchemaStatus status(String schemaName) {
        SchemaStatus.State state = store.latest(schemaName)
                .map(r -> switch (r.getStatus()) {
                    case IN_PROGRESS -> SchemaStatus.State.IN_PROGRESS;
                    case COMPLETE -> SchemaStatus.State.COMPLETE;
                    case ROLLED_BACK -> SchemaStatus.State.ROLLED_BACK;
                })
                .orElse(SchemaStatus.State.NO_MIGRATIONS);

        return SchemaStatus.builder()
                .schema(schemaName)
                .version(latestVersion(schemaName).orElse(null))
                .state(state)
                .build();
    }

    /**
     * Compares the live schema with the snapshot left by the latest completed migration.
     *
     * @return empty when no migration has completed on the schema yet
     */
    public Optional<SchemaVerification> verify(String schemaName) {
        Optional<MigrationRecord> latest = store.latestCompleted(schemaName);
        if (latest.isEmpty()) {
            return Optional.empty();
        }

        Schema expected = latest.get().getCompletedSchema();
        Schema actual = introspector.readSchema(schemaName);
        boolean upToDate = expected.equals(actual);
        if (!upToDate) {
            log.warn("Schema '{}' has drifted from migration '{}'", schemaName, latest.get().getName());
        }

        return Optional.of(SchemaVerification.builder()
                .schema(schemaName)
                .version(latest.get().getName())
                .expectedHash(codec.hash(expected))
                .actualHash(codec.hash(actual))
                .upToDate(upToDate)
                .build());
    }

    private static void requireSchemaName(String schemaName, String operation) {
        if (schemaName == null || schemaName.isBlank()) {
            throw new NotFoundException(String.valueOf(schemaName), operation);
        }
    }

    private boolean isApplied(String schemaName, String migrationName) {
        return store.history(schemaName).stream()
                .anyMatch(r -> r.getStatus() == MigrationStatus.COMPLETE && r.getName().equals(migrationName));
    }
}

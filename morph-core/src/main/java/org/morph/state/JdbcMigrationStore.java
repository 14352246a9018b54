package org.morph.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.morph.exception.AlreadyActiveException;
import org.morph.exception.NoActiveMigrationException;
import org.morph.exception.StoreException;
import org.morph.model.MigrationRecord;
import org.morph.model.MigrationStatus;
import org.morph.model.Schema;
import org.morph.options.MorphOptions;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL-backed migration store. Records live in {@code <stateSchema>.migrations};
 * snapshots and migration definitions are stored as {@code jsonb}.
 */
@Slf4j
public class JdbcMigrationStore implements MigrationStore {

    private static final String UNIQUE_VIOLATION = "23505";

    private final DataSource dataSource;
    private final String stateSchema;
    private final StoreQueries queries;
    private final SnapshotCodec codec;
    private final int queryTimeoutSeconds;

    public JdbcMigrationStore(DataSource dataSource) {
        this(dataSource, MorphOptions.State.SCHEMA_DEFAULT, MorphOptions.State.QUERY_TIMEOUT_DEFAULT);
    }

    public JdbcMigrationStore(DataSource dataSource, String stateSchema, int queryTimeoutSeconds) {
        this.dataSource = dataSource;
        this.stateSchema = stateSchema;
        this.queries = new StoreQueries(stateSchema);
        this.codec = new SnapshotCodec();
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }

    @Override
    public void init() {
        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                // Serialize concurrent init calls; CREATE ... IF NOT EXISTS alone is not race-free.
                try (PreparedStatement lock = conn.prepareStatement(queries.initLock)) {
                    lock.setString(1, "morph-init:" + stateSchema);
                    lock.execute();
                }
                try (Statement stmt = conn.createStatement()) {
                    stmt.setQueryTimeout(queryTimeoutSeconds);
                    stmt.execute(queries.createSchema);
                    stmt.execute(queries.createTable);
                    stmt.execute(queries.createActiveIndex);
                    stmt.execute(queries.createHistoryIndex);
                }
                conn.commit();
            } catch (SQLException e) {
                try {
                    conn.rollback();
                } catch (SQLException rollbackFailure) {
                    e.addSuppressed(rollbackFailure);
                }
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
            log.debug("State schema '{}' is initialized", stateSchema);
        } catch (SQLException e) {
            throw new StoreException("Failed to initialize state schema '" + stateSchema + "'", e);
        }
    }

    @Override
    public MigrationRecord save(MigrationRecord record) {
        return record.isNew() ? insert(record) : update(record);
    }

    private MigrationRecord insert(MigrationRecord record) {
        String schemaName = record.getSchemaName();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = prepare(conn, queries.insert)) {
            stmt.setString(1, schemaName);
            stmt.setString(2, record.getName());
            stmt.setString(3, schemaName);
            stmt.setString(4, codec.writeMigration(record.getMigration()));
            stmt.setString(5, record.getStatus().getDbValue());
            stmt.setString(6, codec.writeSchema(record.getStartedSchema()));
            stmt.setString(7, codec.writeSchema(record.getCompletedSchema()));
            try (ResultSet rs = stmt.executeQuery()) {
                rs.next();
                return mapRecord(rs);
            }
        } catch (SQLException e) {
            if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                throw new AlreadyActiveException(schemaName, "save migration", e);
            }
            throw new StoreException(schemaName, "save migration", e);
        } catch (JsonProcessingException e) {
            throw new StoreException(schemaName, "save migration", "cannot serialize record", e);
        }
    }

    private MigrationRecord update(MigrationRecord record) {
        String schemaName = record.getSchemaName();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = prepare(conn, queries.update)) {
            stmt.setString(1, record.getStatus().getDbValue());
            stmt.setString(2, codec.writeSchema(record.getCompletedSchema()));
            stmt.setLong(3, record.getId());
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    throw new StoreException(schemaName, "save migration",
                            "record " + record.getId() + " does not exist", null);
                }
                return mapRecord(rs);
            }
        } catch (SQLException e) {
            if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                throw new AlreadyActiveException(schemaName, "save migration", e);
            }
            throw new StoreException(schemaName, "save migration", e);
        } catch (JsonProcessingException e) {
            throw new StoreException(schemaName, "save migration", "cannot serialize record", e);
        }
    }

    @Override
    public Optional<MigrationRecord> latest(String schemaName) {
        return queryRecords(queries.latest, schemaName, "read latest migration").stream().findFirst();
    }

    @Override
    public Optional<MigrationRecord> latestCompleted(String schemaName) {
        return queryRecords(queries.latestCompleted, schemaName, "read latest migration").stream().findFirst();
    }

    @Override
    public List<MigrationRecord> history(String schemaName) {
        return queryRecords(queries.history, schemaName, "read migration history");
    }

    @Override
    public void setStatus(String schemaName, MigrationStatus status, Schema completedSchema) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Cannot transition an active migration to " + status);
        }
        String operation = "set migration status to " + status.getDbValue();

        int updated;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = prepare(conn, queries.setStatus)) {
            stmt.setString(1, status.getDbValue());
            stmt.setString(2, codec.writeSchema(completedSchema));
            stmt.setString(3, schemaName);
            updated = stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException(schemaName, operation, e);
        } catch (JsonProcessingException e) {
            throw new StoreException(schemaName, operation, "cannot serialize completed schema", e);
        }

        if (updated == 0) {
            throw new NoActiveMigrationException(schemaName, operation);
        }
    }

    private List<MigrationRecord> queryRecords(String sql, String schemaName, String operation) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = prepare(conn, sql)) {
            stmt.setString(1, schemaName);
            List<MigrationRecord> records = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    records.add(mapRecord(rs));
                }
            }
            return records;
        } catch (SQLException e) {
            throw new StoreException(schemaName, operation, e);
        } catch (JsonProcessingException e) {
            throw new StoreException(schemaName, operation, "cannot deserialize record", e);
        }
    }

    private PreparedStatement prepare(Connection conn, String sql) throws SQLException {
        PreparedStatement stmt = conn.prepareStatement(sql);
        stmt.setQueryTimeout(queryTimeoutSeconds);
        return stmt;
    }

    private MigrationRecord mapRecord(ResultSet rs) throws SQLException, JsonProcessingException {
        return MigrationRecord.builder()
                .id(rs.getLong("id"))
                .schemaName(rs.getString("schema_name"))
                .name(rs.getString("name"))
                .parent(rs.getString("parent"))
                .migration(codec.readMigration(rs.getString("migration")))
                .status(MigrationStatus.fromDbValue(rs.getString("status")))
                .startedSchema(codec.readSchema(rs.getString("started_schema")))
                .completedSchema(codec.readSchema(rs.getString("completed_schema")))
                .createdAt(toInstant(rs.getObject("created_at", OffsetDateTime.class)))
                .updatedAt(toInstant(rs.getObject("updated_at", OffsetDateTime.class)))
                .build();
    }

    private static Instant toInstant(OffsetDateTime value) {
        return value == null ? null : value.toInstant();
    }
}

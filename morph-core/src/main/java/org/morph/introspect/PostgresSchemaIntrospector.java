package org.morph.introspect;

import lombok.extern.slf4j.Slf4j;
import org.morph.exception.IntrospectionException;
import org.morph.exception.NotFoundException;
import org.morph.introspect.CatalogSnapshot.ColumnRow;
import org.morph.introspect.CatalogSnapshot.ConstraintRow;
import org.morph.introspect.CatalogSnapshot.ConstraintType;
import org.morph.introspect.CatalogSnapshot.IndexRow;
import org.morph.introspect.CatalogSnapshot.TableRow;
import org.morph.model.Schema;

import javax.sql.DataSource;
import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads schema structure from the PostgreSQL system catalogs.
 */
@Slf4j
public class PostgresSchemaIntrospector implements SchemaIntrospector {

    private static final String OPERATION = "read schema";

    private final DataSource dataSource;
    private final SchemaAssembler assembler;
    private final int queryTimeoutSeconds;

    public PostgresSchemaIntrospector(DataSource dataSource) {
        this(dataSource, 0);
    }

    public PostgresSchemaIntrospector(DataSource dataSource, int queryTimeoutSeconds) {
        this.dataSource = dataSource;
        this.assembler = new SchemaAssembler();
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }

    /**
     * Reads the schema in its own read-only, repeatable-read transaction so that all
     * catalog queries observe the same snapshot.
     */
    @Override
    public Schema readSchema(String schemaName) {
        requireSchemaName(schemaName);

        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            int isolation = conn.getTransactionIsolation();
            conn.setAutoCommit(false);
            conn.setReadOnly(true);
            conn.setTransactionIsolation(Connection.TRANSACTION_REPEATABLE_READ);
            try {
                Schema schema = readSchema(conn, schemaName);
                conn.commit();
                return schema;
            } catch (RuntimeException | SQLException e) {
                rollbackQuietly(conn, e);
                throw e;
            } finally {
                conn.setReadOnly(false);
                conn.setTransactionIsolation(isolation);
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new IntrospectionException(schemaName, OPERATION, e);
        }
    }

    /**
     * Reads the schema on a connection owned by the caller, inside whatever transaction
     * the caller has open.
     */
    public Schema readSchema(Connection conn, String schemaName) {
        requireSchemaName(schemaName);

        try {
            if (!schemaExists(conn, schemaName)) {
                throw new NotFoundException(schemaName, OPERATION);
            }

            CatalogSnapshot snapshot = new CatalogSnapshot(
                    schemaName,
                    query(conn, CatalogQueries.TABLES, schemaName, this::mapTable),
                    query(conn, CatalogQueries.COLUMNS, schemaName, this::mapColumn),
                    query(conn, CatalogQueries.INDEXES, schemaName, this::mapIndex),
                    query(conn, CatalogQueries.CONSTRAINTS, schemaName, this::mapConstraint));

            log.debug("Read {} tables, {} columns, {} indexes and {} constraints from schema '{}'",
                    snapshot.tables().size(), snapshot.columns().size(),
                    snapshot.indexes().size(), snapshot.constraints().size(), schemaName);

            return assembler.assemble(snapshot);
        } catch (SQLException e) {
            throw new IntrospectionException(schemaName, OPERATION, e);
        }
    }

    private boolean schemaExists(Connection conn, String schemaName) throws SQLException {
        try (PreparedStatement stmt = prepare(conn, CatalogQueries.SCHEMA_EXISTS, schemaName);
             ResultSet rs = stmt.executeQuery()) {
            return rs.next();
        }
    }

    private <T> List<T> query(Connection conn, String sql, String schemaName, RowMapper<T> mapper) throws SQLException {
        List<T> rows = new ArrayList<>();
        try (PreparedStatement stmt = prepare(conn, sql, schemaName);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                rows.add(mapper.map(rs));
            }
        }
        return rows;
    }

    private PreparedStatement prepare(Connection conn, String sql, String schemaName) throws SQLException {
        PreparedStatement stmt = conn.prepareStatement(sql);
        stmt.setQueryTimeout(queryTimeoutSeconds);
        stmt.setString(1, schemaName);
        return stmt;
    }

    private TableRow mapTable(ResultSet rs) throws SQLException {
        return new TableRow(rs.getLong("oid"), rs.getString("relname"), rs.getString("comment"));
    }

    private ColumnRow mapColumn(ResultSet rs) throws SQLException {
        return new ColumnRow(
                rs.getString("table_name"),
                rs.getString("column_name"),
                rs.getString("data_type"),
                rs.getBoolean("nullable"),
                rs.getString("default_value"),
                rs.getString("comment"));
    }

    private IndexRow mapIndex(ResultSet rs) throws SQLException {
        return new IndexRow(rs.getString("table_name"), rs.getString("index_name"));
    }

    private ConstraintRow mapConstraint(ResultSet rs) throws SQLException {
        return new ConstraintRow(
                rs.getString("table_name"),
                rs.getString("constraint_name"),
                ConstraintType.fromCode(rs.getString("constraint_type")),
                stringList(rs.getArray("columns")),
                rs.getString("referenced_table"),
                stringList(rs.getArray("referenced_columns")),
                rs.getString("definition"));
    }

    private static List<String> stringList(Array array) throws SQLException {
        if (array == null) {
            return List.of();
        }
        try {
            Object[] values = (Object[]) array.getArray();
            return Arrays.stream(values).map(String::valueOf).toList();
        } finally {
            array.free();
        }
    }

    /**
     * Rolls back without letting a rollback failure replace the error being handled.
     */
    private static void rollbackQuietly(Connection conn, Exception failure) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            failure.addSuppressed(e);
        }
    }

    private static void requireSchemaName(String schemaName) {
        if (schemaName == null || schemaName.isBlank()) {
            throw new NotFoundException(String.valueOf(schemaName), OPERATION);
        }
    }

    @FunctionalInterface
    private interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }
}

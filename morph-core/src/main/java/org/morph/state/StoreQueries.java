package org.morph.state;

import java.util.regex.Pattern;

/**
 * SQL for the state tables, rendered for a configurable state schema.
 */
final class StoreQueries {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,62}");

    private static final String COLUMNS =
            "id, schema_name, name, parent, migration, status, started_schema, completed_schema, created_at, updated_at";

    final String initLock;
    final String createSchema;
    final String createTable;
    final String createActiveIndex;
    final String createHistoryIndex;
    final String insert;
    final String update;
    final String setStatus;
    final String latest;
    final String latestCompleted;
    final String history;

    StoreQueries(String stateSchema) {
        if (stateSchema == null || !IDENTIFIER.matcher(stateSchema).matches()) {
            throw new IllegalArgumentException("Invalid state schema name: " + stateSchema);
        }
        String schema = "\"" + stateSchema + "\"";
        String table = schema + ".migrations";

        this.initLock = "SELECT pg_advisory_xact_lock(hashtext(?))";
        this.createSchema = "CREATE SCHEMA IF NOT EXISTS " + schema;
        this.createTable = """
                CREATE TABLE IF NOT EXISTS %s (
                    id               BIGSERIAL PRIMARY KEY,
                    schema_name      TEXT NOT NULL,
                    name             TEXT NOT NULL,
                    parent           TEXT,
                    migration        JSONB NOT NULL,
                    status           TEXT NOT NULL CHECK (status IN ('in_progress', 'complete', 'rolled_back')),
                    started_schema   JSONB NOT NULL,
                    completed_schema JSONB,
                    created_at       TIMESTAMPTZ NOT NULL DEFAULT now(),
                    updated_at       TIMESTAMPTZ NOT NULL DEFAULT now()
                )
                """.formatted(table);
        // At most one in-progress migration per schema; the insert fails on a concurrent start.
        this.createActiveIndex = "CREATE UNIQUE INDEX IF NOT EXISTS only_one_active ON " + table
                + " (schema_name) WHERE status = 'in_progress'";
        this.createHistoryIndex = "CREATE INDEX IF NOT EXISTS migrations_history ON " + table + " (schema_name, id)";

        this.insert = """
                INSERT INTO %1$s (schema_name, name, parent, migration, status, started_schema, completed_schema)
                VALUES (?, ?,
                        (SELECT name FROM %1$s WHERE schema_name = ? AND status = 'complete' ORDER BY id DESC LIMIT 1),
                        ?::jsonb, ?, ?::jsonb, ?::jsonb)
                RETURNING %2$s
                """.formatted(table, COLUMNS);
        this.update = """
                UPDATE %s
                SET status = ?, completed_schema = ?::jsonb, updated_at = now()
                WHERE id = ?
                RETURNING %s
                """.formatted(table, COLUMNS);
        this.setStatus = """
                UPDATE %s
                SET status = ?, completed_schema = ?::jsonb, updated_at = now()
                WHERE schema_name = ? AND status = 'in_progress'
                """.formatted(table);
        this.latest = "SELECT " + COLUMNS + " FROM " + table + " WHERE schema_name = ? ORDER BY id DESC LIMIT 1";
        this.latestCompleted = "SELECT " + COLUMNS + " FROM " + table
                + " WHERE schema_name = ? AND status = 'complete' ORDER BY id DESC LIMIT 1";
        this.history = "SELECT " + COLUMNS + " FROM " + table + " WHERE schema_name = ? ORDER BY id";
    }
}

package org.morph.introspect;

/**
 * PostgreSQL catalog queries used by {@link PostgresSchemaIntrospector}.
 * Every query takes the schema name as its only parameter.
 */
final class CatalogQueries {
    private CatalogQueries() {}

    static final String SCHEMA_EXISTS = """
            SELECT 1
            FROM pg_catalog.pg_namespace
            WHERE nspname = ?
            """;

    static final String TABLES = """
            SELECT c.oid,
                   c.relname,
                   obj_description(c.oid, 'pg_class') AS comment
            FROM pg_catalog.pg_class c
            JOIN pg_catalog.pg_namespace n ON n.oid = c.relnamespace
            WHERE n.nspname = ?
              AND c.relkind IN ('r', 'p')
            ORDER BY c.relname
            """;

    static final String COLUMNS = """
            SELECT c.relname AS table_name,
                   a.attname AS column_name,
                   format_type(a.atttypid, a.atttypmod) AS data_type,
                   NOT a.attnotnull AS nullable,
                   pg_get_expr(d.adbin, d.adrelid) AS default_value,
                   col_description(c.oid, a.attnum) AS comment
            FROM pg_catalog.pg_attribute a
            JOIN pg_catalog.pg_class c ON c.oid = a.attrelid
            JOIN pg_catalog.pg_namespace n ON n.oid = c.relnamespace
            LEFT JOIN pg_catalog.pg_attrdef d ON d.adrelid = a.attrelid AND d.adnum = a.attnum
            WHERE n.nspname = ?
              AND c.relkind IN ('r', 'p')
              AND a.attnum > 0
              AND NOT a.attisdropped
            ORDER BY c.relname, a.attnum
            """;

    static final String INDEXES = """
            SELECT t.relname AS table_name,
                   i.relname AS index_name
            FROM pg_catalog.pg_index ix
            JOIN pg_catalog.pg_class i ON i.oid = ix.indexrelid
            JOIN pg_catalog.pg_class t ON t.oid = ix.indrelid
            JOIN pg_catalog.pg_namespace n ON n.oid = t.relnamespace
            WHERE n.nspname = ?
              AND t.relkind IN ('r', 'p')
            ORDER BY t.relname, i.relname
            """;

    // Key columns are resolved through WITH ORDINALITY so multi-column keys keep their declared order.
    static final String CONSTRAINTS = """
            SELECT t.relname AS table_name,
                   con.conname AS constraint_name,
                   con.contype::text AS constraint_type,
                   ARRAY(
                       SELECT a.attname
                       FROM unnest(con.conkey) WITH ORDINALITY AS k(attnum, ord)
                       JOIN pg_catalog.pg_attribute a ON a.attrelid = con.conrelid AND a.attnum = k.attnum
                       ORDER BY k.ord
                   ) AS columns,
                   rt.relname AS referenced_table,
                   ARRAY(
                       SELECT a.attname
                       FROM unnest(con.confkey) WITH ORDINALITY AS k(attnum, ord)
                       JOIN pg_catalog.pg_attribute a ON a.attrelid = con.confrelid AND a.attnum = k.attnum
                       ORDER BY k.ord
                   ) AS referenced_columns,
                   pg_get_constraintdef(con.oid) AS definition
            FROM pg_catalog.pg_constraint con
            JOIN pg_catalog.pg_class t ON t.oid = con.conrelid
            JOIN pg_catalog.pg_namespace n ON n.oid = t.relnamespace
            LEFT JOIN pg_catalog.pg_class rt ON rt.oid = con.confrelid
            WHERE n.nspname = ?
              AND t.relkind IN ('r', 'p')
              AND con.contype IN ('p', 'u', 'f', 'c')
            ORDER BY t.relname, con.conname
            """;
}

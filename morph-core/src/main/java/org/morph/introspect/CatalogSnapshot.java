package org.morph.introspect;

import java.util.List;

/**
 * Raw catalog rows for one schema, read in a single transaction.
 */
public record CatalogSnapshot(
        String schemaName,
        List<TableRow> tables,
        List<ColumnRow> columns,
        List<IndexRow> indexes,
        List<ConstraintRow> constraints
) {

    public record TableRow(long oid, String name, String comment) {}

    /** Rows arrive in attribute number order within each table. */
    public record ColumnRow(String table, String name, String type, boolean nullable,
                            String defaultValue, String comment) {}

    public record IndexRow(String table, String name) {}

    /**
     * One {@code pg_constraint} row. {@code columns} and {@code referencedColumns} are in
     * declared key order; {@code referencedTable} is null unless the type is a foreign key.
     */
    public record ConstraintRow(String table, String name, ConstraintType type, List<String> columns,
                                String referencedTable, List<String> referencedColumns,
                                String definition) {}

    public enum ConstraintType {
        PRIMARY_KEY('p'),
        UNIQUE('u'),
        FOREIGN_KEY('f'),
        CHECK('c');

        private final char code;

        ConstraintType(char code) {
            this.code = code;
        }

        public char getCode() {
            return code;
        }

        public static ConstraintType fromCode(String code) {
            if (code != null && code.length() == 1) {
                for (ConstraintType type : values()) {
                    if (type.code == code.charAt(0)) {
                        return type;
                    }
                }
            }
            throw new IllegalArgumentException("Unsupported constraint type: " + code);
        }
    }
}

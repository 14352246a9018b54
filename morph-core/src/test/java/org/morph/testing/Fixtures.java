package org.morph.testing;

import org.morph.migration.Migration;
import org.morph.migration.operation.ColumnDefinition;
import org.morph.migration.operation.OpAddColumn;
import org.morph.model.Column;
import org.morph.model.Index;
import org.morph.model.Schema;
import org.morph.model.Table;

/**
 * Small schema and migration values shared by tests.
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static Migration addColumnMigration(String name) {
        return Migration.builder()
                .name(name)
                .operation(OpAddColumn.builder()
                        .table("table1")
                        .column(ColumnDefinition.builder().name("test").type("text").nullable(true).build())
                        .build())
                .build();
    }

    public static Schema singleTableSchema(String schemaName) {
        return Schema.builder()
                .name(schemaName)
                .table("table1", Table.builder()
                        .name("table1")
                        .oid(16384)
                        .column("id", Column.builder().name("id").type("integer").nullable(false).unique(true).build())
                        .primaryKeyColumn("id")
                        .index("table1_pkey", Index.named("table1_pkey"))
                        .build())
                .build();
    }
}

package org.morph.introspect;

import org.morph.introspect.CatalogSnapshot.ColumnRow;
import org.morph.introspect.CatalogSnapshot.ConstraintRow;
import org.morph.introspect.CatalogSnapshot.ConstraintType;
import org.morph.introspect.CatalogSnapshot.IndexRow;
import org.morph.introspect.CatalogSnapshot.TableRow;
import org.morph.model.CheckConstraint;
import org.morph.model.Column;
import org.morph.model.ForeignKey;
import org.morph.model.Index;
import org.morph.model.Schema;
import org.morph.model.Table;
import org.morph.model.UniqueConstraint;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Maps raw catalog rows onto the schema model.
 */
public class SchemaAssembler {

    public Schema assemble(CatalogSnapshot snapshot) {
        Map<String, List<ColumnRow>> columnsByTable = groupByTable(snapshot.columns(), ColumnRow::table);
        Map<String, List<IndexRow>> indexesByTable = groupByTable(snapshot.indexes(), IndexRow::table);
        Map<String, List<ConstraintRow>> constraintsByTable = groupByTable(snapshot.constraints(), ConstraintRow::table);

        Schema.SchemaBuilder schema = Schema.builder().name(snapshot.schemaName());
        for (TableRow tableRow : snapshot.tables()) {
            Table table = assembleTable(tableRow,
                    columnsByTable.getOrDefault(tableRow.name(), List.of()),
                    indexesByTable.getOrDefault(tableRow.name(), List.of()),
                    constraintsByTable.getOrDefault(tableRow.name(), List.of()));
            schema.table(table.getName(), table);
        }
        return schema.build();
    }

    private Table assembleTable(TableRow tableRow, List<ColumnRow> columns,
                                List<IndexRow> indexes, List<ConstraintRow> constraints) {
        Table.TableBuilder table = Table.builder()
                .name(tableRow.name())
                .oid(tableRow.oid())
                .comment(tableRow.comment());

        Set<String> uniqueColumns = singleColumnKeys(constraints);
        for (ColumnRow row : columns) {
            table.column(row.name(), Column.builder()
                    .name(row.name())
                    .type(row.type())
                    .nullable(row.nullable())
                    .unique(uniqueColumns.contains(row.name()))
                    .defaultValue(row.defaultValue())
                    .comment(row.comment())
                    .build());
        }

        for (IndexRow row : indexes) {
            table.index(row.name(), Index.named(row.name()));
        }

        for (ConstraintRow row : constraints) {
            switch (row.type()) {
                case PRIMARY_KEY -> table.primaryKey(row.columns());
                case UNIQUE -> table.uniqueConstraint(row.name(), UniqueConstraint.builder()
                        .name(row.name())
                        .columns(row.columns())
                        .build());
                case FOREIGN_KEY -> table.foreignKey(row.name(), ForeignKey.builder()
                        .name(row.name())
                        .columns(row.columns())
                        .referencedTable(row.referencedTable())
                        .referencedColumns(row.referencedColumns())
                        .build());
                case CHECK -> table.checkConstraint(row.name(), CheckConstraint.builder()
                        .name(row.name())
                        .columns(row.columns())
                        .definition(row.definition())
                        .build());
            }
        }
        return table.build();
    }

    /**
     * Columns that alone make up a unique or primary key constraint. Members of
     * multi-column keys are not unique on their own.
     */
    private Set<String> singleColumnKeys(List<ConstraintRow> constraints) {
        Set<String> unique = new HashSet<>();
        for (ConstraintRow row : constraints) {
            boolean keyConstraint = row.type() == ConstraintType.PRIMARY_KEY || row.type() == ConstraintType.UNIQUE;
            if (keyConstraint && row.columns().size() == 1) {
                unique.add(row.columns().get(0));
            }
        }
        return unique;
    }

    private static <T> Map<String, List<T>> groupByTable(List<T> rows, Function<T, String> table) {
        return rows.stream().collect(Collectors.groupingBy(table));
    }
}

package org.morph.migration;

import org.morph.migration.operation.ColumnDefinition;
import org.morph.migration.operation.OpAddColumn;
import org.morph.migration.operation.OpAlterColumn;
import org.morph.migration.operation.OpCreateIndex;
import org.morph.migration.operation.OpCreateTable;
import org.morph.migration.operation.OpDropColumn;
import org.morph.migration.operation.OpDropConstraint;
import org.morph.migration.operation.OpDropIndex;
import org.morph.migration.operation.OpDropTable;
import org.morph.migration.operation.OpRawSql;
import org.morph.migration.operation.OpRenameTable;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders each operation as a one-line human readable summary.
 */
public class OperationDescriber implements OperationVisitor<String> {

    @Override
    public String visitCreateTable(OpCreateTable op) {
        String columns = op.getColumns().stream()
                .map(ColumnDefinition::getName)
                .collect(Collectors.joining(", "));
        return "create table " + op.getName() + " (" + columns + ")";
    }

    @Override
    public String visitDropTable(OpDropTable op) {
        return "drop table " + op.getName();
    }

    @Override
    public String visitRenameTable(OpRenameTable op) {
        return "rename table " + op.getFrom() + " to " + op.getTo();
    }

    @Override
    public String visitAddColumn(OpAddColumn op) {
        ColumnDefinition column = op.getColumn();
        return "add column " + column.getName() + " " + column.getType() + " to " + op.getTable();
    }

    @Override
    public String visitDropColumn(OpDropColumn op) {
        return "drop column " + op.getColumn() + " from " + op.getTable();
    }

    @Override
    public String visitAlterColumn(OpAlterColumn op) {
        List<String> changes = new ArrayList<>();
        if (op.getName() != null) {
            changes.add("rename to " + op.getName());
        }
        if (op.getType() != null) {
            changes.add("type " + op.getType());
        }
        if (op.getNullable() != null) {
            changes.add(op.getNullable() ? "drop not null" : "set not null");
        }
        if (op.getUnique() != null && op.getUnique()) {
            changes.add("add unique");
        }
        return "alter column " + op.getTable() + "." + op.getColumn() + ": " + String.join(", ", changes);
    }

    @Override
    public String visitCreateIndex(OpCreateIndex op) {
        return "create " + (op.isUnique() ? "unique " : "") + "index " + op.getName()
                + " on " + op.getTable() + " (" + String.join(", ", op.getColumns()) + ")";
    }

    @Override
    public String visitDropIndex(OpDropIndex op) {
        return "drop index " + op.getName();
    }

    @Override
    public String visitDropConstraint(OpDropConstraint op) {
        return "drop constraint " + op.getName() + " on " + op.getTable() + "." + op.getColumn();
    }

    @Override
    public String visitRawSql(OpRawSql op) {
        return "raw sql";
    }
}

package org.morph.migration.operation;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.morph.migration.OperationVisitor;

import java.util.ArrayList;
import java.util.List;

@Value
@Builder
@Jacksonized
public class OpAddColumn implements Operation {
    String table;
    ColumnDefinition column;
    /** Backfill expression for existing rows. */
    String up;

    @Override
    public OperationKind kind() {
        return OperationKind.ADD_COLUMN;
    }

    @Override
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        Validation.require(problems, table, "table");
        if (column == null) {
            problems.add("column is required");
        } else {
            problems.addAll(column.validate());
        }
        return problems;
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitAddColumn(this);
    }
}

package org.morph.migration.operation;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.morph.migration.OperationVisitor;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Value
@Builder
@Jacksonized
public class OpCreateTable implements Operation {
    String name;
    @Singular
    List<ColumnDefinition> columns;

    @Override
    public OperationKind kind() {
        return OperationKind.CREATE_TABLE;
    }

    @Override
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        Validation.require(problems, name, "table name");
        Validation.requireNotEmpty(problems, columns, "columns");
        Set<String> seen = new HashSet<>();
        for (ColumnDefinition column : columns) {
            problems.addAll(column.validate());
            if (column.getName() != null && !seen.add(column.getName())) {
                problems.add("duplicate column " + column.getName());
            }
        }
        return problems;
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitCreateTable(this);
    }
}

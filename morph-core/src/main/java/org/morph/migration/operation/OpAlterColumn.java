package org.morph.migration.operation;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.morph.migration.OperationVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * Changes one or more properties of an existing column. Unset properties are left as they are.
 */
@Value
@Builder
@Jacksonized
public class OpAlterColumn implements Operation {
    String table;
    String column;
    String name;
    String type;
    Boolean nullable;
    Boolean unique;
    String up;
    String down;

    @Override
    public OperationKind kind() {
        return OperationKind.ALTER_COLUMN;
    }

    @Override
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        Validation.require(problems, table, "table");
        Validation.require(problems, column, "column");
        if (name == null && type == null && nullable == null && unique == null) {
            problems.add("at least one of name, type, nullable or unique must be set");
        }
        return problems;
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitAlterColumn(this);
    }
}

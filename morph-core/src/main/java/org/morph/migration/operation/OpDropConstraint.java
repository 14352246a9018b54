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
public class OpDropConstraint implements Operation {
    String table;
    String column;
    String name;
    String up;
    String down;

    @Override
    public OperationKind kind() {
        return OperationKind.DROP_CONSTRAINT;
    }

    @Override
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        Validation.require(problems, table, "table");
        Validation.require(problems, column, "column");
        Validation.require(problems, name, "constraint name");
        return problems;
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitDropConstraint(this);
    }
}

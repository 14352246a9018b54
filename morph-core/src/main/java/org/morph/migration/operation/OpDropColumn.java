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
public class OpDropColumn implements Operation {
    String table;
    String column;
    /** Expression that repopulates the column if the drop is rolled back. */
    String down;

    @Override
    public OperationKind kind() {
        return OperationKind.DROP_COLUMN;
    }

    @Override
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        Validation.require(problems, table, "table");
        Validation.require(problems, column, "column");
        return problems;
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitDropColumn(this);
    }
}

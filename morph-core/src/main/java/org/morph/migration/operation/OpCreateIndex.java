package org.morph.migration.operation;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.morph.migration.OperationVisitor;

import java.util.ArrayList;
import java.util.List;

@Value
@Builder
@Jacksonized
public class OpCreateIndex implements Operation {
    String name;
    String table;
    @Singular
    List<String> columns;
    boolean unique;

    @Override
    public OperationKind kind() {
        return OperationKind.CREATE_INDEX;
    }

    @Override
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        Validation.require(problems, name, "index name");
        Validation.require(problems, table, "table");
        Validation.requireNotEmpty(problems, columns, "columns");
        return problems;
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitCreateIndex(this);
    }
}

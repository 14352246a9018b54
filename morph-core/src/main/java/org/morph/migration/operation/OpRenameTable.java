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
public class OpRenameTable implements Operation {
    String from;
    String to;

    @Override
    public OperationKind kind() {
        return OperationKind.RENAME_TABLE;
    }

    @Override
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        Validation.require(problems, from, "from");
        Validation.require(problems, to, "to");
        if (from != null && from.equals(to)) {
            problems.add("table is renamed to itself");
        }
        return problems;
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitRenameTable(this);
    }
}

package org.morph.migration;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.morph.migration.operation.Operation;

import java.util.ArrayList;
import java.util.List;

/**
 * A named, ordered sequence of operations submitted as one unit.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Migration {
    String name;
    @Singular
    List<Operation> operations;

    /**
     * Collects every structural problem with this migration. An empty result means
     * the migration can be started.
     */
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        if (name == null || name.isBlank()) {
            problems.add("migration name is required");
        }
        if (operations.isEmpty()) {
            problems.add("migration must contain at least one operation");
        }
        for (int i = 0; i < operations.size(); i++) {
            Operation op = operations.get(i);
            if (op == null) {
                problems.add("operation #" + (i + 1) + " is empty");
                continue;
            }
            for (String problem : op.validate()) {
                problems.add("operation #" + (i + 1) + " (" + op.kind().getTag() + "): " + problem);
            }
        }
        return problems;
    }

    public <R> List<R> replay(OperationVisitor<R> visitor) {
        return operations.stream().map(op -> op.accept(visitor)).toList();
    }
}

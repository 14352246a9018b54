package org.morph.migration.operation;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.List;

/**
 * Column as declared by a migration author, used by {@code create_table} and
 * {@code add_column}.
 */
@Value
@Builder
@Jacksonized
public class ColumnDefinition {
    String name;
    String type;
    boolean nullable;
    boolean unique;
    boolean pk;
    String defaultValue;
    String comment;

    List<String> validate() {
        List<String> problems = new ArrayList<>();
        Validation.require(problems, name, "column name");
        Validation.require(problems, type, "column type of " + (name == null ? "<unnamed>" : name));
        if (pk && nullable) {
            problems.add("primary key column " + name + " cannot be nullable");
        }
        return problems;
    }
}

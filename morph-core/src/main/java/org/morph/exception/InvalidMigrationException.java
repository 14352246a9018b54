package org.morph.exception;

import java.util.List;

public class InvalidMigrationException extends MorphException {

    private final List<String> problems;

    public InvalidMigrationException(String message) {
        super(message);
        this.problems = List.of(message);
    }

    public InvalidMigrationException(String message, Throwable cause) {
        super(message, cause);
        this.problems = List.of(message);
    }

    public InvalidMigrationException(String schemaName, String operation, List<String> problems) {
        super(describe(operation, schemaName, "invalid migration: " + String.join("; ", problems)),
                schemaName, operation, null);
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}

package org.morph.exception;

public class NoActiveMigrationException extends MorphException {

    public NoActiveMigrationException(String schemaName, String operation) {
        super(describe(operation, schemaName, "no migration is in progress"), schemaName, operation, null);
    }
}

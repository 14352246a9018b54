package org.morph.exception;

/**
 * Another migration is already active on the schema. Callers should report this
 * to the user rather than retry.
 */
public class AlreadyActiveException extends MorphException {

    public AlreadyActiveException(String schemaName, String operation) {
        this(schemaName, operation, null);
    }

    public AlreadyActiveException(String schemaName, String operation, Throwable cause) {
        super(describe(operation, schemaName, "a migration is already active"), schemaName, operation, cause);
    }
}

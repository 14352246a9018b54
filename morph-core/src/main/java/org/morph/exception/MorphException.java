package org.morph.exception;

/**
 * Base of all errors raised by the schema state engine. Carries the schema and
 * the operation that was attempted so callers can log failures meaningfully.
 */
public class MorphException extends RuntimeException {

    private final String schemaName;
    private final String operation;

    public MorphException(String message) {
        this(message, null, null, null);
    }

    public MorphException(String message, Throwable cause) {
        this(message, null, null, cause);
    }

    public MorphException(String message, String schemaName, String operation, Throwable cause) {
        super(message, cause);
        this.schemaName = schemaName;
        this.operation = operation;
    }

    public String getSchemaName() {
        return schemaName;
    }

    public String getOperation() {
        return operation;
    }

    static String describe(String operation, String schemaName, String detail) {
        return operation + " on schema '" + schemaName + "' failed: " + detail;
    }
}

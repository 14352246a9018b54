package org.morph.exception;

/**
 * Reading or writing migration state failed.
 */
public class StoreException extends MorphException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public StoreException(String schemaName, String operation, Throwable cause) {
        super(describe(operation, schemaName, cause.getMessage()), schemaName, operation, cause);
    }

    public StoreException(String schemaName, String operation, String detail, Throwable cause) {
        super(describe(operation, schemaName, detail), schemaName, operation, cause);
    }
}

package org.morph.exception;

/**
 * The requested schema does not exist in the catalog.
 */
public class NotFoundException extends MorphException {

    public NotFoundException(String schemaName, String operation) {
        super(describe(operation, schemaName, "schema does not exist"), schemaName, operation, null);
    }
}

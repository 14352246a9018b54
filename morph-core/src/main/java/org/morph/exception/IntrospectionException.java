package org.morph.exception;

/**
 * A catalog query failed. Whether to retry is up to the caller.
 */
public class IntrospectionException extends MorphException {

    public IntrospectionException(String schemaName, String operation, Throwable cause) {
        super(describe(operation, schemaName, cause.getMessage()), schemaName, operation, cause);
    }
}

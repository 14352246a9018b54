package org.morph.introspect;

import org.morph.model.Schema;

/**
 * Reads the live structure of a named schema from the database catalog.
 */
public interface SchemaIntrospector {

    /**
     * Builds a fresh snapshot of {@code schemaName}.
     *
     * @throws org.morph.exception.NotFoundException if the schema does not exist
     * @throws org.morph.exception.IntrospectionException if a catalog query fails
     */
    Schema readSchema(String schemaName);
}

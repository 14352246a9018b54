package org.morph.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;
import java.util.Optional;

/**
 * Snapshot of one logical database schema as read from the catalog.
 * Instances are immutable; a new snapshot is built on every introspection.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Schema {
    String name;
    @Singular
    Map<String, Table> tables;

    public Optional<Table> findTable(String tableName) {
        return Optional.ofNullable(tables.get(tableName));
    }
}

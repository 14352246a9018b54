package org.morph.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class Table {
    String name;

    /**
     * Catalog-assigned identity. Not part of equality: a dropped and recreated
     * table with the same structure compares equal.
     */
    @EqualsAndHashCode.Exclude
    long oid;

    String comment;

    @Singular
    Map<String, Column> columns;

    @Singular("index")
    Map<String, Index> indexes;

    /** Primary key column names in declared key order. */
    @Singular("primaryKeyColumn")
    List<String> primaryKey;

    @Singular
    Map<String, UniqueConstraint> uniqueConstraints;

    @Singular
    Map<String, ForeignKey> foreignKeys;

    @Singular
    Map<String, CheckConstraint> checkConstraints;

    public boolean hasPrimaryKey() {
        return !primaryKey.isEmpty();
    }
}

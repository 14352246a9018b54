package org.morph.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Foreign key with local and referenced columns paired by position.
 */
@Value
@Builder
@Jacksonized
public class ForeignKey {
    String name;
    @Singular
    List<String> columns;
    String referencedTable;
    @Singular
    List<String> referencedColumns;
}

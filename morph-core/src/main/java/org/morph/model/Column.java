package org.morph.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class Column {
    String name;
    /** Normalized catalog type name, e.g. {@code integer} or {@code character varying(255)}. */
    String type;
    @Builder.Default
    boolean nullable = true;
    /** Sole column of a unique or primary key constraint. */
    boolean unique;
    String defaultValue;
    String comment;
}

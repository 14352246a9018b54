package org.morph.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class CheckConstraint {
    String name;
    @Singular
    List<String> columns;
    /** Predicate as rendered by the catalog, e.g. {@code CHECK ((age > 18))}. */
    String definition;
}

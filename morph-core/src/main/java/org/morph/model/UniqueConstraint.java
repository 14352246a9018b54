package org.morph.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class UniqueConstraint {
    String name;
    @Singular
    List<String> columns;
}

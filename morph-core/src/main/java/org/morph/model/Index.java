package org.morph.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class Index {
    String name;

    public static Index named(String name) {
        return Index.builder().name(name).build();
    }
}

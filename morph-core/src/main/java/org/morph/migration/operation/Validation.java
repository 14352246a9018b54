package org.morph.migration.operation;

import java.util.Collection;
import java.util.List;

final class Validation {

    private Validation() {
    }

    static void require(List<String> problems, String value, String field) {
        if (value == null || value.isBlank()) {
            problems.add(field + " is required");
        }
    }

    static void requireNotEmpty(List<String> problems, Collection<?> values, String field) {
        if (values == null || values.isEmpty()) {
            problems.add(field + " must not be empty");
        }
    }
}

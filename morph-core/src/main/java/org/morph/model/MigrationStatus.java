package org.morph.model;

import java.util.Arrays;

public enum MigrationStatus {
    IN_PROGRESS("in_progress"),
    COMPLETE("complete"),
    ROLLED_BACK("rolled_back");

    private final String dbValue;

    MigrationStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    public String getDbValue() {
        return dbValue;
    }

    public boolean isTerminal() {
        return this != IN_PROGRESS;
    }

    public static MigrationStatus fromDbValue(String value) {
        return Arrays.stream(values())
                .filter(s -> s.dbValue.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown migration status: " + value));
    }
}

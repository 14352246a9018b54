package org.morph.migration.operation;

import java.util.Arrays;
import java.util.Optional;

public enum OperationKind {
    CREATE_TABLE("create_table"),
    DROP_TABLE("drop_table"),
    RENAME_TABLE("rename_table"),
    ADD_COLUMN("add_column"),
    DROP_COLUMN("drop_column"),
    ALTER_COLUMN("alter_column"),
    CREATE_INDEX("create_index"),
    DROP_INDEX("drop_index"),
    DROP_CONSTRAINT("drop_constraint"),
    RAW_SQL("raw_sql");

    private final String tag;

    OperationKind(String tag) {
        this.tag = tag;
    }

    /** Key used for this kind in serialized migrations. */
    public String getTag() {
        return tag;
    }

    public static Optional<OperationKind> fromTag(String tag) {
        return Arrays.stream(values()).filter(k -> k.tag.equals(tag)).findFirst();
    }
}

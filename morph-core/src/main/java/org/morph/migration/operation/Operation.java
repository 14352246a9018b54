package org.morph.migration.operation;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import org.morph.migration.OperationVisitor;

import java.util.List;

/**
 * A single step of a migration. Serialized as a one-key object whose key is the
 * kind tag, e.g. {@code {"add_column": {"table": "users", ...}}}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
        @JsonSubTypes.Type(value = OpCreateTable.class, name = "create_table"),
        @JsonSubTypes.Type(value = OpDropTable.class, name = "drop_table"),
        @JsonSubTypes.Type(value = OpRenameTable.class, name = "rename_table"),
        @JsonSubTypes.Type(value = OpAddColumn.class, name = "add_column"),
        @JsonSubTypes.Type(value = OpDropColumn.class, name = "drop_column"),
        @JsonSubTypes.Type(value = OpAlterColumn.class, name = "alter_column"),
        @JsonSubTypes.Type(value = OpCreateIndex.class, name = "create_index"),
        @JsonSubTypes.Type(value = OpDropIndex.class, name = "drop_index"),
        @JsonSubTypes.Type(value = OpDropConstraint.class, name = "drop_constraint"),
        @JsonSubTypes.Type(value = OpRawSql.class, name = "raw_sql")
})
public interface Operation {

    OperationKind kind();

    /**
     * @return problems with the operation's parameters, empty when it is well formed
     */
    List<String> validate();

    <R> R accept(OperationVisitor<R> visitor);
}

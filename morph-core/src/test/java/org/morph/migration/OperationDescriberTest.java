package org.morph.migration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.morph.migration.operation.ColumnDefinition;
import org.morph.migration.operation.OpAddColumn;
import org.morph.migration.operation.OpAlterColumn;
import org.morph.migration.operation.OpCreateIndex;
import org.morph.migration.operation.OpCreateTable;
import org.morph.migration.operation.OpDropColumn;
import org.morph.migration.operation.OpDropConstraint;
import org.morph.migration.operation.OpDropIndex;
import org.morph.migration.operation.OpRawSql;

import static org.assertj.core.api.Assertions.assertThat;

class OperationDescriberTest {

    private final OperationDescriber describer = new OperationDescriber();

    @Test
    @DisplayName("Describes table and column operations")
    void tableAndColumnOperations() {
        assertThat(OpCreateTable.builder()
                .name("users")
                .column(ColumnDefinition.builder().name("id").type("bigint").pk(true).build())
                .column(ColumnDefinition.builder().name("email").type("text").build())
                .build()
                .accept(describer))
                .isEqualTo("create table users (id, email)");

        assertThat(OpAddColumn.builder()
                .table("table1")
                .column(ColumnDefinition.builder().name("test").type("text").build())
                .build()
                .accept(describer))
                .isEqualTo("add column test text to table1");

        assertThat(OpDropColumn.builder().table("users").column("legacy").build().accept(describer))
                .isEqualTo("drop column legacy from users");
    }

    @Test
    @DisplayName("Lists every change of an alter column")
    void alterColumn() {
        OpAlterColumn op = OpAlterColumn.builder()
                .table("users")
                .column("email")
                .name("mail")
                .type("varchar(320)")
                .nullable(false)
                .unique(true)
                .build();

        assertThat(op.accept(describer))
                .isEqualTo("alter column users.email: rename to mail, type varchar(320), set not null, add unique");
    }

    @Test
    @DisplayName("Describes index, constraint and raw operations")
    void indexesAndConstraints() {
        assertThat(OpCreateIndex.builder().name("t_ab").table("t").column("a").column("b").unique(true).build()
                .accept(describer))
                .isEqualTo("create unique index t_ab on t (a, b)");
        assertThat(OpDropIndex.builder().name("t_ab").build().accept(describer)).isEqualTo("drop index t_ab");
        assertThat(OpDropConstraint.builder().table("t").column("a").name("t_a_check").build().accept(describer))
                .isEqualTo("drop constraint t_a_check on t.a");
        assertThat(OpRawSql.builder().up("SELECT 1").build().accept(describer)).isEqualTo("raw sql");
    }
}

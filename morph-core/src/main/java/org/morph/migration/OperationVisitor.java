package org.morph.migration;

import org.morph.migration.operation.OpAddColumn;
import org.morph.migration.operation.OpAlterColumn;
import org.morph.migration.operation.OpCreateIndex;
import org.morph.migration.operation.OpCreateTable;
import org.morph.migration.operation.OpDropColumn;
import org.morph.migration.operation.OpDropConstraint;
import org.morph.migration.operation.OpDropIndex;
import org.morph.migration.operation.OpDropTable;
import org.morph.migration.operation.OpRawSql;
import org.morph.migration.operation.OpRenameTable;

/**
 * Double-dispatch over the closed set of operation kinds. Executors and
 * describers implement this instead of switching on {@code instanceof}.
 */
public interface OperationVisitor<R> {
    // Table
    R visitCreateTable(OpCreateTable op);
    R visitDropTable(OpDropTable op);
    R visitRenameTable(OpRenameTable op);

    // Column
    R visitAddColumn(OpAddColumn op);
    R visitDropColumn(OpDropColumn op);
    R visitAlterColumn(OpAlterColumn op);

    // Index
    R visitCreateIndex(OpCreateIndex op);
    R visitDropIndex(OpDropIndex op);

    // Constraint
    R visitDropConstraint(OpDropConstraint op);

    R visitRawSql(OpRawSql op);
}

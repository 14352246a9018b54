package org.morph.cli;

import org.morph.cli.service.StateFactory;
import org.morph.model.MigrationRecord;
import picocli.CommandLine;

import java.util.List;

@CommandLine.Command(
        name = "history",
        mixinStandardHelpOptions = true,
        description = "Lists every migration recorded for a schema, oldest first."
)
public class HistoryCommand extends StateCommand {

    public HistoryCommand() {
        this(StateFactory.postgres());
    }

    HistoryCommand(StateFactory stateFactory) {
        super(stateFactory);
    }

    @Override
    protected Integer execute() {
        List<MigrationRecord> history = state().history(schema);
        if (history.isEmpty()) {
            System.out.println("No migrations recorded for schema '" + schema + "'");
            return 0;
        }

        for (MigrationRecord record : history) {
            System.out.printf("%-6d %-40s %-12s %s%n",
                    record.getId(), record.getName(), record.getStatus().getDbValue(), record.getCreatedAt());
        }
        return 0;
    }
}

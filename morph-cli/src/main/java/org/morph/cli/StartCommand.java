package org.morph.cli;

import org.morph.cli.service.StateFactory;
import org.morph.migration.Migration;
import org.morph.migration.MigrationReader;
import org.morph.migration.OperationDescriber;
import org.morph.model.Schema;
import org.morph.state.MigrationState;
import picocli.CommandLine;

import java.nio.file.Path;

/**
 * Command for starting a migration from a definition file.
 * Records the live schema as the migration's baseline.
 */
@CommandLine.Command(
        name = "start",
        mixinStandardHelpOptions = true,
        description = "Starts a migration defined in a JSON or YAML file."
)
public class StartCommand extends StateCommand {

    @CommandLine.Parameters(index = "0", description = "Migration file (.json, .yaml, .yml)")
    private Path file;

    @CommandLine.Option(names = "--complete", description = "Complete the migration right after starting it")
    private boolean complete;

    public StartCommand() {
        this(StateFactory.postgres());
    }

    StartCommand(StateFactory stateFactory) {
        super(stateFactory);
    }

    @Override
    protected Integer execute() {
        Migration migration = new MigrationReader().read(file);

        System.out.println("Migration '" + migration.getName() + "':");
        migration.replay(new OperationDescriber())
                .forEach(line -> System.out.println("   - " + line));

        MigrationState state = state();
        Schema baseline = state.start(schema, migration);
        System.out.println("Migration started on schema '" + schema + "' (" + baseline.getTables().size() + " tables in baseline)");

        if (complete) {
            state.complete(schema);
            System.out.println("Migration completed");
        }
        return 0;
    }
}

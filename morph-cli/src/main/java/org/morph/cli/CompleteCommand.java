package org.morph.cli;

import org.morph.cli.service.StateFactory;
import org.morph.model.Schema;
import picocli.CommandLine;

@CommandLine.Command(
        name = "complete",
        mixinStandardHelpOptions = true,
        description = "Completes the active migration and records the resulting schema."
)
public class CompleteCommand extends StateCommand {

    public CompleteCommand() {
        this(StateFactory.postgres());
    }

    CompleteCommand(StateFactory stateFactory) {
        super(stateFactory);
    }

    @Override
    protected Integer execute() {
        Schema result = state().complete(schema);
        System.out.println("Migration completed on schema '" + schema + "' (" + result.getTables().size() + " tables)");
        return 0;
    }
}

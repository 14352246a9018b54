package org.morph.cli;

import org.morph.cli.service.StateFactory;
import picocli.CommandLine;

@CommandLine.Command(
        name = "rollback",
        mixinStandardHelpOptions = true,
        description = "Marks the active migration as rolled back."
)
public class RollbackCommand extends StateCommand {

    public RollbackCommand() {
        this(StateFactory.postgres());
    }

    RollbackCommand(StateFactory stateFactory) {
        super(stateFactory);
    }

    @Override
    protected Integer execute() {
        state().rollback(schema);
        System.out.println("Migration rolled back on schema '" + schema + "'");
        return 0;
    }
}

package org.morph.cli;

import org.morph.cli.service.StateFactory;
import picocli.CommandLine;

@CommandLine.Command(
        name = "init",
        mixinStandardHelpOptions = true,
        description = "Creates the migration state tables. Safe to run more than once."
)
public class InitCommand extends StateCommand {

    public InitCommand() {
        this(StateFactory.postgres());
    }

    InitCommand(StateFactory stateFactory) {
        super(stateFactory);
    }

    @Override
    protected Integer execute() {
        state().init();
        System.out.println("Initialization complete");
        return 0;
    }
}

package org.morph.cli;

import org.morph.cli.service.StateFactory;
import org.morph.exception.AlreadyActiveException;
import org.morph.exception.MorphException;
import org.morph.state.MigrationState;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/**
 * Base for commands that operate on the migration state of one schema.
 */
abstract class StateCommand implements Callable<Integer> {

    @CommandLine.Mixin
    ConnectionOptions connection = new ConnectionOptions();

    @CommandLine.Option(names = {"-s", "--schema"}, description = "Target schema", defaultValue = "public")
    String schema;

    private final StateFactory stateFactory;

    protected StateCommand(StateFactory stateFactory) {
        this.stateFactory = stateFactory;
    }

    @Override
    public Integer call() {
        try {
            return execute();
        } catch (AlreadyActiveException e) {
            System.err.println("A migration is already running on schema '" + e.getSchemaName() + "'.");
            System.err.println("   Complete or roll it back before starting another one.");
            return 1;
        } catch (MorphException e) {
            System.err.println(name() + " failed: " + e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            return 2;
        } catch (Exception e) {
            System.err.println(name() + " failed: " + e.getMessage());
            e.printStackTrace();
            return 1;
        }
    }

    protected abstract Integer execute() throws Exception;

    protected MigrationState state() {
        return stateFactory.create(connection.resolve());
    }

    private String name() {
        CommandLine.Command command = getClass().getAnnotation(CommandLine.Command.class);
        return command != null ? command.name() : getClass().getSimpleName();
    }
}

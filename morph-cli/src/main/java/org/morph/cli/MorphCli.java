package org.morph.cli;

import picocli.CommandLine;

/**
 * Main CLI entry point for morph.
 * Tracks zero-downtime schema migrations and inspects live schema structure.
 */
@CommandLine.Command(
        name = "morph",
        mixinStandardHelpOptions = true,
        version = "morph 0.1",
        description = "Schema state engine for zero-downtime PostgreSQL migrations",
        subcommands = {
                InitCommand.class,
                StartCommand.class,
                CompleteCommand.class,
                RollbackCommand.class,
                StatusCommand.class,
                HistoryCommand.class,
                ReadSchemaCommand.class,
                VerifyCommand.class
        }
)
public class MorphCli {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new MorphCli()).execute(args);
        System.exit(exitCode);
    }
}

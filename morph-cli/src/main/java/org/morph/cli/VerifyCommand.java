package org.morph.cli;

import org.morph.cli.service.StateFactory;
import org.morph.model.SchemaVerification;
import picocli.CommandLine;

import java.util.Optional;

/**
 * Command for checking that the live schema still matches what the latest completed
 * migration left behind.
 */
@CommandLine.Command(
        name = "verify",
        mixinStandardHelpOptions = true,
        description = "Compares the live schema with the latest completed migration."
)
public class VerifyCommand extends StateCommand {

    public VerifyCommand() {
        this(StateFactory.postgres());
    }

    VerifyCommand(StateFactory stateFactory) {
        super(stateFactory);
    }

    @Override
    protected Integer execute() {
        Optional<SchemaVerification> result = state().verify(schema);
        if (result.isEmpty()) {
            System.out.println("No completed migration on schema '" + schema + "' to verify against");
            return 0;
        }

        SchemaVerification verification = result.get();
        if (verification.isUpToDate()) {
            System.out.println("Schema is up to date");
            System.out.println("   Version: " + verification.getVersion());
            System.out.println("   Hash: " + verification.getActualHash());
            return 0;
        }

        System.err.println("Schema has drifted from migration '" + verification.getVersion() + "'");
        System.err.println("   Expected hash: " + verification.getExpectedHash());
        System.err.println("   Actual hash:   " + verification.getActualHash());
        return 1;
    }
}

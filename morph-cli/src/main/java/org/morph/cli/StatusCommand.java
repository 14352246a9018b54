package org.morph.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.morph.cli.service.StateFactory;
import org.morph.model.SchemaStatus;
import picocli.CommandLine;

@CommandLine.Command(
        name = "status",
        mixinStandardHelpOptions = true,
        description = "Prints the migration status of a schema as JSON."
)
public class StatusCommand extends StateCommand {

    public StatusCommand() {
        this(StateFactory.postgres());
    }

    StatusCommand(StateFactory stateFactory) {
        super(stateFactory);
    }

    @Override
    protected Integer execute() throws Exception {
        SchemaStatus status = state().status(schema);
        System.out.println(new ObjectMapper().writerWithDefaultPrettyPrinter().writeValueAsString(status));
        return 0;
    }
}

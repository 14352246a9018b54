package org.morph.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.morph.cli.service.StateFactory;
import org.morph.model.Schema;
import picocli.CommandLine;

@CommandLine.Command(
        name = "read-schema",
        mixinStandardHelpOptions = true,
        description = "Prints the live structure of a schema as JSON."
)
public class ReadSchemaCommand extends StateCommand {

    public ReadSchemaCommand() {
        this(StateFactory.postgres());
    }

    ReadSchemaCommand(StateFactory stateFactory) {
        super(stateFactory);
    }

    @Override
    protected Integer execute() throws Exception {
        Schema live = state().readSchema(schema);
        ObjectMapper mapper = new ObjectMapper()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
        System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(live));
        return 0;
    }
}

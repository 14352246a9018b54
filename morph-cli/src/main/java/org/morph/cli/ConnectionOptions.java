package org.morph.cli;

import org.morph.cli.service.ConnectionSettings;
import org.morph.config.ConfigurationLoader;
import org.morph.options.MorphOptions;
import picocli.CommandLine;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Connection options shared by every command. Values given on the command line win
 * over the active profile of morph.yaml.
 */
public class ConnectionOptions {

    @CommandLine.Option(names = "--url", description = "JDBC URL of the target database")
    String url;

    @CommandLine.Option(names = "--username", description = "Database user")
    String username;

    @CommandLine.Option(names = "--password", description = "Database password")
    String password;

    @CommandLine.Option(names = "--state-schema", description = "Schema holding migration state (default: morph)")
    String stateSchema;

    @CommandLine.Option(names = "--profile", description = "Configuration profile (dev, prod, test ...)")
    String profile;

    @CommandLine.Option(names = "--config-dir", description = "Directory to search upwards for morph.yaml")
    Path configDir;

    public ConnectionSettings resolve() {
        Path startDir = configDir != null ? configDir : Paths.get("").toAbsolutePath();
        Map<String, String> config = new ConfigurationLoader(startDir).loadConfiguration(profile);

        String resolvedUrl = firstNonBlank(url, config.get(MorphOptions.Database.URL_KEY));
        if (resolvedUrl == null) {
            throw new IllegalArgumentException(
                    "Database URL is required (use --url or set database.url in " + MorphOptions.Profile.CONFIG_FILE + ")");
        }

        return new ConnectionSettings(
                resolvedUrl,
                firstNonBlank(username, config.get(MorphOptions.Database.USERNAME_KEY)),
                firstNonBlank(password, config.get(MorphOptions.Database.PASSWORD_KEY)),
                firstNonBlank(stateSchema, config.get(MorphOptions.State.SCHEMA_KEY)),
                parseTimeout(config.get(MorphOptions.State.QUERY_TIMEOUT_KEY)));
    }

    private static int parseTimeout(String value) {
        if (value == null) {
            return MorphOptions.State.QUERY_TIMEOUT_DEFAULT;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            System.err.println("Warning: Invalid queryTimeoutSeconds in configuration: " + value
                    + ". Using default: " + MorphOptions.State.QUERY_TIMEOUT_DEFAULT);
            return MorphOptions.State.QUERY_TIMEOUT_DEFAULT;
        }
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        return second != null && !second.isBlank() ? second : null;
    }
}

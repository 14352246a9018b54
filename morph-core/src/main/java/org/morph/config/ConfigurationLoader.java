package org.morph.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.morph.options.MorphOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

@Slf4j
public class ConfigurationLoader {

    private static final String CONFIG_FILE_NAME = MorphOptions.Profile.CONFIG_FILE;
    private static final String DEFAULT_PROFILE = MorphOptions.Profile.DEFAULT;
    private static final String PROFILE_ENV_VAR = MorphOptions.Profile.ENV_VAR;

    private final ObjectMapper yamlMapper;
    private final Path startDirectory;
    private final Function<String, String> environment;

    public ConfigurationLoader() {
        this(Paths.get("").toAbsolutePath());
    }

    public ConfigurationLoader(Path startDirectory) {
        this(startDirectory, System::getenv);
    }

    ConfigurationLoader(Path startDirectory, Function<String, String> environment) {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.startDirectory = startDirectory;
        this.environment = environment;
    }

    /**
     * Loads the configuration and flattens the active profile into a key/value map keyed
     * by {@link MorphOptions} constants.
     *
     * Priority: CLI profile > environment variable > default (dev)
     *
     * @param cliProfile profile given on the command line, may be null
     */
    public Map<String, String> loadConfiguration(String cliProfile) {
        String activeProfile = resolveActiveProfile(cliProfile);

        Optional<MorphConfiguration> config = findAndLoadConfiguration();
        if (config.isEmpty()) {
            return createDefaultConfiguration();
        }

        return extractConfigurationForProfile(config.get(), activeProfile);
    }

    String resolveActiveProfile(String cliProfile) {
        if (cliProfile != null && !cliProfile.trim().isEmpty()) {
            return cliProfile;
        }

        String envProfile = environment.apply(PROFILE_ENV_VAR);
        if (envProfile != null && !envProfile.trim().isEmpty()) {
            return envProfile;
        }

        return DEFAULT_PROFILE;
    }

    /**
     * Walks from the start directory up to the filesystem root looking for morph.yaml.
     */
    private Optional<MorphConfiguration> findAndLoadConfiguration() {
        Path currentDir = startDirectory;

        while (currentDir != null) {
            Path configFile = currentDir.resolve(CONFIG_FILE_NAME);
            if (Files.exists(configFile)) {
                try {
                    return Optional.of(yamlMapper.readValue(configFile.toFile(), MorphConfiguration.class));
                } catch (IOException e) {
                    log.warn("Failed to parse {}: {}", configFile, e.getMessage());
                    return Optional.empty();
                }
            }
            currentDir = currentDir.getParent();
        }

        return Optional.empty();
    }

    private Map<String, String> extractConfigurationForProfile(MorphConfiguration config, String profile) {
        var profileConfig = config.getProfiles().get(profile);
        if (profileConfig == null) {
            log.warn("Profile '{}' not found in configuration. Using defaults.", profile);
            return createDefaultConfiguration();
        }

        var configMap = new HashMap<>(createDefaultConfiguration());

        var database = profileConfig.getDatabase();
        if (database != null) {
            putIfPresent(configMap, MorphOptions.Database.URL_KEY, database.getUrl());
            putIfPresent(configMap, MorphOptions.Database.USERNAME_KEY, database.getUsername());
            putIfPresent(configMap, MorphOptions.Database.PASSWORD_KEY, database.getPassword());
        }

        var state = profileConfig.getState();
        if (state != null) {
            putIfPresent(configMap, MorphOptions.State.SCHEMA_KEY, state.getSchema());
            if (state.getQueryTimeoutSeconds() != null) {
                configMap.put(MorphOptions.State.QUERY_TIMEOUT_KEY, String.valueOf(state.getQueryTimeoutSeconds()));
            }
        }

        return configMap;
    }

    private static void putIfPresent(Map<String, String> configMap, String key, String value) {
        if (value != null && !value.isBlank()) {
            configMap.put(key, value);
        }
    }

    private Map<String, String> createDefaultConfiguration() {
        return Map.of(
                MorphOptions.State.SCHEMA_KEY, MorphOptions.State.SCHEMA_DEFAULT,
                MorphOptions.State.QUERY_TIMEOUT_KEY, String.valueOf(MorphOptions.State.QUERY_TIMEOUT_DEFAULT)
        );
    }
}

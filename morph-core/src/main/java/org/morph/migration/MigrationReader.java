package org.morph.migration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.morph.exception.InvalidMigrationException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Loads migration definitions from JSON or YAML files.
 * A file without a {@code name} takes its name from the file name.
 */
public class MigrationReader {

    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    public MigrationReader() {
        this.jsonMapper = new ObjectMapper();
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
    }

    public Migration read(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new InvalidMigrationException("Migration file not found: " + file);
        }

        Migration migration;
        try {
            migration = mapperFor(file).readValue(file.toFile(), Migration.class);
        } catch (IOException e) {
            throw new InvalidMigrationException("Failed to parse migration file " + file + ": " + e.getMessage(), e);
        }

        if (migration.getName() == null || migration.getName().isBlank()) {
            migration = migration.toBuilder().name(baseName(file)).build();
        }
        return migration;
    }

    public String write(Migration migration) {
        try {
            return jsonMapper.writerWithDefaultPrettyPrinter().writeValueAsString(migration);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize migration " + migration.getName(), e);
        }
    }

    private ObjectMapper mapperFor(Path file) {
        String fileName = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (fileName.endsWith(".yaml") || fileName.endsWith(".yml")) {
            return yamlMapper;
        }
        return jsonMapper;
    }

    static String baseName(Path file) {
        String fileName = file.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}

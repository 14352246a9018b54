package org.morph.state;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.morph.migration.Migration;
import org.morph.model.Schema;
import org.morph.model.Table;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * JSON encoding of schema snapshots and migration definitions as they are
 * persisted by the migration store.
 */
public class SnapshotCodec {

    private final ObjectMapper objectMapper;
    private final ObjectMapper hashMapper;

    public SnapshotCodec() {
        this.objectMapper = new ObjectMapper();
        this.hashMapper = new ObjectMapper()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .addMixIn(Table.class, TableHashMixin.class);
    }

    public String writeSchema(Schema schema) throws JsonProcessingException {
        return schema == null ? null : objectMapper.writeValueAsString(schema);
    }

    public Schema readSchema(String json) throws JsonProcessingException {
        return json == null ? null : objectMapper.readValue(json, Schema.class);
    }

    public String writeMigration(Migration migration) throws JsonProcessingException {
        return objectMapper.writeValueAsString(migration);
    }

    public Migration readMigration(String json) throws JsonProcessingException {
        return objectMapper.readValue(json, Migration.class);
    }

    /**
     * Deterministic SHA-256 of a snapshot's structure. Map entries are written in key
     * order and table OIDs are left out, so equal schemas hash equally.
     */
    public String hash(Schema schema) {
        try {
            byte[] content = hashMapper.writeValueAsString(schema).getBytes(StandardCharsets.UTF_8);
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(content);

            StringBuilder hexString = new StringBuilder();
            for (byte b : hash) {
                String hex = Integer.toHexString(0xff & b);
                if (hex.length() == 1) {
                    hexString.append('0');
                }
                hexString.append(hex);
            }
            return hexString.toString();
        } catch (JsonProcessingException | NoSuchAlgorithmException e) {
            throw new IllegalStateException("Failed to hash schema " + schema.getName(), e);
        }
    }

    @JsonIgnoreProperties("oid")
    private abstract static class TableHashMixin {
    }
}

package org.morph.testing;

import org.morph.exception.AlreadyActiveException;
import org.morph.exception.NoActiveMigrationException;
import org.morph.model.MigrationRecord;
import org.morph.model.MigrationStatus;
import org.morph.model.Schema;
import org.morph.state.MigrationStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory {@link MigrationStore} that keeps every record it is given, with the same
 * one-in-progress rule the database store enforces through its unique index.
 */
public class RecordingMigrationStore implements MigrationStore {

    private final List<MigrationRecord> records = new ArrayList<>();
    private final AtomicInteger initCalls = new AtomicInteger();
    private RuntimeException failNextSave;

    @Override
    public void init() {
        initCalls.incrementAndGet();
    }

    @Override
    public synchronized MigrationRecord save(MigrationRecord record) {
        if (failNextSave != null) {
            RuntimeException failure = failNextSave;
            failNextSave = null;
            throw failure;
        }
        if (record.isNew()) {
            boolean active = records.stream()
                    .anyMatch(r -> r.getSchemaName().equals(record.getSchemaName()) && r.isInProgress());
            if (active && record.isInProgress()) {
                throw new AlreadyActiveException(record.getSchemaName(), "save migration");
            }
            MigrationRecord stored = record.toBuilder()
                    .id((long) records.size() + 1)
                    .parent(latestCompleted(record.getSchemaName()).map(MigrationRecord::getName).orElse(null))
                    .createdAt(Instant.now())
                    .updatedAt(Instant.now())
                    .build();
            records.add(stored);
            return stored;
        }
        MigrationRecord stored = record.toBuilder().updatedAt(Instant.now()).build();
        records.set(record.getId().intValue() - 1, stored);
        return stored;
    }

    @Override
    public synchronized Optional<MigrationRecord> latest(String schemaName) {
        return forSchema(schemaName).stream().reduce((first, second) -> second);
    }

    @Override
    public synchronized Optional<MigrationRecord> latestCompleted(String schemaName) {
        return forSchema(schemaName).stream()
                .filter(r -> r.getStatus() == MigrationStatus.COMPLETE)
                .reduce((first, second) -> second);
    }

    @Override
    public synchronized void setStatus(String schemaName, MigrationStatus status, Schema completedSchema) {
        MigrationRecord active = latest(schemaName)
                .filter(MigrationRecord::isInProgress)
                .orElseThrow(() -> new NoActiveMigrationException(schemaName, "set migration status"));
        save(active.toBuilder().status(status).completedSchema(completedSchema).build());
    }

    @Override
    public synchronized List<MigrationRecord> history(String schemaName) {
        return forSchema(schemaName);
    }

    public synchronized void failNextSave(RuntimeException failure) {
        this.failNextSave = failure;
    }

    public int initCalls() {
        return initCalls.get();
    }

    public synchronized List<MigrationRecord> all() {
        return List.copyOf(records);
    }

    private List<MigrationRecord> forSchema(String schemaName) {
        return records.stream().filter(r -> r.getSchemaName().equals(schemaName)).toList();
    }
}

package org.morph.state;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.morph.exception.AlreadyActiveException;
import org.morph.exception.InvalidMigrationException;
import org.morph.exception.NoActiveMigrationException;
import org.morph.exception.NotFoundException;
import org.morph.exception.StoreException;
import org.morph.introspect.SchemaIntrospector;
import org.morph.migration.Migration;
import org.morph.model.Column;
import org.morph.model.MigrationRecord;
import org.morph.model.MigrationStatus;
import org.morph.model.Schema;
import org.morph.model.SchemaStatus;
import org.morph.model.SchemaVerification;
import org.morph.model.Table;
import org.morph.state.guard.ConcurrencyGuard;
import org.morph.state.guard.GuardLease;
import org.morph.testing.Fixtures;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MigrationStateTest {

    private static final String SCHEMA = "public";

    @Mock
    SchemaIntrospector introspector;
    @Mock
    MigrationStore store;
    @Mock
    ConcurrencyGuard guard;
    @Mock
    GuardLease lease;

    private MigrationState state;
    private Schema baseline;

    @BeforeEach
    void setUp() {
        state = new MigrationState(introspector, store, guard);
        baseline = Fixtures.singleTableSchema(SCHEMA);
    }

    private static MigrationRecord record(long id, String name, MigrationStatus status, Schema completed) {
        return MigrationRecord.builder()
                .id(id)
                .schemaName(SCHEMA)
                .name(name)
                .migration(Fixtures.addColumnMigration(name))
                .status(status)
                .startedSchema(Fixtures.singleTableSchema(SCHEMA))
                .completedSchema(completed)
                .build();
    }

    @Nested
    @DisplayName("start")
    class Start {

        @Test
        @DisplayName("Returns the live schema and records an in-progress migration")
        void startsMigration() {
            when(guard.acquire(SCHEMA)).thenReturn(lease);
            when(introspector.readSchema(SCHEMA)).thenReturn(baseline);
            when(store.save(any())).thenAnswer(inv -> inv.<MigrationRecord>getArgument(0).toBuilder().id(1L).build());

            Schema result = state.start(SCHEMA, Fixtures.addColumnMigration("01_add_test"));

            assertThat(result).isEqualTo(baseline);
            ArgumentCaptor<MigrationRecord> saved = ArgumentCaptor.forClass(MigrationRecord.class);
            verify(store).save(saved.capture());
            assertThat(saved.getValue().isNew()).isTrue();
            assertThat(saved.getValue().getName()).isEqualTo("01_add_test");
            assertThat(saved.getValue().getStatus()).isEqualTo(MigrationStatus.IN_PROGRESS);
            assertThat(saved.getValue().getStartedSchema()).isEqualTo(baseline);
            assertThat(saved.getValue().getCompletedSchema()).isNull();
            verify(lease).close();
        }

        @Test
        @DisplayName("Rejects a missing migration without touching the guard or the store")
        void rejectsNullMigration() {
            assertThatThrownBy(() -> state.start(SCHEMA, null))
                    .isInstanceOf(InvalidMigrationException.class)
                    .hasMessageContaining("migration is required");

            verifyNoInteractions(guard, store, introspector);
        }

        @Test
        @DisplayName("Rejects an invalid migration with every problem listed")
        void rejectsInvalidMigration() {
            Migration invalid = Migration.builder().name("").build();

            assertThatThrownBy(() -> state.start(SCHEMA, invalid))
                    .isInstanceOfSatisfying(InvalidMigrationException.class, e -> {
                        assertThat(e.getSchemaName()).isEqualTo(SCHEMA);
                        assertThat(e.getOperation()).isEqualTo("start migration");
                        assertThat(e.getProblems()).hasSize(2);
                    });

            verifyNoInteractions(guard, store, introspector);
        }

        @Test
        @DisplayName("Fails while another migration is in progress and releases the guard")
        void rejectsWhileActive() {
            when(guard.acquire(SCHEMA)).thenReturn(lease);
            when(store.latest(SCHEMA)).thenReturn(Optional.of(record(1, "00_init", MigrationStatus.IN_PROGRESS, null)));

            assertThatThrownBy(() -> state.start(SCHEMA, Fixtures.addColumnMigration("01_add_test")))
                    .isInstanceOf(AlreadyActiveException.class)
                    .hasMessage("start migration on schema 'public' failed: a migration is already active");

            verify(store, never()).save(any());
            verifyNoInteractions(introspector);
            verify(lease).close();
        }

        @Test
        @DisplayName("Fails when the guard is held elsewhere")
        void rejectsWhenGuardHeld() {
            when(guard.acquire(SCHEMA)).thenThrow(new AlreadyActiveException(SCHEMA, "acquire migration lock"));

            assertThatThrownBy(() -> state.start(SCHEMA, Fixtures.addColumnMigration("01_add_test")))
                    .isInstanceOf(AlreadyActiveException.class);

            verifyNoInteractions(store, introspector);
        }

        @Test
        @DisplayName("Rejects a migration name that has already been applied")
        void rejectsAppliedName() {
            when(guard.acquire(SCHEMA)).thenReturn(lease);
            when(store.history(SCHEMA)).thenReturn(List.of(record(1, "01_add_test", MigrationStatus.COMPLETE, baseline)));

            assertThatThrownBy(() -> state.start(SCHEMA, Fixtures.addColumnMigration("01_add_test")))
                    .isInstanceOf(InvalidMigrationException.class)
                    .hasMessageContaining("has already been applied");

            verify(store, never()).save(any());
            verify(lease).close();
        }

        @Test
        @DisplayName("A rolled back name may be started again")
        void allowsRolledBackName() {
            when(guard.acquire(SCHEMA)).thenReturn(lease);
            when(store.history(SCHEMA)).thenReturn(List.of(record(1, "01_add_test", MigrationStatus.ROLLED_BACK, null)));
            when(introspector.readSchema(SCHEMA)).thenReturn(baseline);
            when(store.save(any())).thenAnswer(inv -> inv.<MigrationRecord>getArgument(0).toBuilder().id(2L).build());

            assertThat(state.start(SCHEMA, Fixtures.addColumnMigration("01_add_test"))).isEqualTo(baseline);
        }

        @Test
        @DisplayName("Releases the guard when the store fails")
        void releasesGuardOnStoreFailure() {
            when(guard.acquire(SCHEMA)).thenReturn(lease);
            when(introspector.readSchema(SCHEMA)).thenReturn(baseline);
            when(store.save(any())).thenThrow(new StoreException(SCHEMA, "save migration", new RuntimeException("boom")));

            assertThatThrownBy(() -> state.start(SCHEMA, Fixtures.addColumnMigration("01_add_test")))
                    .isInstanceOf(StoreException.class);

            verify(lease).close();
        }

        @Test
        @DisplayName("A failed guard release is attached to the error that ended the start")
        void releaseFailureIsSuppressedByStoreFailure() {
            StoreException saveFailure = new StoreException(SCHEMA, "save migration", new RuntimeException("boom"));
            StoreException releaseFailure = new StoreException(SCHEMA, "release migration lock", new RuntimeException("gone"));
            when(guard.acquire(SCHEMA)).thenReturn(lease);
            when(introspector.readSchema(SCHEMA)).thenReturn(baseline);
            when(store.save(any())).thenThrow(saveFailure);
            doThrow(releaseFailure).when(lease).close();

            assertThatThrownBy(() -> state.start(SCHEMA, Fixtures.addColumnMigration("01_add_test")))
                    .isSameAs(saveFailure);
            assertThat(saveFailure.getSuppressed()).containsExactly(releaseFailure);
        }

        @Test
        @DisplayName("A failed guard release after a successful start is thrown")
        void releaseFailureAfterSuccessIsThrown() {
            StoreException releaseFailure = new StoreException(SCHEMA, "release migration lock", new RuntimeException("gone"));
            when(guard.acquire(SCHEMA)).thenReturn(lease);
            when(introspector.readSchema(SCHEMA)).thenReturn(baseline);
            when(store.save(any())).thenAnswer(inv -> inv.<MigrationRecord>getArgument(0).toBuilder().id(1L).build());
            doThrow(releaseFailure).when(lease).close();

            assertThatThrownBy(() -> state.start(SCHEMA, Fixtures.addColumnMigration("01_add_test")))
                    .isSameAs(releaseFailure);
            verify(store).save(any());
        }

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = "  ")
        @DisplayName("Missing schema name is not found and never reaches the guard")
        void rejectsMissingSchemaName(String schemaName) {
            assertThatThrownBy(() -> state.start(schemaName, Fixtures.addColumnMigration("01_add_test")))
                    .isInstanceOfSatisfying(NotFoundException.class,
                            e -> assertThat(e.getOperation()).isEqualTo("start migration"));

            verifyNoInteractions(guard, store, introspector);
        }
    }

    @Nested
    @DisplayName("complete and rollback")
    class CompleteAndRollback {

        @Test
        @DisplayName("Complete stores the live schema as the result")
        void completeStoresResult() {
            Schema result = baseline.toBuilder()
                    .table("table1", baseline.findTable("table1").orElseThrow().toBuilder()
                            .column("test", Column.builder().name("test").type("text").build())
                            .build())
                    .build();
            when(store.latest(SCHEMA)).thenReturn(Optional.of(record(1, "01_add_test", MigrationStatus.IN_PROGRESS, null)));
            when(introspector.readSchema(SCHEMA)).thenReturn(result);

            assertThat(state.complete(SCHEMA)).isEqualTo(result);

            verify(store).setStatus(SCHEMA, MigrationStatus.COMPLETE, result);
            verifyNoInteractions(guard);
        }

        @Test
        @DisplayName("Complete without an active migration fails before reading the schema")
        void completeWithoutActive() {
            when(store.latest(SCHEMA)).thenReturn(Optional.of(record(1, "01_add_test", MigrationStatus.COMPLETE, baseline)));

            assertThatThrownBy(() -> state.complete(SCHEMA))
                    .isInstanceOf(NoActiveMigrationException.class)
                    .hasMessage("complete migration on schema 'public' failed: no migration is in progress");

            verifyNoInteractions(introspector);
            verify(store, never()).setStatus(any(), any(), any());
        }

        @ParameterizedTest
        @NullAndEmptySource
        @DisplayName("Complete and rollback need a schema name")
        void missingSchemaName(String schemaName) {
            assertThatThrownBy(() -> state.complete(schemaName)).isInstanceOf(NotFoundException.class);
            assertThatThrownBy(() -> state.rollback(schemaName)).isInstanceOf(NotFoundException.class);

            verifyNoInteractions(store, introspector);
        }

        @Test
        @DisplayName("Rollback marks the active migration rolled back")
        void rollback() {
            state.rollback(SCHEMA);

            verify(store).setStatus(SCHEMA, MigrationStatus.ROLLED_BACK, null);
        }

        @Test
        @DisplayName("Rollback without an active migration propagates the store's error")
        void rollbackWithoutActive() {
            doThrow(new NoActiveMigrationException(SCHEMA, "set migration status"))
                    .when(store).setStatus(SCHEMA, MigrationStatus.ROLLED_BACK, null);

            assertThatThrownBy(() -> state.rollback(SCHEMA)).isInstanceOf(NoActiveMigrationException.class);
        }
    }

    @Nested
    @DisplayName("queries")
    class Queries {

        @Test
        @DisplayName("Status reports no migrations for a fresh schema")
        void statusFresh() {
            SchemaStatus status = state.status(SCHEMA);

            assertThat(status.getState()).isEqualTo(SchemaStatus.State.NO_MIGRATIONS);
            assertThat(status.getVersion()).isNull();
            assertThat(state.isActiveMigrationPeriod(SCHEMA)).isFalse();
        }

        @Test
        @DisplayName("Status reports the in-progress state and the last completed version")
        void statusInProgress() {
            when(store.latest(SCHEMA)).thenReturn(Optional.of(record(2, "02_next", MigrationStatus.IN_PROGRESS, null)));
            when(store.latestCompleted(SCHEMA)).thenReturn(Optional.of(record(1, "01_add_test", MigrationStatus.COMPLETE, baseline)));

            SchemaStatus status = state.status(SCHEMA);

            assertThat(status.getState()).isEqualTo(SchemaStatus.State.IN_PROGRESS);
            assertThat(status.getVersion()).isEqualTo("01_add_test");
            assertThat(state.isActiveMigrationPeriod(SCHEMA)).isTrue();
            assertThat(state.activeMigration(SCHEMA)).map(MigrationRecord::getName).contains("02_next");
        }

        @Test
        @DisplayName("Previous version skips rolled back migrations")
        void previousVersion() {
            when(store.history(SCHEMA)).thenReturn(List.of(
                    record(1, "01", MigrationStatus.COMPLETE, baseline),
                    record(2, "02", MigrationStatus.ROLLED_BACK, null),
                    record(3, "03", MigrationStatus.COMPLETE, baseline)));

            assertThat(state.previousVersion(SCHEMA)).contains("01");
        }

        @Test
        @DisplayName("Previous version is empty with fewer than two completed migrations")
        void previousVersionEmpty() {
            when(store.history(SCHEMA)).thenReturn(List.of(record(1, "01", MigrationStatus.COMPLETE, baseline)));

            assertThat(state.previousVersion(SCHEMA)).isEmpty();
        }
    }

    @Nested
    @DisplayName("verify")
    class Verify {

        @Test
        @DisplayName("Nothing to verify before the first completed migration")
        void nothingCompleted() {
            assertThat(state.verify(SCHEMA)).isEmpty();
            verifyNoInteractions(introspector);
        }

        @Test
        @DisplayName("Up to date when the live schema matches the recorded result")
        void upToDate() {
            when(store.latestCompleted(SCHEMA)).thenReturn(Optional.of(record(1, "01_add_test", MigrationStatus.COMPLETE, baseline)));
            when(introspector.readSchema(SCHEMA)).thenReturn(Fixtures.singleTableSchema(SCHEMA));

            SchemaVerification verification = state.verify(SCHEMA).orElseThrow();

            assertThat(verification.isUpToDate()).isTrue();
            assertThat(verification.getVersion()).isEqualTo("01_add_test");
            assertThat(verification.getActualHash()).isEqualTo(verification.getExpectedHash());
        }

        @Test
        @DisplayName("Reports drift when the live schema changed outside a migration")
        void drift() {
            Schema drifted = baseline.toBuilder()
                    .table("manual", Table.builder().name("manual").build())
                    .build();
            when(store.latestCompleted(SCHEMA)).thenReturn(Optional.of(record(1, "01_add_test", MigrationStatus.COMPLETE, baseline)));
            when(introspector.readSchema(SCHEMA)).thenReturn(drifted);

            SchemaVerification verification = state.verify(SCHEMA).orElseThrow();

            assertThat(verification.isUpToDate()).isFalse();
            assertThat(verification.getActualHash()).isNotEqualTo(verification.getExpectedHash());
        }
    }
}

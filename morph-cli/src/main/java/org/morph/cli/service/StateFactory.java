package org.morph.cli.service;

import org.morph.state.MigrationState;
import org.postgresql.ds.PGSimpleDataSource;

/**
 * Creates the {@link MigrationState} a command operates on.
 */
@FunctionalInterface
public interface StateFactory {

    MigrationState create(ConnectionSettings settings);

    /**
     * PostgreSQL state over an unpooled data source; connections are opened on demand.
     */
    static StateFactory postgres() {
        return settings -> {
            PGSimpleDataSource dataSource = new PGSimpleDataSource();
            dataSource.setURL(settings.url());
            if (settings.username() != null) {
                dataSource.setUser(settings.username());
            }
            if (settings.password() != null) {
                dataSource.setPassword(settings.password());
            }
            return MigrationState.postgres(dataSource, settings.stateSchema(), settings.queryTimeoutSeconds());
        };
    }
}

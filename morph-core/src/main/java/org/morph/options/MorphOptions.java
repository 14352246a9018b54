package org.morph.options;

/**
 * Configuration keys and defaults shared by the CLI and embedders of the core.
 */
public final class MorphOptions {

    private MorphOptions() {
    }

    /**
     * Profile-related settings.
     */
    public static final class Profile {
        private Profile() {}

        public static final String DEFAULT = "dev";

        public static final String ENV_VAR = "MORPH_PROFILE";

        public static final String CONFIG_FILE = "morph.yaml";
    }

    /**
     * Connection to the database whose schemas are migrated.
     */
    public static final class Database {
        private Database() {}

        public static final String URL_KEY = "morph.database.url";
        public static final String USERNAME_KEY = "morph.database.username";
        public static final String PASSWORD_KEY = "morph.database.password";
    }

    /**
     * Where and how migration state is kept.
     */
    public static final class State {
        private State() {}

        /**
         * Schema holding the migration history tables.
         * Default: morph
         */
        public static final String SCHEMA_KEY = "morph.state.schema";
        public static final String SCHEMA_DEFAULT = "morph";

        /**
         * Per-statement timeout for catalog and state queries, 0 for none.
         */
        public static final String QUERY_TIMEOUT_KEY = "morph.state.queryTimeoutSeconds";
        public static final int QUERY_TIMEOUT_DEFAULT = 0;
    }
}

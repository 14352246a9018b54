package org.morph.state.guard;

import lombok.extern.slf4j.Slf4j;
import org.morph.exception.AlreadyActiveException;
import org.morph.exception.StoreException;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Guard backed by PostgreSQL session-level advisory locks, keyed by
 * {@code (LOCK_NAMESPACE, hashtext(schemaName))}. Each lease pins its own connection;
 * if the holder dies, the server drops the lock together with the session.
 */
@Slf4j
public class AdvisoryLockGuard implements ConcurrencyGuard {

    /** First half of the two-key advisory lock, "morp" in ASCII. */
    static final int LOCK_NAMESPACE = 0x6D6F7270;

    private static final String TRY_LOCK = "SELECT pg_try_advisory_lock(?, hashtext(?))";
    private static final String UNLOCK = "SELECT pg_advisory_unlock(?, hashtext(?))";

    private final DataSource dataSource;

    public AdvisoryLockGuard(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public GuardLease acquire(String schemaName) {
        Connection conn = null;
        try {
            conn = dataSource.getConnection();
            if (!runLockFunction(conn, TRY_LOCK, schemaName)) {
                conn.close();
                throw new AlreadyActiveException(schemaName, "acquire migration lock");
            }
            return new Lease(conn, schemaName);
        } catch (SQLException e) {
            closeQuietly(conn, schemaName);
            throw new StoreException(schemaName, "acquire migration lock", e);
        }
    }

    private static boolean runLockFunction(Connection conn, String sql, String schemaName) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setInt(1, LOCK_NAMESPACE);
            stmt.setString(2, schemaName);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() && rs.getBoolean(1);
            }
        }
    }

    private static void closeQuietly(Connection conn, String schemaName) {
        if (conn == null) {
            return;
        }
        try {
            conn.close();
        } catch (SQLException e) {
            log.warn("Failed to close lock connection for schema '{}': {}", schemaName, e.getMessage());
        }
    }

    private static final class Lease implements GuardLease {
        private final Connection conn;
        private final String schemaName;
        private final AtomicBoolean released = new AtomicBoolean();

        private Lease(Connection conn, String schemaName) {
            this.conn = conn;
            this.schemaName = schemaName;
        }

        @Override
        public String schemaName() {
            return schemaName;
        }

        @Override
        public void release() {
            if (!released.compareAndSet(false, true)) {
                return;
            }
            try {
                if (!runLockFunction(conn, UNLOCK, schemaName)) {
                    log.warn("Migration lock for schema '{}' was not held at release", schemaName);
                }
                conn.close();
            } catch (SQLException e) {
                log.error("Failed to release migration lock for schema '{}'; the schema stays locked "
                        + "until the lock session ends", schemaName, e);
                closeQuietly(conn, schemaName);
                throw new StoreException(schemaName, "release migration lock", e);
            }
        }
    }
}

// file: storage/src/main/java/io/tasksync/storage/PostgresSyncStorage.java
package io.tasksync.storage;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import java.time.Clock;
import java.util.logging.Logger;

/**
 * Networked backend: a PostgreSQL database reached through a HikariCP pool.
 * <p>
 * Several server processes may share one database; the per-client row lock taken by
 * {@link JdbcSyncStorage} keeps them consistent. The schema is not created implicitly:
 * call {@link #initSchema()} (or run postgres-schema.sql by hand) once per database.
 */
public class PostgresSyncStorage extends JdbcSyncStorage {
    private static final Logger log = Logger.getLogger(PostgresSyncStorage.class.getName());

    private final HikariDataSource pool;

    private PostgresSyncStorage(HikariDataSource pool, Clock clock) {
        super(pool, clock);
        this.pool = pool;
    }

    /**
     * Connect to {@code jdbcUrl} (e.g. {@code jdbc:postgresql://db:5432/tasksync}).
     * User and password may be null when they are carried in the URL.
     */
    public static PostgresSyncStorage connect(String jdbcUrl, String user, String password) {
        return connect(jdbcUrl, user, password, Clock.systemUTC());
    }

    public static PostgresSyncStorage connect(String jdbcUrl, String user, String password, Clock clock) {
        HikariConfig cfg = new HikariConfig();
        cfg.setPoolName("tasksync-postgres");
        cfg.setJdbcUrl(jdbcUrl);
        if (user != null) cfg.setUsername(user);
        if (password != null) cfg.setPassword(password);
        cfg.setMaximumPoolSize(16);
        cfg.setTransactionIsolation("TRANSACTION_READ_COMMITTED");

        PostgresSyncStorage storage = new PostgresSyncStorage(new HikariDataSource(cfg), clock);
        log.info(() -> "connected to postgres pool " + cfg.getPoolName());
        return storage;
    }

    /** Create the tables and index if they do not exist yet. */
    public void initSchema() {
        applySchema("postgres-schema.sql");
    }

    @Override
    public void close() {
        pool.close();
    }
}

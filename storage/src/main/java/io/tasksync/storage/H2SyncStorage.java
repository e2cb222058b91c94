// file: storage/src/main/java/io/tasksync/storage/H2SyncStorage.java
package io.tasksync.storage;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Embedded backend: an H2 database file under the data directory.
 * <p>
 * Layout:
 *  dataDir/
 *    tasksync.mv.db
 * <p>
 * The file is owned by this process (H2 file locking), so the store behaves as a
 * single-writer database: write transactions are serialized on one lock, readers
 * run concurrently. The schema is created on open if missing.
 */
public class H2SyncStorage extends JdbcSyncStorage {
    private static final Logger log = Logger.getLogger(H2SyncStorage.class.getName());

    static final String DB_NAME = "tasksync";

    private final HikariDataSource pool;
    private final ReentrantLock writeLock = new ReentrantLock();

    private H2SyncStorage(HikariDataSource pool, Clock clock) {
        super(pool, clock);
        this.pool = pool;
    }

    /** Open (or create) the database under {@code dataDir}. */
    public static H2SyncStorage open(Path dataDir) {
        return open(dataDir, Clock.systemUTC());
    }

    public static H2SyncStorage open(Path dataDir, Clock clock) {
        try {
            Files.createDirectories(dataDir);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot create data dir " + dataDir, e);
        }
        Path file = dataDir.toAbsolutePath().resolve(DB_NAME);

        HikariConfig cfg = new HikariConfig();
        cfg.setPoolName("tasksync-h2");
        cfg.setJdbcUrl("jdbc:h2:file:" + file + ";LOCK_TIMEOUT=10000");
        cfg.setUsername("sa");
        cfg.setPassword("");
        cfg.setMaximumPoolSize(8);
        cfg.setTransactionIsolation("TRANSACTION_READ_COMMITTED");

        H2SyncStorage storage = new H2SyncStorage(new HikariDataSource(cfg), clock);
        try {
            storage.applySchema("h2-schema.sql");
        } catch (RuntimeException e) {
            storage.close();
            throw e;
        }
        log.info(() -> "opened H2 storage at " + file);
        return storage;
    }

    @Override
    protected <T> T inWriteTransaction(String operation, SqlWork<T> work) {
        writeLock.lock();
        try {
            return super.inWriteTransaction(operation, work);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void close() {
        pool.close();
    }
}

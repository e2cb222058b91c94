// file: storage/src/main/java/io/tasksync/storage/JdbcSyncStorage.java
package io.tasksync.storage;

import io.tasksync.core.Client;
import io.tasksync.core.RetentionPolicy;
import io.tasksync.core.SnapshotData;
import io.tasksync.core.SnapshotInfo;
import io.tasksync.core.Version;
import io.tasksync.core.VersionIds;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.logging.Logger;

/**
 * {@link SyncStorage} over a JDBC {@link DataSource} with the two-table layout:
 * <pre>
 *   clients(client_id PK, latest_version_id, snapshot_version_id,
 *           versions_since_snapshot, snapshot_timestamp, snapshot)
 *   versions(client_id FK, version_id, parent_version_id, history_segment,
 *            PK(client_id, version_id))
 * </pre>
 * Concurrency:
 *  - Every operation runs in one transaction at READ COMMITTED.
 *  - Check-then-write operations first lock the client row with SELECT ... FOR UPDATE, so
 *    a second writer for the same client waits and then sees the committed head.
 *  - addVersion moves the head before inserting the version row. A failing insert
 *    (for example a duplicate version id) therefore rolls back the head move as well.
 * <p>
 * Timestamps are stored as epoch seconds.
 */
public abstract class JdbcSyncStorage implements SyncStorage {
    private static final Logger log = Logger.getLogger(JdbcSyncStorage.class.getName());

    /** SQLState for unique / primary key violations (Postgres and H2). */
    static final String UNIQUE_VIOLATION = "23505";

    private static final String SELECT_CLIENT =
            "SELECT latest_version_id, versions_since_snapshot, snapshot_version_id, snapshot_timestamp"
                    + " FROM clients WHERE client_id = ?";

    private final DataSource dataSource;
    private final Clock clock;

    protected JdbcSyncStorage(DataSource dataSource, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Unit of work executed inside a transaction. */
    @FunctionalInterface
    protected interface SqlWork<T> {
        T run(Connection c) throws SQLException;
    }

    @Override
    public Client getClient(UUID clientId) {
        return inTransaction("getClient", c -> selectClient(c, clientId, false));
    }

    @Override
    public Client createClient(UUID clientId) {
        Objects.requireNonNull(clientId, "clientId");
        try {
            return inWriteTransaction("createClient", c -> {
                try (PreparedStatement ps = c.prepareStatement(
                        "INSERT INTO clients (client_id, latest_version_id, versions_since_snapshot)"
                                + " VALUES (?, ?, 0)")) {
                    ps.setObject(1, clientId);
                    ps.setObject(2, VersionIds.NIL);
                    ps.executeUpdate();
                }
                return Client.fresh(clientId);
            });
        } catch (StorageException e) {
            if (e.getCause() instanceof SQLException sql && UNIQUE_VIOLATION.equals(sql.getSQLState())) {
                throw new ClientAlreadyExistsException(clientId);
            }
            throw e;
        }
    }

    @Override
    public Version getVersionByParent(UUID clientId, UUID parentVersionId) {
        return inTransaction("getVersionByParent", c -> selectVersion(c,
                "SELECT version_id, parent_version_id, history_segment FROM versions"
                        + " WHERE client_id = ? AND parent_version_id = ?",
                clientId, parentVersionId));
    }

    @Override
    public Version getVersion(UUID clientId, UUID versionId) {
        return inTransaction("getVersion", c -> selectVersion(c,
                "SELECT version_id, parent_version_id, history_segment FROM versions"
                        + " WHERE client_id = ? AND version_id = ?",
                clientId, versionId));
    }

    @Override
    public AddVersionOutcome addVersion(
            UUID clientId, UUID parentVersionId, UUID newVersionId, byte[] historySegment) {
        Objects.requireNonNull(parentVersionId, "parentVersionId");
        Objects.requireNonNull(newVersionId, "newVersionId");
        Objects.requireNonNull(historySegment, "historySegment");
        return inWriteTransaction("addVersion", c -> {
            Client client = selectClient(c, clientId, true);
            if (client == null) {
                throw new NoSuchClientException(clientId);
            }
            if (!client.latestVersionId().equals(parentVersionId)) {
                return new AddVersionOutcome.Conflict(client.latestVersionId());
            }

            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE clients SET latest_version_id = ?, versions_since_snapshot = versions_since_snapshot + 1"
                            + " WHERE client_id = ? AND latest_version_id = ?")) {
                ps.setObject(1, newVersionId);
                ps.setObject(2, clientId);
                ps.setObject(3, parentVersionId);
                if (ps.executeUpdate() != 1) {
                    // Row lock held, so this means the head moved under us anyway.
                    Client current = selectClient(c, clientId, false);
                    return new AddVersionOutcome.Conflict(current.latestVersionId());
                }
            }
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO versions (client_id, version_id, parent_version_id, history_segment)"
                            + " VALUES (?, ?, ?, ?)")) {
                ps.setObject(1, clientId);
                ps.setObject(2, newVersionId);
                ps.setObject(3, parentVersionId);
                ps.setBytes(4, historySegment);
                ps.executeUpdate();
            }
            return new AddVersionOutcome.Committed(new Client(
                    clientId, newVersionId, client.versionsSinceSnapshot() + 1, client.snapshot()));
        });
    }

    @Override
    public SnapshotOutcome addSnapshot(
            UUID clientId, UUID versionId, byte[] snapshot, RetentionPolicy retention) {
        Objects.requireNonNull(snapshot, "snapshot");
        return inWriteTransaction("addSnapshot", c -> {
            Client client = selectClient(c, clientId, true);
            if (client == null) {
                throw new NoSuchClientException(clientId);
            }
            if (!client.hasVersions() || !client.latestVersionId().equals(versionId)) {
                return SnapshotOutcome.VERSION_MISMATCH;
            }

            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE clients SET snapshot_version_id = ?, snapshot_timestamp = ?, snapshot = ?,"
                            + " versions_since_snapshot = 0 WHERE client_id = ?")) {
                ps.setObject(1, versionId);
                ps.setLong(2, clock.instant().getEpochSecond());
                ps.setBytes(3, snapshot);
                ps.setObject(4, clientId);
                ps.executeUpdate();
            }
            if (retention == RetentionPolicy.PRUNE_ON_SNAPSHOT) {
                try (PreparedStatement ps = c.prepareStatement("DELETE FROM versions WHERE client_id = ?")) {
                    ps.setObject(1, clientId);
                    int pruned = ps.executeUpdate();
                    log.fine(() -> "pruned " + pruned + " versions of client " + clientId);
                }
            }
            return SnapshotOutcome.ACCEPTED;
        });
    }

    @Override
    public SnapshotData getSnapshotData(UUID clientId) {
        return inTransaction("getSnapshotData", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT snapshot_version_id, snapshot FROM clients WHERE client_id = ?")) {
                ps.setObject(1, clientId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        return null;
                    }
                    UUID versionId = rs.getObject("snapshot_version_id", UUID.class);
                    byte[] data = rs.getBytes("snapshot");
                    return versionId == null || data == null ? null : new SnapshotData(versionId, data);
                }
            }
        });
    }

    /**
     * Run {@code work} in its own transaction: commit on success, roll back on any failure.
     * SQL failures surface as {@link StorageException}; runtime exceptions thrown by the work
     * itself (e.g. {@link NoSuchClientException}) pass through after the rollback.
     */
    protected <T> T inTransaction(String operation, SqlWork<T> work) {
        try (Connection c = dataSource.getConnection()) {
            c.setAutoCommit(false);
            try {
                T result = work.run(c);
                c.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollback(c, e);
                throw e;
            }
        } catch (SQLException e) {
            throw new StorageException(operation + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * Transactions that write. Backends with a single-writer model can serialize them here;
     * the default is a plain {@link #inTransaction}.
     */
    protected <T> T inWriteTransaction(String operation, SqlWork<T> work) {
        return inTransaction(operation, work);
    }

    /** Execute the ';'-separated DDL statements of a classpath resource next to this class. */
    protected void applySchema(String resource) {
        String script;
        try (InputStream in = JdbcSyncStorage.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new StorageException("schema resource not found: " + resource);
            }
            script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StorageException("cannot read schema resource " + resource, e);
        }
        inTransaction("applySchema", c -> {
            try (Statement st = c.createStatement()) {
                for (String stmt : script.split(";")) {
                    String sql = stmt.strip();
                    if (!sql.isEmpty()) {
                        st.execute(sql);
                    }
                }
            }
            return null;
        });
        log.info(() -> "applied schema " + resource);
    }

    private static void rollback(Connection c, Exception cause) {
        try {
            c.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    private static Client selectClient(Connection c, UUID clientId, boolean forUpdate) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(forUpdate ? SELECT_CLIENT + " FOR UPDATE" : SELECT_CLIENT)) {
            ps.setObject(1, clientId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return null;
                }
                UUID latest = rs.getObject("latest_version_id", UUID.class);
                int sinceSnapshot = rs.getInt("versions_since_snapshot");
                UUID snapshotVersion = rs.getObject("snapshot_version_id", UUID.class);
                long seconds = rs.getLong("snapshot_timestamp");
                boolean noTimestamp = rs.wasNull();

                SnapshotInfo snapshot = snapshotVersion == null || noTimestamp
                        ? null
                        : new SnapshotInfo(snapshotVersion, Instant.ofEpochSecond(seconds));
                return new Client(clientId, latest, sinceSnapshot, snapshot);
            }
        }
    }

    private static Version selectVersion(Connection c, String sql, UUID clientId, UUID key) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setObject(1, clientId);
            ps.setObject(2, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return null;
                }
                return new Version(
                        rs.getObject("version_id", UUID.class),
                        rs.getObject("parent_version_id", UUID.class),
                        rs.getBytes("history_segment"));
            }
        }
    }
}

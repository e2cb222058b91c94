// file: storage/src/main/java/io/tasksync/storage/InMemorySyncStorage.java
package io.tasksync.storage;

import io.tasksync.core.Client;
import io.tasksync.core.RetentionPolicy;
import io.tasksync.core.SnapshotData;
import io.tasksync.core.SnapshotInfo;
import io.tasksync.core.Version;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Volatile {@link SyncStorage} for tests and throwaway servers.
 * <p>
 * Responsibilities:
 *  - Keep clients, versions and snapshot bytes in plain maps.
 *  - Make each operation atomic by holding the instance monitor for its whole duration,
 *    and by validating everything before the first mutation.
 * <p>
 * Note:
 *  - Snapshot timestamps are truncated to whole seconds, matching the SQL backends.
 *  - All state is lost on close.
 */
public class InMemorySyncStorage implements SyncStorage {
    private final Map<UUID, Client> clients = new HashMap<>();
    private final Map<UUID, byte[]> snapshots = new HashMap<>();
    // (client, versionId) -> version
    private final Map<VersionKey, Version> versions = new HashMap<>();
    // (client, parentVersionId) -> child versionId
    private final Map<VersionKey, UUID> childByParent = new HashMap<>();
    private final Clock clock;

    public InMemorySyncStorage() {
        this(Clock.systemUTC());
    }

    public InMemorySyncStorage(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public synchronized Client getClient(UUID clientId) {
        return clients.get(clientId);
    }

    @Override
    public synchronized Client createClient(UUID clientId) {
        Objects.requireNonNull(clientId, "clientId");
        if (clients.containsKey(clientId)) {
            throw new ClientAlreadyExistsException(clientId);
        }
        Client fresh = Client.fresh(clientId);
        clients.put(clientId, fresh);
        return fresh;
    }

    @Override
    public synchronized Version getVersionByParent(UUID clientId, UUID parentVersionId) {
        UUID child = childByParent.get(new VersionKey(clientId, parentVersionId));
        return child == null ? null : versions.get(new VersionKey(clientId, child));
    }

    @Override
    public synchronized Version getVersion(UUID clientId, UUID versionId) {
        return versions.get(new VersionKey(clientId, versionId));
    }

    @Override
    public synchronized AddVersionOutcome addVersion(
            UUID clientId, UUID parentVersionId, UUID newVersionId, byte[] historySegment) {
        Client client = requireClient(clientId);
        if (!client.latestVersionId().equals(parentVersionId)) {
            return new AddVersionOutcome.Conflict(client.latestVersionId());
        }
        VersionKey key = new VersionKey(clientId, newVersionId);
        if (versions.containsKey(key)) {
            throw new StorageException("duplicate version id " + newVersionId + " for client " + clientId);
        }

        Version version = new Version(newVersionId, parentVersionId, historySegment);
        Client updated = new Client(
                clientId, newVersionId, client.versionsSinceSnapshot() + 1, client.snapshot());
        versions.put(key, version);
        childByParent.put(new VersionKey(clientId, parentVersionId), newVersionId);
        clients.put(clientId, updated);
        return new AddVersionOutcome.Committed(updated);
    }

    @Override
    public synchronized SnapshotOutcome addSnapshot(
            UUID clientId, UUID versionId, byte[] snapshot, RetentionPolicy retention) {
        Objects.requireNonNull(snapshot, "snapshot");
        Client client = requireClient(clientId);
        if (!client.hasVersions() || !client.latestVersionId().equals(versionId)) {
            return SnapshotOutcome.VERSION_MISMATCH;
        }

        SnapshotInfo info = new SnapshotInfo(versionId, clock.instant().truncatedTo(ChronoUnit.SECONDS));
        clients.put(clientId, new Client(clientId, client.latestVersionId(), 0, info));
        snapshots.put(clientId, Arrays.copyOf(snapshot, snapshot.length));
        if (retention == RetentionPolicy.PRUNE_ON_SNAPSHOT) {
            versions.keySet().removeIf(k -> k.clientId().equals(clientId));
            childByParent.keySet().removeIf(k -> k.clientId().equals(clientId));
        }
        return SnapshotOutcome.ACCEPTED;
    }

    @Override
    public synchronized SnapshotData getSnapshotData(UUID clientId) {
        Client client = clients.get(clientId);
        byte[] data = snapshots.get(clientId);
        if (client == null || !client.hasSnapshot() || data == null) {
            return null;
        }
        return new SnapshotData(client.snapshot().versionId(), data);
    }

    @Override
    public synchronized void close() {
        clients.clear();
        snapshots.clear();
        versions.clear();
        childByParent.clear();
    }

    private Client requireClient(UUID clientId) {
        Client client = clients.get(clientId);
        if (client == null) {
            throw new NoSuchClientException(clientId);
        }
        return client;
    }

    private record VersionKey(UUID clientId, UUID versionId) {}
}

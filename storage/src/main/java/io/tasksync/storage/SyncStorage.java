// file: storage/src/main/java/io/tasksync/storage/SyncStorage.java
package io.tasksync.storage;

import io.tasksync.core.Client;
import io.tasksync.core.RetentionPolicy;
import io.tasksync.core.SnapshotData;
import io.tasksync.core.Version;

import java.util.UUID;

/**
 * Transactional storage contract behind the sync protocol.
 * <p>
 * Semantics every implementation must provide:
 *  - Each method is one atomic transaction. A failure rolls it back entirely and
 *    surfaces as {@link StorageException}; no partial state is ever visible.
 *  - {@link #addVersion} and {@link #addSnapshot} are check-then-write operations and must
 *    be serializable with respect to other calls for the same client id. Two concurrent
 *    addVersion calls with the same parent must never both commit.
 *  - Calls for different client ids need no mutual isolation.
 *  - Lookups return null when nothing matches.
 * <p>
 * The guarantee must come from the backend's transaction model, not from locks in the
 * calling process, since several server processes may share one backend.
 */
public interface SyncStorage extends AutoCloseable {

    /** The client, or null if it was never created. */
    Client getClient(UUID clientId);

    /**
     * Insert a client with an empty chain and no snapshot.
     *
     * @throws ClientAlreadyExistsException if the client already exists
     */
    Client createClient(UUID clientId);

    /** The single version of this client whose parent is {@code parentVersionId}, or null. */
    Version getVersionByParent(UUID clientId, UUID parentVersionId);

    /**
     * The version with this id, or null.
     * <p>
     * Lookup for inspection and tests. The sync protocol walks the chain by parent
     * through {@link #getVersionByParent} and does not call this.
     */
    Version getVersion(UUID clientId, UUID versionId);

    /**
     * Compare-and-set on the client's head.
     * <ul>
     *   <li>If the head equals {@code parentVersionId}: store the version, move the head to
     *       {@code newVersionId}, increment versions-since-snapshot and return
     *       {@link AddVersionOutcome.Committed} with the updated client.</li>
     *   <li>Otherwise write nothing and return {@link AddVersionOutcome.Conflict} with the
     *       actual head.</li>
     * </ul>
     *
     * @throws NoSuchClientException if the client does not exist
     */
    AddVersionOutcome addVersion(UUID clientId, UUID parentVersionId, UUID newVersionId, byte[] historySegment);

    /**
     * Store a snapshot if {@code versionId} is the client's current, non-nil head.
     * On success the snapshot version, timestamp and bytes are replaced and
     * versions-since-snapshot is reset to 0; with {@link RetentionPolicy#PRUNE_ON_SNAPSHOT}
     * the client's stored versions are deleted in the same transaction.
     * Otherwise nothing changes.
     *
     * @throws NoSuchClientException if the client does not exist
     */
    SnapshotOutcome addSnapshot(UUID clientId, UUID versionId, byte[] snapshot, RetentionPolicy retention);

    default SnapshotOutcome addSnapshot(UUID clientId, UUID versionId, byte[] snapshot) {
        return addSnapshot(clientId, versionId, snapshot, RetentionPolicy.KEEP_ALL);
    }

    /** The latest accepted snapshot, or null if there is none. */
    SnapshotData getSnapshotData(UUID clientId);

    /** Release the backend (pool, database file). Does not throw checked exceptions. */
    @Override
    void close();
}

// file: server/src/main/java/io/tasksync/server/SyncService.java
package io.tasksync.server;

import io.tasksync.core.Client;
import io.tasksync.core.RetentionPolicy;
import io.tasksync.core.SnapshotData;
import io.tasksync.core.SnapshotPolicy;
import io.tasksync.core.SnapshotUrgency;
import io.tasksync.core.Version;
import io.tasksync.core.VersionIds;
import io.tasksync.storage.AddVersionOutcome;
import io.tasksync.storage.ClientAlreadyExistsException;
import io.tasksync.storage.NoSuchClientException;
import io.tasksync.storage.SnapshotOutcome;
import io.tasksync.storage.StorageException;
import io.tasksync.storage.SyncStorage;

import java.util.Objects;
import java.util.UUID;
import java.util.logging.Logger;

/**
 * Application service implementing the sync protocol transactions.
 *
 * Responsibilities:
 *  - Apply the client access policy and create unknown clients on first contact.
 *  - Generate version ids; ids proposed by clients are never trusted.
 *  - Translate storage outcomes into protocol results (found / not found / gone,
 *    accepted / conflict) and attach the snapshot urgency to accepted versions.
 *
 * The service holds no mutable state; every decision is made by one storage
 * transaction. It never retries on conflict: the client rebases and tries again.
 */
public class SyncService {
    private static final Logger log = Logger.getLogger(SyncService.class.getName());

    private final SyncStorage storage;
    private final ClientPolicy clientPolicy;
    private final SnapshotPolicy snapshotPolicy;
    private final RetentionPolicy retention;

    /** Open client policy, default snapshot thresholds, full history kept. */
    public SyncService(SyncStorage storage) {
        this(storage, ClientPolicy.open(), SnapshotPolicy.defaults(), RetentionPolicy.KEEP_ALL);
    }

    public SyncService(SyncStorage storage,
                       ClientPolicy clientPolicy,
                       SnapshotPolicy snapshotPolicy,
                       RetentionPolicy retention) {
        this.storage = Objects.requireNonNull(storage, "storage");
        this.clientPolicy = Objects.requireNonNull(clientPolicy, "clientPolicy");
        this.snapshotPolicy = Objects.requireNonNull(snapshotPolicy, "snapshotPolicy");
        this.retention = Objects.requireNonNull(retention, "retention");
    }

    /**
     * GetChildVersion: the version whose parent is {@code parentVersionId}.
     *
     *  - Found:    a stored child exists.
     *  - NotFound: the parent is the head, or the chain is still empty (nothing newer yet).
     *  - Gone:     the parent is not the head and has no stored child; its history was
     *              pruned or never existed, and the caller should restart from the snapshot.
     */
    public ChildVersion getChildVersion(UUID clientId, UUID parentVersionId) {
        Objects.requireNonNull(parentVersionId, "parentVersionId");
        Client client = ensureClient(clientId);

        Version child = storage.getVersionByParent(clientId, parentVersionId);
        if (child != null) {
            return new ChildVersion.Found(child);
        }
        if (!client.hasVersions() || client.latestVersionId().equals(parentVersionId)) {
            return new ChildVersion.NotFound();
        }
        return new ChildVersion.Gone();
    }

    /**
     * AddVersion: append {@code historySegment} after {@code parentVersionId}.
     * Accepted carries the new id and the snapshot urgency computed from the updated client;
     * Conflict carries the actual head the client must rebase onto.
     */
    public AddVersionResult addVersion(UUID clientId, UUID parentVersionId, byte[] historySegment) {
        Objects.requireNonNull(parentVersionId, "parentVersionId");
        Objects.requireNonNull(historySegment, "historySegment");
        if (historySegment.length == 0) {
            throw new IllegalArgumentException("history segment must not be empty");
        }
        ensureClient(clientId);

        UUID versionId = VersionIds.newVersionId();
        AddVersionOutcome outcome = storage.addVersion(clientId, parentVersionId, versionId, historySegment);

        if (outcome instanceof AddVersionOutcome.Committed committed) {
            SnapshotUrgency urgency = snapshotPolicy.urgencyFor(committed.client());
            log.fine(() -> "client " + clientId + ": accepted " + versionId
                    + " after " + parentVersionId + " (snapshot urgency " + urgency + ")");
            return new AddVersionResult.Accepted(versionId, urgency);
        }
        UUID head = ((AddVersionOutcome.Conflict) outcome).latestVersionId();
        log.fine(() -> "client " + clientId + ": conflict, parent " + parentVersionId + " but head is " + head);
        return new AddVersionResult.Conflict(head);
    }

    /**
     * AddSnapshot: store {@code snapshot} as the state at {@code versionId}.
     * A snapshot that is not at the current head is discarded and reported as
     * {@link SnapshotOutcome#VERSION_MISMATCH}; that is not an error.
     */
    public SnapshotOutcome addSnapshot(UUID clientId, UUID versionId, byte[] snapshot) {
        Objects.requireNonNull(versionId, "versionId");
        Objects.requireNonNull(snapshot, "snapshot");
        if (snapshot.length == 0) {
            throw new IllegalArgumentException("snapshot must not be empty");
        }
        ensureClient(clientId);

        SnapshotOutcome outcome = storage.addSnapshot(clientId, versionId, snapshot, retention);
        log.fine(() -> "client " + clientId + ": snapshot at " + versionId + " -> " + outcome);
        return outcome;
    }

    /** GetSnapshot: the latest accepted snapshot, or null if none was ever accepted. */
    public SnapshotData getSnapshot(UUID clientId) {
        ensureClient(clientId);
        return storage.getSnapshotData(clientId);
    }

    /**
     * Load the client, creating it when the policy allows.
     * A concurrent creation by another request is not an error: the winner's row is re-read.
     */
    Client ensureClient(UUID clientId) {
        Objects.requireNonNull(clientId, "clientId");
        clientPolicy.checkAllowed(clientId);

        Client client = storage.getClient(clientId);
        if (client != null) {
            return client;
        }
        if (!clientPolicy.createClients()) {
            throw new NoSuchClientException(clientId);
        }
        try {
            Client created = storage.createClient(clientId);
            log.info(() -> "created client " + clientId);
            return created;
        } catch (ClientAlreadyExistsException race) {
            Client existing = storage.getClient(clientId);
            if (existing == null) {
                throw new StorageException("client " + clientId + " reported as existing but not readable", race);
            }
            return existing;
        }
    }

    // ---------- view models ----------

    /** Result of {@link #getChildVersion}. */
    public sealed interface ChildVersion permits ChildVersion.Found, ChildVersion.NotFound, ChildVersion.Gone {
        record Found(Version version) implements ChildVersion {}
        record NotFound() implements ChildVersion {}
        record Gone() implements ChildVersion {}
    }

    /** Result of {@link #addVersion}. */
    public sealed interface AddVersionResult permits AddVersionResult.Accepted, AddVersionResult.Conflict {
        record Accepted(UUID versionId, SnapshotUrgency snapshotUrgency) implements AddVersionResult {
            public boolean snapshotRequested() {
                return snapshotUrgency.requested();
            }
        }

        record Conflict(UUID expectedParentVersionId) implements AddVersionResult {}
    }
}

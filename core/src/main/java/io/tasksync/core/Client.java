// file: core/src/main/java/io/tasksync/core/Client.java
package io.tasksync.core;

import java.util.Objects;
import java.util.UUID;

/**
 * Stored metadata about one synchronizing client.
 * <p>
 * Fields:
 *  - clientId:              stable identity of the client.
 *  - latestVersionId:       head of the version chain, {@link VersionIds#NIL} when empty.
 *  - versionsSinceSnapshot: versions added since the last accepted snapshot.
 *  - snapshot:              metadata of the last accepted snapshot, or null if none.
 * <p>
 * The snapshot bytes are not part of this record; see {@link SnapshotData}.
 */
public record Client(
        UUID clientId,
        UUID latestVersionId,
        int versionsSinceSnapshot,
        SnapshotInfo snapshot
) {
    public Client {
        Objects.requireNonNull(clientId, "clientId");
        Objects.requireNonNull(latestVersionId, "latestVersionId");
        if (versionsSinceSnapshot < 0) {
            throw new IllegalArgumentException("versionsSinceSnapshot must be >= 0");
        }
    }

    /** A client as it looks on first contact: empty chain, no snapshot. */
    public static Client fresh(UUID clientId) {
        return new Client(clientId, VersionIds.NIL, 0, null);
    }

    public boolean hasVersions() {
        return !VersionIds.isNil(latestVersionId);
    }

    public boolean hasSnapshot() {
        return snapshot != null;
    }
}

// file: core/src/main/java/io/tasksync/core/SnapshotInfo.java
package io.tasksync.core;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/** Metadata about an accepted snapshot: the version it captures and when it was stored. */
public record SnapshotInfo(UUID versionId, Instant timestamp) {
    public SnapshotInfo {
        Objects.requireNonNull(versionId, "versionId");
        Objects.requireNonNull(timestamp, "timestamp");
    }
}

// file: core/src/main/java/io/tasksync/core/SnapshotData.java
package io.tasksync.core;

import java.util.Arrays;
import java.util.Objects;
import java.util.UUID;

/** The latest snapshot of a client: the version it captures plus the opaque blob. */
public final class SnapshotData {
    private final UUID versionId;
    private final byte[] data;

    public SnapshotData(UUID versionId, byte[] data) {
        this.versionId = Objects.requireNonNull(versionId, "versionId");
        Objects.requireNonNull(data, "data");
        this.data = Arrays.copyOf(data, data.length);
    }

    public UUID versionId() { return versionId; }

    public byte[] data() { return Arrays.copyOf(data, data.length); }
}

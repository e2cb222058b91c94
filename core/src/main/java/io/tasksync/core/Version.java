// file: core/src/main/java/io/tasksync/core/Version.java
package io.tasksync.core;

import java.util.Arrays;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable envelope for one accepted delta in a client's chain.
 * <p>
 * Fields:
 *  - versionId:        server-generated id of this version.
 *  - parentVersionId:  the version this one extends ({@link VersionIds#NIL} for the first).
 *  - historySegment:   opaque encrypted bytes, never inspected by the server.
 * <p>
 * Invariants:
 *  - All fields are immutable.
 *  - Segment bytes are copied on input and output.
 */
public final class Version {
    private final UUID versionId;
    private final UUID parentVersionId;
    private final byte[] historySegment;

    public Version(UUID versionId, UUID parentVersionId, byte[] historySegment) {
        this.versionId = Objects.requireNonNull(versionId, "versionId");
        this.parentVersionId = Objects.requireNonNull(parentVersionId, "parentVersionId");
        Objects.requireNonNull(historySegment, "historySegment");
        this.historySegment = Arrays.copyOf(historySegment, historySegment.length);
    }

    public UUID versionId() { return versionId; }

    public UUID parentVersionId() { return parentVersionId; }

    public byte[] historySegment() { return Arrays.copyOf(historySegment, historySegment.length); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Version other)) return false;
        return versionId.equals(other.versionId)
                && parentVersionId.equals(other.parentVersionId)
                && Arrays.equals(historySegment, other.historySegment);
    }

    @Override
    public int hashCode() {
        return Objects.hash(versionId, parentVersionId, Arrays.hashCode(historySegment));
    }

    @Override
    public String toString() {
        return "Version[" + versionId + " <- " + parentVersionId + ", " + historySegment.length + " bytes]";
    }
}

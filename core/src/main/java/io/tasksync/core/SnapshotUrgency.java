// file: core/src/main/java/io/tasksync/core/SnapshotUrgency.java
package io.tasksync.core;

/**
 * How strongly the server asks a replica to upload a snapshot.
 * Declaration order is significant: NONE &lt; LOW &lt; HIGH.
 */
public enum SnapshotUrgency {
    NONE,
    LOW,
    HIGH;

    public static SnapshotUrgency max(SnapshotUrgency a, SnapshotUrgency b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    /** True when any snapshot is wanted. */
    public boolean requested() {
        return this != NONE;
    }
}

// file: storage/src/main/java/io/tasksync/storage/SnapshotOutcome.java
package io.tasksync.storage;

/** Result of {@link SyncStorage#addSnapshot}. */
public enum SnapshotOutcome {
    ACCEPTED,
    /** The snapshot's version is not the current head; nothing was stored. */
    VERSION_MISMATCH
}

// file: core/src/main/java/io/tasksync/core/RetentionPolicy.java
package io.tasksync.core;

/**
 * What happens to stored versions once a snapshot is accepted.
 *
 *  - KEEP_ALL:          versions are never deleted (the chain stays fully walkable).
 *  - PRUNE_ON_SNAPSHOT: the versions covered by the snapshot are deleted in the same
 *                       transaction that stores it. Replicas behind the snapshot
 *                       see "gone" and restart from the snapshot.
 */
public enum RetentionPolicy {
    KEEP_ALL,
    PRUNE_ON_SNAPSHOT;

    /** Parse the CLI spelling ("keep-all", "prune-on-snapshot"). */
    public static RetentionPolicy parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("retention policy must not be null");
        }
        return switch (text.trim().toLowerCase()) {
            case "keep-all" -> KEEP_ALL;
            case "prune-on-snapshot" -> PRUNE_ON_SNAPSHOT;
            default -> throw new IllegalArgumentException(
                    "retention must be one of: keep-all, prune-on-snapshot");
        };
    }
}

// file: storage/src/main/java/io/tasksync/storage/AddVersionOutcome.java
package io.tasksync.storage;

import io.tasksync.core.Client;

import java.util.UUID;

/**
 * Result of {@link SyncStorage#addVersion}:
 *  - Committed: the version now heads the chain; carries the client after the update.
 *  - Conflict:  the declared parent was not the head; carries the actual head.
 */
public sealed interface AddVersionOutcome permits AddVersionOutcome.Committed, AddVersionOutcome.Conflict {
    record Committed(Client client) implements AddVersionOutcome {}
    record Conflict(UUID latestVersionId) implements AddVersionOutcome {}
}

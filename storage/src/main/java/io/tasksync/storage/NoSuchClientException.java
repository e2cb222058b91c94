// file: storage/src/main/java/io/tasksync/storage/NoSuchClientException.java
package io.tasksync.storage;

import java.util.UUID;

/** The client is unknown and may not be (or has not been) created. */
public class NoSuchClientException extends RuntimeException {
    private final UUID clientId;

    public NoSuchClientException(UUID clientId) {
        super("no such client: " + clientId);
        this.clientId = clientId;
    }

    public UUID clientId() {
        return clientId;
    }
}

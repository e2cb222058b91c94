// file: storage/src/main/java/io/tasksync/storage/ClientAlreadyExistsException.java
package io.tasksync.storage;

import java.util.UUID;

/** Raised by {@link SyncStorage#createClient} when another request created the client first. */
public class ClientAlreadyExistsException extends RuntimeException {
    private final UUID clientId;

    public ClientAlreadyExistsException(UUID clientId) {
        super("client already exists: " + clientId);
        this.clientId = clientId;
    }

    public UUID clientId() {
        return clientId;
    }
}

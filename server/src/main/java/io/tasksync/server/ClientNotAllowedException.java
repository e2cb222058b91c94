// file: server/src/main/java/io/tasksync/server/ClientNotAllowedException.java
package io.tasksync.server;

import java.util.UUID;

/** The client id is not on the configured allow-list. */
public class ClientNotAllowedException extends RuntimeException {
    private final UUID clientId;

    public ClientNotAllowedException(UUID clientId) {
        super("client not allowed: " + clientId);
        this.clientId = clientId;
    }

    public UUID clientId() {
        return clientId;
    }
}

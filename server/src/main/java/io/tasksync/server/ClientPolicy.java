// file: server/src/main/java/io/tasksync/server/ClientPolicy.java
package io.tasksync.server;

import java.util.Set;
import java.util.UUID;

/**
 * Who may sync, and whether unknown clients are created on first contact.
 *
 *  - createClients: auto-create a client the first time its id is seen.
 *  - allowList:     accepted client ids, or null to accept every id.
 */
public record ClientPolicy(boolean createClients, Set<UUID> allowList) {

    public ClientPolicy {
        allowList = allowList == null ? null : Set.copyOf(allowList);
    }

    /** Any client id, created on demand. */
    public static ClientPolicy open() {
        return new ClientPolicy(true, null);
    }

    public boolean isAllowed(UUID clientId) {
        return allowList == null || allowList.contains(clientId);
    }

    /** @throws ClientNotAllowedException if the id is outside the allow-list */
    public void checkAllowed(UUID clientId) {
        if (!isAllowed(clientId)) {
            throw new ClientNotAllowedException(clientId);
        }
    }
}

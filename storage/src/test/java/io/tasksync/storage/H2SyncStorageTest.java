// file: storage/src/test/java/io/tasksync/storage/H2SyncStorageTest.java
package io.tasksync.storage;

import io.tasksync.core.Client;
import io.tasksync.core.VersionIds;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class H2SyncStorageTest extends SyncStorageContract {

    @TempDir Path dataDir;

    @Override
    SyncStorage open(Clock clock) {
        return H2SyncStorage.open(dataDir, clock);
    }

    @Test
    void state_survives_reopen() {
        UUID client = UUID.randomUUID();
        storage.createClient(client);
        UUID v1 = UUID.randomUUID();
        storage.addVersion(client, VersionIds.NIL, v1, "seg1".getBytes());
        storage.addSnapshot(client, v1, "blob".getBytes());
        storage.close();

        // "Restart": a new instance over the same directory
        storage = H2SyncStorage.open(dataDir, CLOCK);

        Client c = storage.getClient(client);
        assertEquals(v1, c.latestVersionId());
        assertEquals(v1, c.snapshot().versionId());
        assertArrayEquals("seg1".getBytes(), storage.getVersionByParent(client, VersionIds.NIL).historySegment());
        assertArrayEquals("blob".getBytes(), storage.getSnapshotData(client).data());
        assertTrue(Files.exists(dataDir.resolve(H2SyncStorage.DB_NAME + ".mv.db")));
    }
}

// file: storage/src/test/java/io/tasksync/storage/InMemorySyncStorageTest.java
package io.tasksync.storage;

import java.time.Clock;

class InMemorySyncStorageTest extends SyncStorageContract {

    @Override
    SyncStorage open(Clock clock) {
        return new InMemorySyncStorage(clock);
    }
}

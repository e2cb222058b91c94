// file: storage/src/test/java/io/tasksync/storage/PostgresSyncStorageTest.java
package io.tasksync.storage;

import org.junit.jupiter.api.condition.EnabledIfEnvironmentVariable;

import java.time.Clock;

/**
 * Runs the storage contract against a real PostgreSQL database.
 * Set TASKSYNC_TEST_PG_URL (e.g. jdbc:postgresql://localhost/tasksync_test?user=postgres&password=pw)
 * to enable; every test uses fresh random client ids, so the database may be reused.
 */
@EnabledIfEnvironmentVariable(named = "TASKSYNC_TEST_PG_URL", matches = ".+")
class PostgresSyncStorageTest extends SyncStorageContract {

    @Override
    SyncStorage open(Clock clock) {
        PostgresSyncStorage pg = PostgresSyncStorage.connect(System.getenv("TASKSYNC_TEST_PG_URL"), null, null, clock);
        pg.initSchema();
        return pg;
    }
}

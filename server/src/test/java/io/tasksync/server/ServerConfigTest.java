// file: server/src/test/java/io/tasksync/server/ServerConfigTest.java
package io.tasksync.server;

import io.tasksync.core.RetentionPolicy;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ServerConfigTest {

    private static final UUID A = UUID.fromString("11111111-1111-1111-1111-111111111111");
    private static final UUID B = UUID.fromString("22222222-2222-2222-2222-222222222222");

    @Test
    void defaults_apply_when_only_listen_is_given() {
        var cfg = ServerConfig.fromArgs(new String[]{"--listen", "localhost:8080"}, Map.of());

        assertEquals(List.of(new ListenAddress("localhost", 8080)), cfg.listen());
        assertNull(cfg.allowedClientIds());
        assertTrue(cfg.createClients());
        assertEquals(100, cfg.snapshotVersions());
        assertEquals(14, cfg.snapshotDays());
        assertEquals(RetentionPolicy.KEEP_ALL, cfg.retention());
        assertEquals(ServerConfig.StorageKind.H2, cfg.storage());
        assertEquals("./data", cfg.dataDir());
        assertFalse(cfg.initSchema());
        assertEquals(WebServer.DEFAULT_MAX_BODY_BYTES, cfg.maxBodyBytes());
    }

    @Test
    void environment_supplies_values() {
        var env = Map.of(
                "LISTEN", "0.0.0.0:8080,[::1]:8081",
                "CLIENT_ID", A + "," + B,
                "CREATE_CLIENTS", "false",
                "SNAPSHOT_VERSIONS", "50",
                "SNAPSHOT_DAYS", "7",
                "RETENTION", "prune-on-snapshot",
                "STORAGE", "postgres",
                "CONNECTION", "jdbc:postgresql://db/tasksync");

        var cfg = ServerConfig.fromArgs(new String[0], env);

        assertEquals(List.of(new ListenAddress("0.0.0.0", 8080), new ListenAddress("::1", 8081)), cfg.listen());
        assertEquals(Set.of(A, B), cfg.allowedClientIds());
        assertFalse(cfg.createClients());
        assertEquals(50, cfg.snapshotVersions());
        assertEquals(7, cfg.snapshotDays());
        assertEquals(RetentionPolicy.PRUNE_ON_SNAPSHOT, cfg.retention());
        assertEquals(ServerConfig.StorageKind.POSTGRES, cfg.storage());
        assertEquals("jdbc:postgresql://db/tasksync", cfg.connection());
    }

    @Test
    void flags_win_over_environment() {
        var env = Map.of("LISTEN", "localhost:1", "CLIENT_ID", A.toString(), "STORAGE", "h2");

        var cfg = ServerConfig.fromArgs(new String[]{
                "-l", "localhost:2", "--listen", "localhost:3",
                "-C", B.toString(),
                "--storage", "memory",
                "--snapshot-versions", "10",
                "--no-create-clients",
                "--max-body-bytes", "1024"
        }, env);

        assertEquals(List.of(new ListenAddress("localhost", 2), new ListenAddress("localhost", 3)), cfg.listen());
        assertEquals(Set.of(B), cfg.allowedClientIds());
        assertEquals(ServerConfig.StorageKind.MEMORY, cfg.storage());
        assertEquals(10, cfg.snapshotVersions());
        assertFalse(cfg.createClients());
        assertEquals(1024, cfg.maxBodyBytes());
        assertEquals(Set.of(B), cfg.clientPolicy().allowList());
    }

    @Test
    void invalid_input_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.fromArgs(new String[0], Map.of()));
        assertThrows(IllegalArgumentException.class,
                () -> ServerConfig.fromArgs(new String[]{"--listen"}, Map.of()));
        assertThrows(IllegalArgumentException.class,
                () -> ServerConfig.fromArgs(new String[]{"--listen", "nohost"}, Map.of()));
        assertThrows(IllegalArgumentException.class,
                () -> ServerConfig.fromArgs(new String[]{"-l", "h:1", "--bogus"}, Map.of()));
        assertThrows(IllegalArgumentException.class,
                () -> ServerConfig.fromArgs(new String[]{"-l", "h:1", "--snapshot-days", "0"}, Map.of()));
        assertThrows(IllegalArgumentException.class,
                () -> ServerConfig.fromArgs(new String[]{"-l", "h:1", "-C", "not-a-uuid"}, Map.of()));
        assertThrows(IllegalArgumentException.class,
                () -> ServerConfig.fromArgs(new String[]{"-l", "h:1", "--storage", "postgres"}, Map.of()));
        assertThrows(IllegalArgumentException.class,
                () -> ServerConfig.fromArgs(new String[]{"-l", "h:1"}, Map.of("CREATE_CLIENTS", "maybe")));
    }

    @Test
    void listen_address_formats() {
        assertEquals(new ListenAddress("example.org", 443), ListenAddress.parse(" example.org:443 "));
        assertEquals(new ListenAddress("::", 80), ListenAddress.parse("[::]:80"));
        assertEquals("[::]:80", new ListenAddress("::", 80).toString());
        assertThrows(IllegalArgumentException.class, () -> ListenAddress.parse(":80"));
        assertThrows(IllegalArgumentException.class, () -> ListenAddress.parse("host:"));
        assertThrows(IllegalArgumentException.class, () -> ListenAddress.parse("host:99999"));
    }
}

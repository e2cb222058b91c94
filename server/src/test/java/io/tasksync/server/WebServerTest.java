// file: server/src/test/java/io/tasksync/server/WebServerTest.java
package io.tasksync.server;

import io.tasksync.core.Client;
import io.tasksync.core.RetentionPolicy;
import io.tasksync.core.SnapshotPolicy;
import io.tasksync.core.VersionIds;
import io.tasksync.storage.InMemorySyncStorage;
import io.tasksync.storage.StorageException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static io.tasksync.server.WebServer.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end specs for the HTTP surface: routes, headers, status codes and error mapping.
 */
class WebServerTest {

    private static final int PORT = 18081; // test-only port
    private static final String BASE = "http://localhost:" + PORT;

    private WebServer server;
    private HttpClient http;
    private InMemorySyncStorage storage;

    @BeforeEach
    void setUp() {
        http = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(2))
                .build();
        storage = new InMemorySyncStorage();
    }

    @AfterEach
    void stopServer() {
        if (server != null) {
            server.stop();
        }
    }

    private void start(SyncService sync, int maxBodyBytes) {
        server = new WebServer(List.of(new ListenAddress("localhost", PORT)), sync, maxBodyBytes);
        server.start();
    }

    private void start() {
        start(new SyncService(storage), DEFAULT_MAX_BODY_BYTES);
    }

    private HttpResponse<byte[]> get(String path, UUID clientId) throws Exception {
        var b = HttpRequest.newBuilder(URI.create(BASE + path)).GET();
        if (clientId != null) b.header(CLIENT_ID_HEADER, clientId.toString());
        return http.send(b.build(), HttpResponse.BodyHandlers.ofByteArray());
    }

    private HttpResponse<byte[]> post(String path, UUID clientId, String contentType, byte[] body) throws Exception {
        var b = HttpRequest.newBuilder(URI.create(BASE + path))
                .POST(HttpRequest.BodyPublishers.ofByteArray(body));
        if (clientId != null) b.header(CLIENT_ID_HEADER, clientId.toString());
        if (contentType != null) b.header("Content-Type", contentType);
        return http.send(b.build(), HttpResponse.BodyHandlers.ofByteArray());
    }

    private HttpResponse<byte[]> addVersion(UUID clientId, UUID parent, String segment) throws Exception {
        return post("/v1/client/add-version/" + parent, clientId, HISTORY_SEGMENT_CONTENT_TYPE,
                segment.getBytes(StandardCharsets.UTF_8));
    }

    private static String header(HttpResponse<?> resp, String name) {
        return resp.headers().firstValue(name).orElse(null);
    }

    private static String text(HttpResponse<byte[]> resp) {
        return new String(resp.body(), StandardCharsets.UTF_8);
    }

    @Test
    void banner_and_health_carry_no_store_cache_control() throws Exception {
        start();

        var banner = get("/", null);
        assertEquals(200, banner.statusCode());
        assertTrue(text(banner).startsWith("tasksync"));
        assertEquals("no-store, max-age=0", header(banner, "Cache-Control"));

        var health = get("/admin/health", null);
        assertEquals(200, health.statusCode());
        assertTrue(text(health).contains("\"ok\""));
        assertEquals("no-store, max-age=0", header(health, "Cache-Control"));
    }

    @Test
    void add_version_then_fetch_it_as_child() throws Exception {
        start();
        UUID client = UUID.randomUUID();

        var added = addVersion(client, VersionIds.NIL, "seg1");
        assertEquals(200, added.statusCode());
        String versionId = header(added, VERSION_ID_HEADER);
        assertNotNull(versionId);
        // no snapshot yet
        assertEquals("urgency=high", header(added, SNAPSHOT_REQUEST_HEADER));

        var child = get("/v1/client/get-child-version/" + VersionIds.NIL, client);
        assertEquals(200, child.statusCode());
        assertEquals(HISTORY_SEGMENT_CONTENT_TYPE, header(child, "Content-Type"));
        assertEquals(versionId, header(child, VERSION_ID_HEADER));
        assertEquals(VersionIds.NIL.toString(), header(child, PARENT_VERSION_ID_HEADER));
        assertEquals("seg1", text(child));

        var upToDate = get("/v1/client/get-child-version/" + versionId, client);
        assertEquals(404, upToDate.statusCode());
    }

    @Test
    void stale_parent_gets_409_with_expected_parent() throws Exception {
        start();
        UUID client = UUID.randomUUID();
        String v1 = header(addVersion(client, VersionIds.NIL, "seg1"), VERSION_ID_HEADER);

        var conflict = addVersion(client, VersionIds.NIL, "seg2");

        assertEquals(409, conflict.statusCode());
        assertEquals(v1, header(conflict, PARENT_VERSION_ID_HEADER));
        assertNull(header(conflict, VERSION_ID_HEADER));
    }

    @Test
    void unknown_parent_is_gone() throws Exception {
        start();
        UUID client = UUID.randomUUID();
        addVersion(client, VersionIds.NIL, "seg1");

        var gone = get("/v1/client/get-child-version/" + UUID.randomUUID(), client);

        assertEquals(410, gone.statusCode());
    }

    @Test
    void snapshot_request_header_is_absent_below_threshold() throws Exception {
        start(new SyncService(storage, ClientPolicy.open(), new SnapshotPolicy(3, 14), RetentionPolicy.KEEP_ALL),
                DEFAULT_MAX_BODY_BYTES);
        UUID client = UUID.randomUUID();
        String v1 = header(addVersion(client, VersionIds.NIL, "seg1"), VERSION_ID_HEADER);
        post("/v1/client/add-snapshot/" + v1, client, SNAPSHOT_CONTENT_TYPE, "snap".getBytes());

        var next = addVersion(client, UUID.fromString(v1), "seg2");

        assertEquals(200, next.statusCode());
        assertNull(header(next, SNAPSHOT_REQUEST_HEADER));
    }

    @Test
    void snapshot_upload_and_download() throws Exception {
        start();
        UUID client = UUID.randomUUID();
        assertEquals(404, get("/v1/client/snapshot", client).statusCode());

        String v1 = header(addVersion(client, VersionIds.NIL, "seg1"), VERSION_ID_HEADER);
        String v2 = header(addVersion(client, UUID.fromString(v1), "seg2"), VERSION_ID_HEADER);

        // stale snapshot: still 200, but nothing stored
        var stale = post("/v1/client/add-snapshot/" + v1, client, SNAPSHOT_CONTENT_TYPE, "old".getBytes());
        assertEquals(200, stale.statusCode());
        assertEquals(404, get("/v1/client/snapshot", client).statusCode());

        var ok = post("/v1/client/add-snapshot/" + v2, client, SNAPSHOT_CONTENT_TYPE, "new".getBytes());
        assertEquals(200, ok.statusCode());

        var snap = get("/v1/client/snapshot", client);
        assertEquals(200, snap.statusCode());
        assertEquals(SNAPSHOT_CONTENT_TYPE, header(snap, "Content-Type"));
        assertEquals(v2, header(snap, VERSION_ID_HEADER));
        assertEquals("new", text(snap));
        Client stored = storage.getClient(client);
        assertEquals(0, stored.versionsSinceSnapshot());
    }

    @Test
    void malformed_requests_get_400() throws Exception {
        start();
        UUID client = UUID.randomUUID();

        assertEquals(400, post("/v1/client/add-version/" + VersionIds.NIL, client, "application/json",
                "x".getBytes()).statusCode(), "bad content type");
        assertEquals(400, post("/v1/client/add-version/" + VersionIds.NIL, client, null,
                "x".getBytes()).statusCode(), "missing content type");
        assertEquals(400, post("/v1/client/add-version/" + VersionIds.NIL, null, HISTORY_SEGMENT_CONTENT_TYPE,
                "x".getBytes()).statusCode(), "missing client id");
        assertEquals(400, post("/v1/client/add-version/not-a-uuid", client, HISTORY_SEGMENT_CONTENT_TYPE,
                "x".getBytes()).statusCode(), "bad parent");
        assertEquals(400, post("/v1/client/add-version/" + VersionIds.NIL, client, HISTORY_SEGMENT_CONTENT_TYPE,
                new byte[0]).statusCode(), "empty body");
        assertEquals(400, post("/v1/client/add-snapshot/" + VersionIds.NIL, client, SNAPSHOT_CONTENT_TYPE,
                new byte[0]).statusCode(), "empty snapshot");

        var badHeader = HttpRequest.newBuilder(URI.create(BASE + "/v1/client/snapshot"))
                .header(CLIENT_ID_HEADER, "nope").GET().build();
        assertEquals(400, http.send(badHeader, HttpResponse.BodyHandlers.discarding()).statusCode());

        // nothing was created along the way
        assertNull(storage.getClient(client));
    }

    @Test
    void content_type_parameters_are_ignored() throws Exception {
        start();
        var resp = post("/v1/client/add-version/" + VersionIds.NIL, UUID.randomUUID(),
                HISTORY_SEGMENT_CONTENT_TYPE + "; charset=binary", "x".getBytes());

        assertEquals(200, resp.statusCode());
    }

    @Test
    void oversized_body_gets_413() throws Exception {
        start(new SyncService(storage), 16);
        UUID client = UUID.randomUUID();

        var resp = post("/v1/client/add-version/" + VersionIds.NIL, client, HISTORY_SEGMENT_CONTENT_TYPE, new byte[17]);
        assertEquals(413, resp.statusCode());

        var fits = post("/v1/client/add-version/" + VersionIds.NIL, client, HISTORY_SEGMENT_CONTENT_TYPE, new byte[16]);
        assertEquals(200, fits.statusCode());
    }

    @Test
    void client_policy_maps_to_403_and_404() throws Exception {
        UUID allowed = UUID.randomUUID();
        start(new SyncService(storage, new ClientPolicy(false, Set.of(allowed)),
                SnapshotPolicy.defaults(), RetentionPolicy.KEEP_ALL), DEFAULT_MAX_BODY_BYTES);

        assertEquals(403, addVersion(UUID.randomUUID(), VersionIds.NIL, "x").statusCode());
        // allowed but unknown, and creation is disabled
        assertEquals(404, addVersion(allowed, VersionIds.NIL, "x").statusCode());

        storage.createClient(allowed);
        assertEquals(200, addVersion(allowed, VersionIds.NIL, "x").statusCode());
    }

    @Test
    void unknown_routes_and_wrong_methods() throws Exception {
        start();

        assertEquals(404, get("/v2/whatever", null).statusCode());

        var wrongMethod = post("/v1/client/snapshot", UUID.randomUUID(), SNAPSHOT_CONTENT_TYPE, "x".getBytes());
        assertEquals(405, wrongMethod.statusCode());
        assertEquals("GET", header(wrongMethod, "Allow"));

        assertEquals(405, get("/v1/client/add-version/" + VersionIds.NIL, UUID.randomUUID()).statusCode());
    }

    @Test
    void storage_failure_maps_to_500() throws Exception {
        var broken = new StubStorage() {
            @Override
            public Client getClient(UUID clientId) {
                throw new StorageException("database unavailable");
            }
        };
        start(new SyncService(broken), DEFAULT_MAX_BODY_BYTES);

        var resp = get("/v1/client/snapshot", UUID.randomUUID());

        assertEquals(500, resp.statusCode());
        assertTrue(text(resp).contains("StorageException"));
        assertTrue(text(resp).contains("database unavailable"));
    }

    @Test
    void invalid_argument_from_storage_is_a_server_error_not_a_bad_request() throws Exception {
        var corrupt = new StubStorage() {
            @Override
            public Client getClient(UUID clientId) {
                // a stored row with a negative counter fails Client validation
                return new Client(clientId, VersionIds.NIL, -1, null);
            }
        };
        start(new SyncService(corrupt), DEFAULT_MAX_BODY_BYTES);

        var resp = get("/v1/client/snapshot", UUID.randomUUID());

        assertEquals(500, resp.statusCode());
        assertTrue(text(resp).contains("IllegalArgumentException"));
    }
}

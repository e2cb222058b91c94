// file: server/src/main/java/io/tasksync/server/WebServer.java
package io.tasksync.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.tasksync.core.SnapshotData;
import io.tasksync.core.SnapshotUrgency;
import io.tasksync.core.Version;
import io.tasksync.core.VersionIds;
import io.tasksync.storage.NoSuchClientException;
import io.tasksync.storage.SnapshotOutcome;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Thin HTTP adapter over {@link SyncService}.
 *
 * Responsibilities:
 *  - Parse method, path, client id header and raw request bodies.
 *  - Call the sync service and turn its results into status codes and headers.
 *  - Map Java exceptions to HTTP status codes.
 *  - Emit per-request logging via {@link RequestLogger}.
 *
 * Path layout (v1):
 *   - GET  /                                        banner
 *   - GET  /admin/health                            health check
 *   - GET  /v1/client/get-child-version/{parent}    200 segment | 404 | 410
 *   - POST /v1/client/add-version/{parent}          200 X-Version-Id | 409 X-Parent-Version-Id
 *   - POST /v1/client/add-snapshot/{version}        200 {"accepted": bool}, stale snapshots are dropped
 *   - GET  /v1/client/snapshot                      200 snapshot | 404
 *
 * Every /v1 request carries the client id in X-Client-Id. Bodies are opaque bytes; only
 * errors and admin endpoints answer with JSON. Handlers run on worker threads because
 * storage calls block.
 */
public final class WebServer {
    public static final String HISTORY_SEGMENT_CONTENT_TYPE = "application/vnd.taskchampion.history-segment";
    public static final String SNAPSHOT_CONTENT_TYPE = "application/vnd.taskchampion.snapshot";

    public static final String CLIENT_ID_HEADER = "X-Client-Id";
    public static final String VERSION_ID_HEADER = "X-Version-Id";
    public static final String PARENT_VERSION_ID_HEADER = "X-Parent-Version-Id";
    public static final String SNAPSHOT_REQUEST_HEADER = "X-Snapshot-Request";

    public static final int DEFAULT_MAX_BODY_BYTES = 100 * 1024 * 1024; // 100 MiB

    private static final String GET_CHILD_VERSION = "/v1/client/get-child-version/";
    private static final String ADD_VERSION = "/v1/client/add-version/";
    private static final String ADD_SNAPSHOT = "/v1/client/add-snapshot/";
    private static final String GET_SNAPSHOT = "/v1/client/snapshot";

    private static final String BANNER = "tasksync server";

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final SyncService sync;
    private final int maxBodyBytes;

    public WebServer(List<ListenAddress> listen, SyncService sync) {
        this(listen, sync, DEFAULT_MAX_BODY_BYTES);
    }

    public WebServer(List<ListenAddress> listen, SyncService sync, int maxBodyBytes) {
        if (listen == null || listen.isEmpty()) {
            throw new IllegalArgumentException("at least one listen address is required");
        }
        if (maxBodyBytes <= 0 || maxBodyBytes == Integer.MAX_VALUE) {
            throw new IllegalArgumentException("maxBodyBytes out of range: " + maxBodyBytes);
        }
        this.sync = sync;
        this.maxBodyBytes = maxBodyBytes;

        Undertow.Builder builder = Undertow.builder();
        for (ListenAddress address : listen) {
            builder.addHttpListener(address.port(), address.host());
        }
        this.server = builder.setHandler(new BlockingHandler(this::route)).build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    private void route(HttpServerExchange ex) {
        String path = ex.getRequestPath();
        String method = ex.getRequestMethod().toString();
        ex.getResponseHeaders().put(Headers.CACHE_CONTROL, "no-store, max-age=0");

        if (path.startsWith(GET_CHILD_VERSION)) {
            dispatch(ex, "GET", (e, t) -> handleGetChildVersion(e, t, path.substring(GET_CHILD_VERSION.length())));
        } else if (path.startsWith(ADD_VERSION)) {
            dispatch(ex, "POST", (e, t) -> handleAddVersion(e, t, path.substring(ADD_VERSION.length())));
        } else if (path.startsWith(ADD_SNAPSHOT)) {
            dispatch(ex, "POST", (e, t) -> handleAddSnapshot(e, t, path.substring(ADD_SNAPSHOT.length())));
        } else if (GET_SNAPSHOT.equals(path)) {
            dispatch(ex, "GET", this::handleGetSnapshot);
        } else if ("/admin/health".equals(path)) {
            dispatch(ex, "GET", (e, t) -> send(e, 200, Map.of("status", "ok")));
        } else if ("/".equals(path)) {
            dispatch(ex, "GET", (e, t) -> {
                e.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                e.getResponseSender().send(BANNER, StandardCharsets.UTF_8);
            });
        } else {
            send(ex, 404, Map.of("error", "not found"));
            RequestLogger.logRequest(method, path, 404, 0, -1, null);
        }
    }

    // ---------- handlers ----------

    /** GET /v1/client/get-child-version/{parent} */
    private void handleGetChildVersion(HttpServerExchange ex, Timing timing, String parentText) {
        UUID clientId = clientId(ex);
        UUID parent = versionId(parentText);

        SyncService.ChildVersion result = timing.time(() -> sync.getChildVersion(clientId, parent));

        if (result instanceof SyncService.ChildVersion.Found found) {
            Version v = found.version();
            ex.setStatusCode(200);
            ex.getResponseHeaders().put(Headers.CONTENT_TYPE, HISTORY_SEGMENT_CONTENT_TYPE);
            ex.getResponseHeaders().put(HttpString.tryFromString(VERSION_ID_HEADER), v.versionId().toString());
            ex.getResponseHeaders().put(HttpString.tryFromString(PARENT_VERSION_ID_HEADER), v.parentVersionId().toString());
            ex.getResponseSender().send(ByteBuffer.wrap(v.historySegment()));
        } else if (result instanceof SyncService.ChildVersion.Gone) {
            send(ex, 410, Map.of("error", "version has been deleted"));
        } else {
            send(ex, 404, Map.of("error", "no such version"));
        }
    }

    /** POST /v1/client/add-version/{parent} */
    private void handleAddVersion(HttpServerExchange ex, Timing timing, String parentText) throws IOException {
        UUID parent = versionId(parentText);
        requireContentType(ex, HISTORY_SEGMENT_CONTENT_TYPE);
        UUID clientId = clientId(ex);
        byte[] segment = readBody(ex);

        SyncService.AddVersionResult result = timing.time(() -> sync.addVersion(clientId, parent, segment));

        if (result instanceof SyncService.AddVersionResult.Accepted accepted) {
            ex.setStatusCode(200);
            ex.getResponseHeaders().put(HttpString.tryFromString(VERSION_ID_HEADER), accepted.versionId().toString());
            if (accepted.snapshotRequested()) {
                ex.getResponseHeaders().put(
                        HttpString.tryFromString(SNAPSHOT_REQUEST_HEADER), snapshotRequest(accepted.snapshotUrgency()));
            }
        } else {
            UUID expected = ((SyncService.AddVersionResult.Conflict) result).expectedParentVersionId();
            ex.getResponseHeaders().put(HttpString.tryFromString(PARENT_VERSION_ID_HEADER), expected.toString());
            send(ex, 409, Map.of("error", "conflict", "expectedParentVersionId", expected.toString()));
        }
    }

    /** POST /v1/client/add-snapshot/{version} */
    private void handleAddSnapshot(HttpServerExchange ex, Timing timing, String versionText) throws IOException {
        UUID version = versionId(versionText);
        requireContentType(ex, SNAPSHOT_CONTENT_TYPE);
        UUID clientId = clientId(ex);
        byte[] snapshot = readBody(ex);

        SnapshotOutcome outcome = timing.time(() -> sync.addSnapshot(clientId, version, snapshot));

        // 200 for VERSION_MISMATCH too: the snapshot is simply dropped.
        send(ex, 200, Map.of("accepted", outcome == SnapshotOutcome.ACCEPTED));
    }

    /** GET /v1/client/snapshot */
    private void handleGetSnapshot(HttpServerExchange ex, Timing timing) {
        UUID clientId = clientId(ex);

        SnapshotData snapshot = timing.time(() -> sync.getSnapshot(clientId));

        if (snapshot == null) {
            send(ex, 404, Map.of("error", "no snapshot"));
            return;
        }
        ex.setStatusCode(200);
        ex.getResponseHeaders().put(Headers.CONTENT_TYPE, SNAPSHOT_CONTENT_TYPE);
        ex.getResponseHeaders().put(HttpString.tryFromString(VERSION_ID_HEADER), snapshot.versionId().toString());
        ex.getResponseSender().send(ByteBuffer.wrap(snapshot.data()));
    }

    // ---------- request plumbing ----------

    @FunctionalInterface
    private interface Handler {
        void handle(HttpServerExchange ex, Timing timing) throws IOException;
    }

    /** Latency of the service call within one request. */
    private static final class Timing {
        long serviceMillis = -1L;

        <T> T time(Supplier<T> call) {
            long start = System.nanoTime();
            try {
                return call.get();
            } finally {
                serviceMillis = (System.nanoTime() - start) / 1_000_000L;
            }
        }
    }

    /** Malformed request: client id, version id, content type or body. */
    private static final class BadRequestException extends RuntimeException {
        BadRequestException(String message) {
            super(message);
        }

        BadRequestException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /** Body exceeded the configured limit. */
    private static final class PayloadTooLargeException extends RuntimeException {
        PayloadTooLargeException(int limit) {
            super("request body larger than " + limit + " bytes");
        }
    }

    /**
     * Run one handler with method check, exception-to-status mapping and request logging.
     */
    private void dispatch(HttpServerExchange ex, String allowedMethod, Handler handler) {
        String method = ex.getRequestMethod().toString();
        String path = ex.getRequestPath();
        long start = System.nanoTime();
        Timing timing = new Timing();
        Throwable error = null;

        try {
            if (!allowedMethod.equals(method)) {
                ex.getResponseHeaders().put(Headers.ALLOW, allowedMethod);
                send(ex, 405, Map.of("error", "method not allowed"));
                return;
            }
            handler.handle(ex, timing);
        } catch (PayloadTooLargeException tooLarge) {
            error = tooLarge;
            send(ex, 413, Map.of("error", tooLarge.getMessage()));
        } catch (BadRequestException bad) {
            error = bad;
            send(ex, 400, Map.of("error", String.valueOf(bad.getMessage())));
        } catch (ClientNotAllowedException denied) {
            error = denied;
            send(ex, 403, Map.of("error", "client not allowed"));
        } catch (NoSuchClientException missing) {
            error = missing;
            send(ex, 404, Map.of("error", "no such client"));
        } catch (Exception e) {
            error = e;
            send(ex, 500, Map.of("error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage())));
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RequestLogger.logRequest(method, path, ex.getStatusCode(), totalMs, timing.serviceMillis, error);
        }
    }

    private static UUID clientId(HttpServerExchange ex) {
        String header = ex.getRequestHeaders().getFirst(CLIENT_ID_HEADER);
        try {
            return VersionIds.parse(header);
        } catch (IllegalArgumentException e) {
            throw new BadRequestException("bad " + CLIENT_ID_HEADER, e);
        }
    }

    private static UUID versionId(String text) {
        try {
            return VersionIds.parse(text);
        } catch (IllegalArgumentException e) {
            throw new BadRequestException("bad version id '" + text + "'", e);
        }
    }

    private static void requireContentType(HttpServerExchange ex, String expected) {
        String actual = ex.getRequestHeaders().getFirst(Headers.CONTENT_TYPE);
        if (actual == null) {
            throw new BadRequestException("missing content-type, expected " + expected);
        }
        int semicolon = actual.indexOf(';');
        String mediaType = (semicolon >= 0 ? actual.substring(0, semicolon) : actual).trim();
        if (!mediaType.equalsIgnoreCase(expected)) {
            throw new BadRequestException("bad content-type '" + actual + "', expected " + expected);
        }
    }

    /** Read the whole request body, enforcing the size limit and rejecting empty bodies. */
    private byte[] readBody(HttpServerExchange ex) throws IOException {
        if (ex.getRequestContentLength() > maxBodyBytes) {
            throw new PayloadTooLargeException(maxBodyBytes);
        }
        InputStream in = ex.getInputStream();
        byte[] body = in.readNBytes(maxBodyBytes + 1);
        if (body.length > maxBodyBytes) {
            throw new PayloadTooLargeException(maxBodyBytes);
        }
        if (body.length == 0) {
            throw new BadRequestException("empty body");
        }
        return body;
    }

    static String snapshotRequest(SnapshotUrgency urgency) {
        return switch (urgency) {
            case LOW -> "urgency=low";
            case HIGH -> "urgency=high";
            case NONE -> throw new IllegalArgumentException("no snapshot requested");
        };
    }

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private void send(HttpServerExchange ex, int code, Object body) {
        ex.setStatusCode(code);
        ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        try {
            ex.getResponseSender().send(ByteBuffer.wrap(json.writeValueAsBytes(body)));
        } catch (IOException e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}

// file: client/src/main/java/io/tasksync/client/SyncClient.java
package io.tasksync.client;

import io.tasksync.core.SnapshotData;
import io.tasksync.core.SnapshotUrgency;
import io.tasksync.core.VersionIds;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.UUID;

/**
 * Typed HTTP client for one client id of a tasksync server.
 *
 * Payloads are passed through as opaque bytes; encrypting history segments and
 * snapshots is the caller's business.
 */
public final class SyncClient {
    static final String HISTORY_SEGMENT_CONTENT_TYPE = "application/vnd.taskchampion.history-segment";
    static final String SNAPSHOT_CONTENT_TYPE = "application/vnd.taskchampion.snapshot";
    static final String CLIENT_ID_HEADER = "X-Client-Id";
    static final String VERSION_ID_HEADER = "X-Version-Id";
    static final String PARENT_VERSION_ID_HEADER = "X-Parent-Version-Id";
    static final String SNAPSHOT_REQUEST_HEADER = "X-Snapshot-Request";

    private final HttpClient http;
    private final String baseUrl;
    private final UUID clientId;

    public SyncClient(String baseUrl, UUID clientId) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build(), baseUrl, clientId);
    }

    public SyncClient(HttpClient http, String baseUrl, UUID clientId) {
        this.http = Objects.requireNonNull(http, "http");
        Objects.requireNonNull(baseUrl, "baseUrl");
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.clientId = Objects.requireNonNull(clientId, "clientId");
    }

    public UUID clientId() {
        return clientId;
    }

    /** Result of {@link #getChildVersion}. */
    public sealed interface ChildVersion permits ChildVersion.Found, ChildVersion.NotFound, ChildVersion.Gone {
        record Found(UUID versionId, UUID parentVersionId, byte[] historySegment) implements ChildVersion {}
        /** The parent is the latest version: nothing newer yet. */
        record NotFound() implements ChildVersion {}
        /** The parent's history is no longer available; restart from the snapshot. */
        record Gone() implements ChildVersion {}
    }

    /** Result of {@link #addVersion}. */
    public sealed interface AddVersionResult permits AddVersionResult.Accepted, AddVersionResult.Conflict {
        record Accepted(UUID versionId, SnapshotUrgency snapshotUrgency) implements AddVersionResult {}
        record Conflict(UUID expectedParentVersionId) implements AddVersionResult {}
    }

    public ChildVersion getChildVersion(UUID parentVersionId) throws IOException, InterruptedException {
        HttpResponse<byte[]> resp = http.send(
                request("/v1/client/get-child-version/" + parentVersionId).GET().build(),
                HttpResponse.BodyHandlers.ofByteArray());
        return switch (resp.statusCode()) {
            case 200 -> new ChildVersion.Found(
                    uuidHeader(resp, VERSION_ID_HEADER),
                    uuidHeader(resp, PARENT_VERSION_ID_HEADER),
                    resp.body());
            case 404 -> new ChildVersion.NotFound();
            case 410 -> new ChildVersion.Gone();
            default -> throw failure("get-child-version", resp);
        };
    }

    public AddVersionResult addVersion(UUID parentVersionId, byte[] historySegment)
            throws IOException, InterruptedException {
        HttpResponse<byte[]> resp = http.send(
                request("/v1/client/add-version/" + parentVersionId)
                        .header("Content-Type", HISTORY_SEGMENT_CONTENT_TYPE)
                        .POST(HttpRequest.BodyPublishers.ofByteArray(historySegment))
                        .build(),
                HttpResponse.BodyHandlers.ofByteArray());
        return switch (resp.statusCode()) {
            case 200 -> new AddVersionResult.Accepted(
                    uuidHeader(resp, VERSION_ID_HEADER),
                    parseSnapshotRequest(resp.headers().firstValue(SNAPSHOT_REQUEST_HEADER).orElse(null)));
            case 409 -> new AddVersionResult.Conflict(uuidHeader(resp, PARENT_VERSION_ID_HEADER));
            default -> throw failure("add-version", resp);
        };
    }

    /**
     * Upload a snapshot of the state at {@code versionId}.
     *
     * @return true if the server stored it, false if it was dropped as stale
     */
    public boolean addSnapshot(UUID versionId, byte[] snapshot) throws IOException, InterruptedException {
        HttpResponse<byte[]> resp = http.send(
                request("/v1/client/add-snapshot/" + versionId)
                        .header("Content-Type", SNAPSHOT_CONTENT_TYPE)
                        .POST(HttpRequest.BodyPublishers.ofByteArray(snapshot))
                        .build(),
                HttpResponse.BodyHandlers.ofByteArray());
        if (resp.statusCode() != 200) {
            throw failure("add-snapshot", resp);
        }
        // body is {"accepted":true} or {"accepted":false}
        return new String(resp.body(), StandardCharsets.UTF_8).replace(" ", "").contains("\"accepted\":true");
    }

    /** The latest snapshot, or null if the server has none. */
    public SnapshotData getSnapshot() throws IOException, InterruptedException {
        HttpResponse<byte[]> resp = http.send(
                request("/v1/client/snapshot").GET().build(),
                HttpResponse.BodyHandlers.ofByteArray());
        return switch (resp.statusCode()) {
            case 200 -> new SnapshotData(uuidHeader(resp, VERSION_ID_HEADER), resp.body());
            case 404 -> null;
            default -> throw failure("snapshot", resp);
        };
    }

    static SnapshotUrgency parseSnapshotRequest(String header) {
        if (header == null || header.isBlank()) {
            return SnapshotUrgency.NONE;
        }
        return switch (header.trim().toLowerCase()) {
            case "urgency=low" -> SnapshotUrgency.LOW;
            case "urgency=high" -> SnapshotUrgency.HIGH;
            default -> throw new IllegalArgumentException("unexpected " + SNAPSHOT_REQUEST_HEADER + ": " + header);
        };
    }

    private HttpRequest.Builder request(String path) {
        return HttpRequest.newBuilder(URI.create(baseUrl + path))
                .timeout(Duration.ofSeconds(30))
                .header(CLIENT_ID_HEADER, clientId.toString());
    }

    private static UUID uuidHeader(HttpResponse<?> resp, String name) {
        String value = resp.headers().firstValue(name)
                .orElseThrow(() -> new IllegalStateException("response lacks " + name));
        return VersionIds.parse(value);
    }

    private static SyncClientException failure(String operation, HttpResponse<byte[]> resp) {
        return new SyncClientException(operation, resp.statusCode(), new String(resp.body(), StandardCharsets.UTF_8));
    }
}

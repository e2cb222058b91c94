// file: server/src/main/java/io/tasksync/server/RequestLogger.java
package io.tasksync.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Per-request access log.
 *
 * One line per completed HTTP request with method, path, status and latency.
 * 5xx responses are logged at WARNING together with the failure; everything
 * else, including conflicts and rejected clients, at INFO.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * Log a completed HTTP request.
     *
     * @param method        HTTP method (GET, POST)
     * @param path          request path
     * @param status        HTTP status code
     * @param totalMillis   wall-clock latency for the whole request
     * @param storageMillis latency of the sync service call, or -1 if none was made
     * @param error         failure behind the response, null if none
     */
    public static void logRequest(
            String method,
            String path,
            int status,
            long totalMillis,
            long storageMillis,
            Throwable error
    ) {
        String msg = String.format(
                "HTTP %s %s -> %d (total=%dms%s)",
                method,
                path,
                status,
                totalMillis,
                storageMillis >= 0 ? ", storage=" + storageMillis + "ms" : ""
        );

        if (status >= 500) {
            log.log(Level.WARNING, msg, error);
        } else if (error != null) {
            log.log(Level.INFO, msg + ": " + error.getMessage());
        } else {
            log.log(Level.INFO, msg);
        }
    }
}

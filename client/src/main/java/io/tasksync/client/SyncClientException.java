// file: client/src/main/java/io/tasksync/client/SyncClientException.java
package io.tasksync.client;

/** The server answered with a status the protocol does not expect for this call. */
public class SyncClientException extends RuntimeException {
    private final int statusCode;

    public SyncClientException(String operation, int statusCode, String body) {
        super(operation + " failed (" + statusCode + "): " + body);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }
}

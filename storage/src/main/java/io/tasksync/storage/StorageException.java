// file: storage/src/main/java/io/tasksync/storage/StorageException.java
package io.tasksync.storage;

/**
 * Backend failure: connectivity, SQL error, constraint violation.
 * The failed transaction has been rolled back when this is thrown.
 */
public class StorageException extends RuntimeException {
    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.fotofun.history;

/**
 * Raised by a {@link SnapshotStorage} when its backing medium fails.
 */
public class SnapshotStorageException extends RuntimeException {

    public SnapshotStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}

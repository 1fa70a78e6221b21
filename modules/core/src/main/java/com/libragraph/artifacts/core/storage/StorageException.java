package com.libragraph.artifacts.core.storage;

/**
 * Wraps checked I/O and backend client exceptions from storage operations.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    public StorageException(String message) {
        super(message);
    }
}

package com.libragraph.artifacts.core.storage;

/**
 * Thrown when the target of a reference (object, file, artifact or entry) does not exist.
 */
public class ReferenceNotFoundException extends StorageException {

    public ReferenceNotFoundException(String message) {
        super(message);
    }

    public ReferenceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.libragraph.artifacts.core.storage;

/**
 * Thrown when expanding a reference would produce more entries than allowed.
 */
public class QuotaExceededException extends StorageException {

    private final String uri;
    private final int maxObjects;

    public QuotaExceededException(String uri, int maxObjects) {
        super("Exceeded " + maxObjects + " objects tracked for " + uri
                + ", pass a larger maxObjects to addReference");
        this.uri = uri;
        this.maxObjects = maxObjects;
    }

    public String uri() {
        return uri;
    }

    public int maxObjects() {
        return maxObjects;
    }
}

package com.libragraph.artifacts.core.storage;

/**
 * Thrown when a fetch delivers a different number of bytes than the entry declares.
 * The partial object is never committed to the cache.
 */
public class IncompleteDownloadException extends StorageException {

    private final long expected;
    private final long actual;

    public IncompleteDownloadException(String uri, long expected, long actual) {
        super("Incomplete download of " + uri + ": expected " + expected + " bytes, got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public long expected() {
        return expected;
    }

    public long actual() {
        return actual;
    }
}

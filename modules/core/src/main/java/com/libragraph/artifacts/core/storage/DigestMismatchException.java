package com.libragraph.artifacts.core.storage;

/**
 * Thrown when the object found at a reference no longer matches the digest recorded for it.
 */
public class DigestMismatchException extends StorageException {

    private final String expected;
    private final String actual;

    public DigestMismatchException(String location, String expected, String actual) {
        super("Digest mismatch for " + location + ": expected " + expected + " but found " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public String expected() {
        return expected;
    }

    public String actual() {
        return actual;
    }
}

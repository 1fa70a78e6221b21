package com.libragraph.artifacts.core.manifest;

/**
 * Thrown when a path is added to a manifest twice with different contents.
 */
public class ManifestConflictException extends RuntimeException {

    private final String path;

    public ManifestConflictException(String path, String existingDigest, String newDigest) {
        super("Cannot add the same path twice with different contents: path=" + path
                + " existing=" + existingDigest + " new=" + newDigest);
        this.path = path;
    }

    public String path() {
        return path;
    }
}

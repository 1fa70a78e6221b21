package com.libragraph.artifacts.core.storage;

/**
 * Thrown when a reference cannot be resolved to local bytes because no handler
 * understands its scheme.
 */
public class UnsupportedSchemeException extends StorageException {

    private final String uri;

    public UnsupportedSchemeException(String uri) {
        super("No handler can resolve reference locally: " + uri);
        this.uri = uri;
    }

    public String uri() {
        return uri;
    }
}

package com.libragraph.artifacts.core.manifest;

/**
 * Thrown for a manifest document that is malformed or declares an unsupported version.
 */
public class ManifestFormatException extends RuntimeException {

    public ManifestFormatException(String message) {
        super(message);
    }

    public ManifestFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}

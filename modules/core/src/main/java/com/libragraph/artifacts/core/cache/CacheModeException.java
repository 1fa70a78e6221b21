package com.libragraph.artifacts.core.cache;

/**
 * Thrown when a cache opener is asked for anything but a fresh whole-object write.
 */
public class CacheModeException extends IllegalArgumentException {

    public CacheModeException(String message) {
        super(message);
    }
}

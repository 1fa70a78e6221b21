package com.libragraph.artifacts.core.artifact;

/**
 * Whether an added file may change before it is uploaded.
 */
public enum FilePolicy {
    /** Copied into the staging directory when added. */
    MUTABLE,
    /** Uploaded from where it is; the caller promises not to touch it. */
    IMMUTABLE
}

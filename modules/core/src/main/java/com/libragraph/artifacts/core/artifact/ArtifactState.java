package com.libragraph.artifacts.core.artifact;

public enum ArtifactState {
    /** Being built; entries may still be added. */
    PENDING,
    /** Manifest and new bytes recorded by the backend; the manifest is frozen. */
    COMMITTED,
    /** Terminal. */
    DELETED
}

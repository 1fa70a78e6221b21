package com.libragraph.artifacts.core.artifact;

/**
 * Thrown when adding to an artifact whose manifest is already final.
 */
public class ArtifactFinalizedException extends ArtifactStateException {

    public ArtifactFinalizedException(String artifactName, ArtifactState state) {
        super("Can't modify finalized artifact " + artifactName, state);
    }
}

package com.libragraph.artifacts.core.artifact;

/**
 * Thrown when an operation needs the id the backend assigns on commit.
 */
public class ArtifactNotLoggedException extends ArtifactStateException {

    public ArtifactNotLoggedException(String artifactName, String operation, ArtifactState state) {
        super("Artifact " + artifactName + " must be committed before " + operation, state);
    }
}

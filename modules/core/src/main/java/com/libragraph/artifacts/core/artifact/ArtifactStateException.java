package com.libragraph.artifacts.core.artifact;

/**
 * Thrown when an operation is not allowed in the artifact's current state.
 */
public class ArtifactStateException extends IllegalStateException {

    private final ArtifactState state;

    public ArtifactStateException(String message, ArtifactState state) {
        super(message + " (state " + state + ")");
        this.state = state;
    }

    public ArtifactState state() {
        return state;
    }
}

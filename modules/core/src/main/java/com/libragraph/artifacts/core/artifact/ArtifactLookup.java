package com.libragraph.artifacts.core.artifact;

import java.util.Optional;

/**
 * Finds committed artifacts by id, for resolving cross-artifact references.
 */
public interface ArtifactLookup {

    Optional<Artifact> findById(String artifactId);
}

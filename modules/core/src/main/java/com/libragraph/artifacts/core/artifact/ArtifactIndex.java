package com.libragraph.artifacts.core.artifact;

import jakarta.enterprise.context.ApplicationScoped;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@link ArtifactLookup} of the committed artifacts this process knows about.
 */
@ApplicationScoped
public class ArtifactIndex implements ArtifactLookup {

    private final Map<String, Artifact> byId = new ConcurrentHashMap<>();

    public void register(Artifact artifact) {
        String id = artifact.id().orElseThrow(() ->
                new ArtifactNotLoggedException(artifact.name(), "indexing", artifact.state()));
        byId.put(id, artifact);
    }

    public void remove(String artifactId) {
        byId.remove(artifactId);
    }

    @Override
    public Optional<Artifact> findById(String artifactId) {
        return Optional.ofNullable(byId.get(artifactId));
    }

    public int size() {
        return byId.size();
    }
}

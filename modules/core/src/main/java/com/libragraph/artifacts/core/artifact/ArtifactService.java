package com.libragraph.artifacts.core.artifact;

import com.libragraph.artifacts.core.manifest.Manifest;
import com.libragraph.artifacts.core.storage.StoragePolicy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;

import java.util.Optional;
import java.util.concurrent.ExecutorService;

/**
 * Creates artifacts wired to the application's storage policy and keeps committed
 * ones resolvable by id.
 */
@ApplicationScoped
public class ArtifactService {

    @Inject
    StoragePolicy storagePolicy;

    @Inject
    ArtifactIndex index;

    @Inject
    @Named("artifactExecutor")
    ExecutorService executor;

    public Artifact create(String name, String type) {
        return new Artifact(name, type, storagePolicy, executor);
    }

    /**
     * Registers an artifact the backend already holds.
     */
    public Artifact load(String id, String name, String type, String version, Manifest manifest) {
        Artifact artifact = Artifact.committed(name, type, id, version, manifest, storagePolicy, executor);
        index.register(artifact);
        return artifact;
    }

    public void commit(Artifact artifact, String id, String version) {
        artifact.markCommitted(id, version);
        index.register(artifact);
    }

    public void delete(Artifact artifact) {
        artifact.delete();
        artifact.id().ifPresent(index::remove);
    }

    public Optional<Artifact> findById(String id) {
        return index.findById(id);
    }
}

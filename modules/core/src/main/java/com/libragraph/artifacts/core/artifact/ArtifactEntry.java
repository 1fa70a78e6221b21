package com.libragraph.artifacts.core.artifact;

import com.libragraph.artifacts.core.manifest.ManifestEntry;
import com.libragraph.artifacts.core.storage.StorageException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * A manifest entry seen through the artifact that holds it.
 */
public final class ArtifactEntry {

    private final Artifact artifact;
    private final ManifestEntry entry;

    ArtifactEntry(Artifact artifact, ManifestEntry entry) {
        this.artifact = artifact;
        this.entry = entry;
    }

    public String path() {
        return entry.path();
    }

    public String digest() {
        return entry.digest();
    }

    public Optional<Long> size() {
        return entry.size();
    }

    public Optional<String> ref() {
        return entry.ref();
    }

    public ManifestEntry entry() {
        return entry;
    }

    public Artifact artifact() {
        return artifact;
    }

    /**
     * Where the bytes live: the reference URI, or this artifact's own URI for uploaded files.
     *
     * @throws ArtifactNotLoggedException for an uploaded file of an uncommitted artifact
     */
    public String refTarget() {
        if (entry.isReference()) {
            return entry.ref().get();
        }
        String id = artifact.id().orElseThrow(() ->
                new ArtifactNotLoggedException(artifact.name(), "resolving " + entry.path(), artifact.state()));
        return ArtifactUri.of(id, entry.path()).toString();
    }

    /**
     * Local path holding the bytes, fetched into the cache when needed.
     */
    public Path download() {
        return artifact.resolveLocal(entry);
    }

    /**
     * Copies the bytes to {@code root/<path>}.
     */
    public Path download(Path root) {
        Path source = download();
        Path target = root.resolve(entry.path());
        try {
            Files.createDirectories(target.getParent());
            return Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new StorageException("Failed to copy " + entry.path() + " into " + root, e);
        }
    }

    @Override
    public String toString() {
        return artifact.name() + ":" + entry.path();
    }
}

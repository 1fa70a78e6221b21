package com.libragraph.artifacts.core.storage.handlers;

import com.libragraph.artifacts.core.artifact.Artifact;
import com.libragraph.artifacts.core.artifact.ArtifactEntry;
import com.libragraph.artifacts.core.artifact.ArtifactLookup;
import com.libragraph.artifacts.core.artifact.ArtifactUri;
import com.libragraph.artifacts.core.manifest.ManifestEntry;
import com.libragraph.artifacts.core.storage.ReferenceNotFoundException;
import com.libragraph.artifacts.core.storage.StorageException;
import com.libragraph.artifacts.core.storage.StorageHandler;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * References to entries of other artifacts ({@code wandb-artifact://<hex id>/<path>}).
 *
 * <p>Adding follows chains of artifact references to the artifact that holds the
 * content and copies its digest; nothing is read. Loading delegates to that artifact.
 */
@ApplicationScoped
public class ArtifactReferenceHandler implements StorageHandler {

    private static final int MAX_HOPS = 64;

    @Inject
    ArtifactLookup artifacts;

    ArtifactReferenceHandler() {
    }

    public ArtifactReferenceHandler(ArtifactLookup artifacts) {
        this.artifacts = artifacts;
    }

    @Override
    public Set<String> schemes() {
        return Set.of(ArtifactUri.SCHEME);
    }

    @Override
    public List<ManifestEntry> storePath(String uri, String name, boolean checksum, int maxObjects) {
        String current = uri;
        Artifact target = null;
        ManifestEntry entry = null;
        int hops = 0;
        while (current != null && current.startsWith(ArtifactUri.SCHEME + "://")) {
            if (++hops > MAX_HOPS) {
                throw new StorageException("Artifact reference chain too long starting at " + uri);
            }
            ArtifactEntry resolved = resolve(ArtifactUri.parse(current));
            target = resolved.artifact();
            entry = resolved.entry();
            current = entry.ref().orElse(null);
        }
        String direct = ArtifactUri.of(target.id().orElseThrow(), entry.path()).toString();
        String entryName = name != null ? name : BucketEntries.basename(entry.path());
        return List.of(ManifestEntry.reference(entryName, direct, entry.digest(), entry.size().orElse(null),
                Map.of()));
    }

    @Override
    public String loadPath(ManifestEntry entry, boolean local) {
        ArtifactEntry target = resolve(ArtifactUri.parse(HandlerSupport.requireRef(entry)));
        return local ? target.download().toString() : target.refTarget();
    }

    private ArtifactEntry resolve(ArtifactUri uri) {
        Artifact artifact = artifacts.findById(uri.artifactId()).orElseThrow(() ->
                new ReferenceNotFoundException("Artifact not found: " + uri.artifactId() + " (" + uri + ")"));
        return artifact.getPath(uri.path());
    }
}

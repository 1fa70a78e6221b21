package com.libragraph.artifacts.core.storage.handlers;

import com.libragraph.artifacts.core.manifest.ManifestEntry;
import com.libragraph.artifacts.core.storage.StorageHandler;
import com.libragraph.artifacts.core.storage.UnsupportedSchemeException;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fallback for URIs no other handler understands. The URI is its own digest and the
 * entry can never be resolved to local bytes.
 */
@ApplicationScoped
public class TrackingHandler implements StorageHandler {

    private static final Logger log = Logger.getLogger(TrackingHandler.class);

    @Override
    public Set<String> schemes() {
        return Set.of();
    }

    @Override
    public List<ManifestEntry> storePath(String uri, String name, boolean checksum, int maxObjects) {
        if (name == null) {
            throw new IllegalArgumentException(
                    "A name is required when tracking references with unknown schemes: " + uri);
        }
        log.warnf("Reference %s has an unsupported scheme and cannot be checksummed", uri);
        return List.of(ManifestEntry.reference(name, uri, uri, null, Map.of()));
    }

    @Override
    public String loadPath(ManifestEntry entry, boolean local) {
        String ref = HandlerSupport.requireRef(entry);
        if (local) {
            throw new UnsupportedSchemeException(ref);
        }
        return ref;
    }
}

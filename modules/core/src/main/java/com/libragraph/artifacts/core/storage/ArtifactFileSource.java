package com.libragraph.artifacts.core.storage;

import com.libragraph.artifacts.core.manifest.ManifestEntry;

import java.io.IOException;
import java.io.InputStream;

/**
 * Supplies the bytes of files uploaded with a committed artifact. Implemented by the
 * transport layer that talks to the artifact backend.
 */
public interface ArtifactFileSource {

    /**
     * Opens the uploaded content of {@code entry}.
     *
     * @throws ReferenceNotFoundException if the backend has no such file
     */
    InputStream open(String artifactId, ManifestEntry entry) throws IOException;
}

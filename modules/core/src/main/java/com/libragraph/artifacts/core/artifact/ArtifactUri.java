package com.libragraph.artifacts.core.artifact;

import com.libragraph.artifacts.util.HashUtil;

import java.util.Objects;

/**
 * Cross-artifact reference: {@code wandb-artifact://<hex artifact id>/<entry path>}.
 * Artifact ids are base64; the URI carries their hex form.
 */
public record ArtifactUri(String hexId, String path) {

    public static final String SCHEME = "wandb-artifact";

    private static final String PREFIX = SCHEME + "://";

    public ArtifactUri {
        Objects.requireNonNull(hexId, "hexId cannot be null");
        Objects.requireNonNull(path, "path cannot be null");
    }

    public static ArtifactUri of(String artifactId, String path) {
        return new ArtifactUri(HashUtil.b64ToHex(artifactId), path);
    }

    public static ArtifactUri parse(String uri) {
        if (!uri.startsWith(PREFIX)) {
            throw new IllegalArgumentException("Not an artifact reference: " + uri);
        }
        String rest = uri.substring(PREFIX.length());
        int slash = rest.indexOf('/');
        if (slash <= 0 || slash == rest.length() - 1) {
            throw new IllegalArgumentException("Artifact reference needs an id and a path: " + uri);
        }
        return new ArtifactUri(rest.substring(0, slash), rest.substring(slash + 1));
    }

    public String artifactId() {
        return HashUtil.hexToB64(hexId);
    }

    @Override
    public String toString() {
        return PREFIX + hexId + "/" + path;
    }
}

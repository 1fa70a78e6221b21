package com.libragraph.artifacts.core.manifest;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One row of a manifest: logical path, digest, size, and for references the URI
 * the bytes live at.
 *
 * <p>{@code extra} holds backend provenance (etag, versionID) and never feeds the
 * manifest digest. {@code localPath} stages bytes for upload and is not serialized.
 */
public final class ManifestEntry {

    private final String path;
    private final String digest;
    private final Long size;
    private final String ref;
    private final Map<String, String> extra;
    private String birthArtifactId;
    private Path localPath;

    public ManifestEntry(String path, String digest, Long size, String ref,
                         Map<String, String> extra, String birthArtifactId, Path localPath) {
        Objects.requireNonNull(path, "path cannot be null");
        Objects.requireNonNull(digest, "digest cannot be null");
        if (localPath != null && size == null) {
            throw new IllegalArgumentException("size is required when a local path is staged: " + path);
        }
        if (size != null && size < 0) {
            throw new IllegalArgumentException("size must be >= 0, got: " + size);
        }
        this.path = normalizePath(path);
        this.digest = digest;
        this.size = size;
        this.ref = ref;
        this.extra = extra == null || extra.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(extra));
        this.birthArtifactId = birthArtifactId;
        this.localPath = localPath;
    }

    /**
     * Entry for a locally added file whose bytes will be uploaded.
     */
    public static ManifestEntry local(String path, String digest, long size, Path localPath) {
        return new ManifestEntry(path, digest, size, null, null, null, localPath);
    }

    /**
     * Entry for bytes that stay where {@code ref} points.
     */
    public static ManifestEntry reference(String path, String ref, String digest,
                                          Long size, Map<String, String> extra) {
        Objects.requireNonNull(ref, "ref cannot be null");
        return new ManifestEntry(path, digest, size, ref, extra, null, null);
    }

    /**
     * Converts OS separators to forward slashes.
     */
    public static String normalizePath(String path) {
        return path.replace('\\', '/');
    }

    public String path() {
        return path;
    }

    public String digest() {
        return digest;
    }

    public Optional<Long> size() {
        return Optional.ofNullable(size);
    }

    public Optional<String> ref() {
        return Optional.ofNullable(ref);
    }

    public boolean isReference() {
        return ref != null;
    }

    public Map<String, String> extra() {
        return extra;
    }

    public Optional<String> birthArtifactId() {
        return Optional.ofNullable(birthArtifactId);
    }

    public void setBirthArtifactId(String birthArtifactId) {
        this.birthArtifactId = birthArtifactId;
    }

    public Optional<Path> localPath() {
        return Optional.ofNullable(localPath);
    }

    /**
     * Clears the staged local path once the bytes are uploaded.
     */
    public void clearLocalPath() {
        this.localPath = null;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ManifestEntry other)) return false;
        return path.equals(other.path)
                && digest.equals(other.digest)
                && Objects.equals(size, other.size)
                && Objects.equals(ref, other.ref)
                && extra.equals(other.extra)
                && Objects.equals(birthArtifactId, other.birthArtifactId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, digest, size, ref, extra, birthArtifactId);
    }

    @Override
    public String toString() {
        return ref != null
                ? "ManifestEntry[" + path + " ref=" + ref + "]"
                : "ManifestEntry[" + path + " digest=" + digest + "]";
    }
}

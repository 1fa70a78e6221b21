package com.libragraph.artifacts.core.storage;

import com.libragraph.artifacts.core.manifest.ManifestEntry;

import java.util.List;
import java.util.Set;

/**
 * Checksums and resolves references for one family of URI schemes.
 *
 * <p>Handlers are discovered as CDI beans by {@link StorageHandlerRegistry}.
 * {@link #storePath} reads metadata only and never mutates remote state;
 * {@code loadPath(entry, false)} never touches the network; repeated
 * {@code loadPath(entry, true)} calls are served from the object cache.
 */
public interface StorageHandler {

    /**
     * Lower-case schemes this handler resolves, e.g. {@code s3} or {@code http}.
     */
    Set<String> schemes();

    /**
     * Builds manifest entries for the object(s) at {@code uri}.
     *
     * @param name logical path for the entry, or the prefix for entries under a directory; may be null
     * @param checksum when false, no content or remote metadata is read
     * @param maxObjects upper bound on entries produced by expanding a prefix or directory
     * @throws QuotaExceededException if expansion yields more than {@code maxObjects} entries
     */
    List<ManifestEntry> storePath(String uri, String name, boolean checksum, int maxObjects);

    /**
     * Resolves a reference entry.
     *
     * @param local when true, returns a filesystem path holding the bytes; otherwise the reference target
     */
    String loadPath(ManifestEntry entry, boolean local);
}

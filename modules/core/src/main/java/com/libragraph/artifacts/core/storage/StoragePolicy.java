package com.libragraph.artifacts.core.storage;

import com.libragraph.artifacts.core.cache.CacheLookup;
import com.libragraph.artifacts.core.cache.ObjectCache;
import com.libragraph.artifacts.core.manifest.ManifestDefaults;
import com.libragraph.artifacts.core.manifest.ManifestEntry;
import com.libragraph.artifacts.util.HashUtil;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Map;

/**
 * How an artifact stores and resolves its entries.
 *
 * <p>Local files become unreferenced entries staged for upload and never pass through
 * the cache on the way in. References are checksummed and resolved by the
 * {@link StorageHandler} for their scheme. Uploaded files are read back through the
 * md5 namespace of the {@link ObjectCache}, fetching misses from the
 * {@link ArtifactFileSource}.
 */
@ApplicationScoped
public class StoragePolicy {

    private static final Logger log = Logger.getLogger(StoragePolicy.class);

    @Inject
    ObjectCache cache;

    @Inject
    StorageHandlerRegistry registry;

    @Inject
    Instance<ArtifactFileSource> fileSources;

    @ConfigProperty(name = "artifacts.staging.dir", defaultValue = "${java.io.tmpdir}/artifacts-staging")
    String stagingDirectory;

    @ConfigProperty(name = "artifacts.reference.max-objects", defaultValue = "10000")
    int defaultMaxObjects;

    private ArtifactFileSource fileSource;
    private Path stagingDir;

    StoragePolicy() {
    }

    /**
     * @param fileSource source of uploaded bytes; null when only references and staged files are read
     */
    public StoragePolicy(ObjectCache cache, StorageHandlerRegistry registry, ArtifactFileSource fileSource,
                         Path stagingDir, int defaultMaxObjects) {
        this.cache = cache;
        this.registry = registry;
        this.fileSource = fileSource;
        this.stagingDir = stagingDir;
        this.defaultMaxObjects = defaultMaxObjects;
    }

    @PostConstruct
    void init() {
        fileSource = fileSources.isResolvable() ? fileSources.get() : null;
        stagingDir = Path.of(stagingDirectory);
    }

    public String name() {
        return ManifestDefaults.STORAGE_POLICY;
    }

    public Map<String, Object> config() {
        return Map.of("storageLayout", "V2");
    }

    public int defaultMaxObjects() {
        return defaultMaxObjects;
    }

    public ObjectCache cache() {
        return cache;
    }

    /**
     * Hashes {@code localPath} and returns an entry staging it for upload.
     */
    public ManifestEntry storeFile(Path localPath, String name) {
        return storeFile(localPath, name, null);
    }

    /**
     * As {@link #storeFile(Path, String)} with a digest the caller already computed.
     */
    public ManifestEntry storeFile(Path localPath, String name, String digest) {
        try {
            String md5 = digest != null ? digest : HashUtil.md5FileB64(localPath);
            return ManifestEntry.local(name, md5, Files.size(localPath), localPath);
        } catch (IOException e) {
            throw new StorageException("Failed to read " + localPath, e);
        }
    }

    /**
     * Builds entries for {@code uri} through the handler for its scheme.
     *
     * @throws QuotaExceededException if more than {@code maxObjects} entries would be produced
     */
    public List<ManifestEntry> storeReference(String uri, String name, boolean checksum, int maxObjects) {
        StorageHandler handler = registry.handlerFor(uri);
        List<ManifestEntry> entries = handler.storePath(uri, name, checksum, maxObjects);
        if (entries.size() > maxObjects) {
            throw new QuotaExceededException(uri, maxObjects);
        }
        log.debugf("Reference %s produced %d entries via %s",
                uri, entries.size(), handler.getClass().getSimpleName());
        return entries;
    }

    public String loadReference(ManifestEntry entry, boolean local) {
        String ref = entry.ref().orElseThrow(() ->
                new IllegalArgumentException("Not a reference entry: " + entry.path()));
        return registry.handlerFor(ref).loadPath(entry, local);
    }

    /**
     * Local path of an uploaded file of a committed artifact.
     */
    public Path loadFile(String artifactId, ManifestEntry entry) {
        if (entry.isReference()) {
            throw new IllegalArgumentException("Entry is a reference: " + entry.path());
        }
        long size = entry.size().orElseThrow(() ->
                new IllegalArgumentException("Uploaded entry has no size: " + entry.path()));
        CacheLookup lookup;
        try {
            lookup = cache.checkMd5ObjPath(entry.digest(), size);
        } catch (IOException e) {
            throw new StorageException("Cache lookup failed for " + entry.path(), e);
        }
        if (lookup.exists()) {
            return lookup.path();
        }
        if (fileSource == null) {
            throw new StorageException("No artifact file source available to fetch " + entry.path());
        }
        return CachedDownload.fetch(lookup, "artifact " + artifactId + " file " + entry.path(),
                size, entry.digest(), () -> fileSource.open(artifactId, entry));
    }

    /**
     * Writes an uploaded entry's staged bytes through to the md5 cache.
     */
    public Path cacheUploaded(ManifestEntry entry) {
        Path source = entry.localPath().orElseThrow(() ->
                new IllegalArgumentException("Entry has no staged file: " + entry.path()));
        try {
            CacheLookup lookup = cache.checkMd5ObjPath(entry.digest(), entry.size().orElseThrow());
            return lookup.exists() ? lookup.path() : lookup.opener().copyFrom(source);
        } catch (IOException e) {
            throw new StorageException("Failed to cache uploaded file " + entry.path(), e);
        }
    }

    /**
     * Copies {@code source} into the staging directory so later edits to it do not
     * change what gets uploaded.
     */
    public Path stageCopy(Path source) {
        Path target = newStagingFile(source.getFileName().toString());
        try {
            Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
            return target;
        } catch (IOException e) {
            throw new StorageException("Failed to stage " + source, e);
        }
    }

    /**
     * A new empty file in the staging directory.
     */
    public Path newStagingFile(String name) {
        String fileName = name.substring(name.lastIndexOf('/') + 1);
        try {
            Files.createDirectories(stagingDir);
            return Files.createTempFile(stagingDir, "staged_", "_" + fileName);
        } catch (IOException e) {
            throw new StorageException("Failed to create staging file for " + name, e);
        }
    }
}

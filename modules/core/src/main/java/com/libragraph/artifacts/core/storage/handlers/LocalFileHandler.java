package com.libragraph.artifacts.core.storage.handlers;

import com.libragraph.artifacts.core.cache.CacheKey;
import com.libragraph.artifacts.core.cache.CacheLookup;
import com.libragraph.artifacts.core.cache.ObjectCache;
import com.libragraph.artifacts.core.manifest.ManifestEntry;
import com.libragraph.artifacts.core.storage.DigestMismatchException;
import com.libragraph.artifacts.core.storage.QuotaExceededException;
import com.libragraph.artifacts.core.storage.ReferenceNotFoundException;
import com.libragraph.artifacts.core.storage.StorageException;
import com.libragraph.artifacts.core.storage.StorageHandler;
import com.libragraph.artifacts.util.HashUtil;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * References to files and directories on a local or mounted filesystem ({@code file://path}).
 *
 * <p>With checksumming the file content is hashed; without it only the size is read and
 * the digest is the MD5 of the size's decimal string. A local load verifies the file
 * against its MD5 digest and copies it into the cache, so later loads never see edits
 * made to the source. Unchecked entries and non-local loads return the source path.
 */
@ApplicationScoped
public class LocalFileHandler implements StorageHandler {

    private static final Logger log = Logger.getLogger(LocalFileHandler.class);

    private static final String PREFIX = "file://";

    @Inject
    ObjectCache cache;

    LocalFileHandler() {
    }

    public LocalFileHandler(ObjectCache cache) {
        this.cache = cache;
    }

    @Override
    public Set<String> schemes() {
        return Set.of("file");
    }

    @Override
    public List<ManifestEntry> storePath(String uri, String name, boolean checksum, int maxObjects) {
        Path local = toPath(uri);
        try {
            if (Files.isDirectory(local)) {
                return storeDirectory(uri, local, name, checksum, maxObjects);
            }
            if (Files.isRegularFile(local)) {
                String entryName = name != null ? name : local.getFileName().toString();
                return List.of(entry(entryName, uri, local, checksum));
            }
        } catch (IOException e) {
            throw new StorageException("Failed to read " + local, e);
        }
        throw new ReferenceNotFoundException("Path \"" + uri + "\" must be a valid file or directory path");
    }

    private List<ManifestEntry> storeDirectory(String uri, Path dir, String name, boolean checksum,
                                               int maxObjects) throws IOException {
        if (checksum) {
            log.infof("Generating checksum for up to %d files in \"%s\"", maxObjects, dir);
        }
        long start = System.nanoTime();
        String base = uri.endsWith("/") ? uri : uri + "/";
        List<ManifestEntry> entries = new ArrayList<>();
        try (Stream<Path> walk = Files.walk(dir)) {
            Iterator<Path> files = walk.filter(Files::isRegularFile).sorted().iterator();
            while (files.hasNext()) {
                Path file = files.next();
                if (entries.size() == maxObjects) {
                    throw new QuotaExceededException(uri, maxObjects);
                }
                String relative = ManifestEntry.normalizePath(dir.relativize(file).toString());
                String entryName = name != null ? BucketEntries.join(name, relative) : relative;
                entries.add(entry(entryName, base + relative, file, checksum));
            }
        }
        log.infof("Tracked %d files under %s in %.1fs", entries.size(), dir, (System.nanoTime() - start) / 1e9);
        return entries;
    }

    private static ManifestEntry entry(String name, String ref, Path file, boolean checksum) throws IOException {
        long size = Files.size(file);
        String digest = checksum ? HashUtil.md5FileB64(file) : HashUtil.md5String(String.valueOf(size));
        return ManifestEntry.reference(name, ref, digest, size, Map.of());
    }

    @Override
    public String loadPath(ManifestEntry entry, boolean local) {
        Path path = toPath(HandlerSupport.requireRef(entry));
        if (local && !isSizeDigest(entry)) {
            CacheLookup lookup = HandlerSupport.lookup(cache, CacheKey.md5(entry.digest()), entry);
            if (lookup.exists()) {
                return lookup.path().toString();
            }
            requireFile(path, entry);
            try {
                String actual = HashUtil.md5FileB64(path);
                if (!actual.equals(entry.digest())) {
                    throw new DigestMismatchException(path.toString(), entry.digest(), actual);
                }
                return lookup.opener().copyFrom(path).toString();
            } catch (IOException e) {
                throw new StorageException("Failed to cache " + path, e);
            }
        }
        requireFile(path, entry);
        return path.toString();
    }

    /**
     * Entries added without checksumming carry the MD5 of their size, not of their content.
     */
    private static boolean isSizeDigest(ManifestEntry entry) {
        return entry.size().isPresent()
                && entry.digest().equals(HashUtil.md5String(String.valueOf(entry.size().get())));
    }

    private static void requireFile(Path path, ManifestEntry entry) {
        if (!Files.isRegularFile(path)) {
            throw new ReferenceNotFoundException("Local file reference: failed to find file at path " + path);
        }
        if (entry.size().isPresent()) {
            long actual;
            try {
                actual = Files.size(path);
            } catch (IOException e) {
                throw new StorageException("Failed to read " + path, e);
            }
            if (actual != entry.size().get()) {
                throw new DigestMismatchException(path.toString(),
                        entry.size().get() + " bytes", actual + " bytes");
            }
        }
    }

    static Path toPath(String uri) {
        if (!uri.regionMatches(true, 0, PREFIX, 0, PREFIX.length())) {
            throw new IllegalArgumentException("Not a file URI: " + uri);
        }
        return Path.of(uri.substring(PREFIX.length()));
    }
}

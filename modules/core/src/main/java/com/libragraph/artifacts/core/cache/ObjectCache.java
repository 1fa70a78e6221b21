package com.libragraph.artifacts.core.cache;

import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributeView;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Disk-resident, process-shared cache of object bytes keyed by content digest.
 *
 * <p>Layout: {@code {root}/obj/md5/{hex[0:2]}/{hex[2:]}} for locally hashed content and
 * {@code {root}/obj/etag/{hex[0:2]}/{hex[2:]}} for remote (url, etag) content.
 *
 * <p>No locks: every mutation is a write to a temporary file in the object's own
 * directory followed by an atomic rename, so a reader sees either no object or a
 * complete one. Concurrent writers of one key all succeed and the last rename wins.
 * {@link #cleanup(long)} must only run from one process at a time.
 */
public class ObjectCache {

    private static final Logger log = Logger.getLogger(ObjectCache.class);

    /** Name prefix of in-flight temporary files. */
    public static final String TMP_PREFIX = "tmp_";

    /** Expected size for objects whose size was never recorded; any complete file is a hit. */
    public static final long UNKNOWN_SIZE = -1;

    private final Path root;

    public ObjectCache(Path root) {
        this.root = Objects.requireNonNull(root, "cache root cannot be null");
    }

    public Path root() {
        return root;
    }

    /**
     * Looks up {@code key}; the object exists only if its file size equals {@code expectedSize}
     * (or {@code expectedSize} is {@link #UNKNOWN_SIZE}).
     * A hit refreshes the object's last-access time.
     */
    public CacheLookup lookupOrOpen(CacheKey key, long expectedSize) throws IOException {
        Path path = key.resolveUnder(root);
        CacheOpener opener = new CacheOpener(path);
        BasicFileAttributes attrs = attributesOrNull(path);
        if (attrs != null && attrs.isRegularFile()
                && (expectedSize == UNKNOWN_SIZE || attrs.size() == expectedSize)) {
            touch(path);
            log.debugf("Cache hit: %s", key);
            return new CacheLookup(path, true, opener);
        }
        Files.createDirectories(path.getParent());
        log.debugf("Cache miss: %s (expected %d bytes)", key, expectedSize);
        return new CacheLookup(path, false, opener);
    }

    /**
     * Looks up content by its base64 MD5 digest.
     */
    public CacheLookup checkMd5ObjPath(String b64Md5, long size) throws IOException {
        return lookupOrOpen(CacheKey.md5(b64Md5), size);
    }

    /**
     * Looks up remote content by URL and etag.
     */
    public CacheLookup checkEtagObjPath(String url, String etag, long size) throws IOException {
        return lookupOrOpen(CacheKey.etag(url, etag), size);
    }

    /**
     * Evicts objects, least recently accessed first, until the cache holds at most
     * {@code targetBytes}. Leftover temporary files are always removed.
     * A file that cannot be deleted is skipped.
     *
     * @return bytes reclaimed
     */
    public long cleanup(long targetBytes) throws IOException {
        if (!Files.isDirectory(root)) {
            return 0;
        }

        List<CachedFile> files = new ArrayList<>();
        long[] reclaimed = {0};

        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (!attrs.isRegularFile()) {
                    return FileVisitResult.CONTINUE;
                }
                if (file.getFileName().toString().startsWith(TMP_PREFIX)) {
                    if (delete(file)) {
                        reclaimed[0] += attrs.size();
                    }
                } else {
                    files.add(new CachedFile(file, attrs.size(), attrs.lastAccessTime()));
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                log.warnf("Skipping unreadable cache entry %s: %s", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });

        long total = files.stream().mapToLong(CachedFile::size).sum();
        files.sort(Comparator.comparing(CachedFile::lastAccess));

        for (CachedFile file : files) {
            if (total <= targetBytes) {
                break;
            }
            if (delete(file.path())) {
                total -= file.size();
                reclaimed[0] += file.size();
            }
        }

        log.infof("Cache cleanup reclaimed %d bytes, %d bytes remain", reclaimed[0], total);
        return reclaimed[0];
    }

    private static BasicFileAttributes attributesOrNull(Path path) throws IOException {
        try {
            return Files.readAttributes(path, BasicFileAttributes.class);
        } catch (NoSuchFileException e) {
            return null;
        }
    }

    private boolean delete(Path file) {
        try {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warnf("Failed to evict cache file %s: %s", file, e.getMessage());
            return false;
        }
    }

    private void touch(Path path) {
        try {
            Files.getFileAttributeView(path, BasicFileAttributeView.class)
                    .setTimes(null, FileTime.from(Instant.now()), null);
        } catch (IOException e) {
            log.debugf("Could not update access time of %s: %s", path, e.getMessage());
        }
    }

    private record CachedFile(Path path, long size, FileTime lastAccess) {}
}

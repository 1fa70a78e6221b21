package com.libragraph.artifacts.core.storage;

import com.libragraph.artifacts.core.cache.CacheLookup;
import com.libragraph.artifacts.core.cache.CacheWrite;
import org.apache.commons.codec.digest.DigestUtils;
import org.jboss.logging.Logger;

import java.io.InputStream;
import java.nio.file.Path;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.util.Base64;

/**
 * Streams remote bytes into a cache slot, committing only a complete object.
 */
public final class CachedDownload {

    private static final Logger log = Logger.getLogger(CachedDownload.class);

    /**
     * Opens the remote content. Backend clients throw a variety of checked exceptions.
     */
    @FunctionalInterface
    public interface Source {
        InputStream open() throws Exception;
    }

    private CachedDownload() {
    }

    /**
     * Returns the cached path, fetching from {@code source} on a miss.
     *
     * @param expectedSize declared size, or null when unknown
     * @throws IncompleteDownloadException if the byte count differs from {@code expectedSize};
     *         the temporary file is discarded
     */
    public static Path fetch(CacheLookup lookup, String uri, Long expectedSize, Source source) {
        return fetch(lookup, uri, expectedSize, null, source);
    }

    /**
     * As {@link #fetch(CacheLookup, String, Long, Source)}, also checking the base64 MD5 of
     * the received bytes before they are committed.
     *
     * @param expectedMd5 base64 MD5, or null to skip the check
     * @throws DigestMismatchException if the received bytes hash differently
     */
    public static Path fetch(CacheLookup lookup, String uri, Long expectedSize, String expectedMd5,
                             Source source) {
        if (lookup.exists()) {
            return lookup.path();
        }
        MessageDigest md5 = DigestUtils.getMd5Digest();
        try (CacheWrite write = lookup.opener().open();
             InputStream in = new DigestInputStream(source.open(), md5)) {
            long written = in.transferTo(write.outputStream());
            if (expectedSize != null && written != expectedSize) {
                throw new IncompleteDownloadException(uri, expectedSize, written);
            }
            if (expectedMd5 != null) {
                String actual = Base64.getEncoder().encodeToString(md5.digest());
                if (!expectedMd5.equals(actual)) {
                    throw new DigestMismatchException(uri, expectedMd5, actual);
                }
            }
            Path path = write.commit();
            log.debugf("Fetched %s (%d bytes) into %s", uri, written, path);
            return path;
        } catch (StorageException e) {
            throw e;
        } catch (Exception e) {
            throw new StorageException("Failed to fetch " + uri, e);
        }
    }
}

package com.libragraph.artifacts.core.storage.handlers;

import com.libragraph.artifacts.core.cache.CacheKey;
import com.libragraph.artifacts.core.cache.CacheLookup;
import com.libragraph.artifacts.core.cache.ObjectCache;
import com.libragraph.artifacts.core.manifest.ManifestEntry;
import com.libragraph.artifacts.core.storage.StorageException;

import java.io.IOException;

final class HandlerSupport {

    private HandlerSupport() {
    }

    static String requireRef(ManifestEntry entry) {
        return entry.ref().orElseThrow(() ->
                new IllegalArgumentException("Not a reference entry: " + entry.path()));
    }

    /**
     * An entry added with checksumming disabled carries its own URI as the digest.
     */
    static boolean isUnchecked(ManifestEntry entry) {
        return entry.ref().map(entry.digest()::equals).orElse(false);
    }

    static CacheLookup lookup(ObjectCache cache, CacheKey key, ManifestEntry entry) {
        try {
            return cache.lookupOrOpen(key, entry.size().orElse(ObjectCache.UNKNOWN_SIZE));
        } catch (IOException e) {
            throw new StorageException("Cache lookup failed for " + entry.path(), e);
        }
    }
}

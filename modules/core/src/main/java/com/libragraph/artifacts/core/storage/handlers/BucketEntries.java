package com.libragraph.artifacts.core.storage.handlers;

import com.libragraph.artifacts.core.manifest.ManifestEntry;
import com.libragraph.artifacts.core.storage.QuotaExceededException;
import com.libragraph.artifacts.core.storage.ReferenceNotFoundException;
import com.libragraph.artifacts.core.storage.bucket.BucketClient;
import com.libragraph.artifacts.core.storage.bucket.BucketLocation;
import com.libragraph.artifacts.core.storage.bucket.BucketObject;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Turns a bucket URI into entries: one for an object, or one per non-empty object
 * when the URI names a prefix.
 */
final class BucketEntries {

    private static final Logger log = Logger.getLogger(BucketEntries.class);

    @FunctionalInterface
    interface EntryFactory {
        ManifestEntry create(String name, String ref, BucketObject object);
    }

    private BucketEntries() {
    }

    static List<ManifestEntry> expand(BucketClient client, BucketLocation location, String name,
                                      int maxObjects, EntryFactory factory) {
        Optional<BucketObject> single = client.stat(location.bucket(), location.key(), location.version());
        List<ManifestEntry> entries;
        if (single.isPresent() && !single.get().isDirectoryMarker()) {
            String entryName = name != null ? name : basename(location.key());
            entries = List.of(factory.create(entryName, location.uri(), single.get()));
        } else {
            String prefix = location.directoryPrefix();
            String base = location.scheme() + "://" + location.bucket() + "/" + prefix;
            log.infof("Generating checksum for up to %d objects with prefix \"%s\" in %s",
                    maxObjects, prefix, location.bucket());
            long start = System.nanoTime();
            try (Stream<BucketObject> objects = client.list(location.bucket(), prefix)) {
                entries = objects
                        .filter(object -> object.size() > 0)
                        .limit(maxObjects + 1L)
                        .map(object -> {
                            String relative = object.key().substring(prefix.length());
                            String entryName = name != null ? join(name, relative) : relative;
                            return factory.create(entryName, base + relative, object);
                        })
                        .collect(Collectors.toList());
            }
            log.infof("Checksummed %d objects under %s in %.1fs",
                    entries.size(), location.uri(), (System.nanoTime() - start) / 1e9);
            if (entries.isEmpty()) {
                throw new ReferenceNotFoundException("No objects found at " + location.uri());
            }
        }
        if (entries.size() > maxObjects) {
            throw new QuotaExceededException(location.uri(), maxObjects);
        }
        return entries;
    }

    static String basename(String path) {
        String trimmed = path;
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed.substring(trimmed.lastIndexOf('/') + 1);
    }

    static String join(String dir, String name) {
        String trimmed = dir;
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed.isEmpty() ? name : trimmed + "/" + name;
    }
}

package com.libragraph.artifacts.core.storage.handlers;

import com.libragraph.artifacts.core.cache.CacheKey;
import com.libragraph.artifacts.core.cache.CacheLookup;
import com.libragraph.artifacts.core.cache.ObjectCache;
import com.libragraph.artifacts.core.manifest.ManifestEntry;
import com.libragraph.artifacts.core.storage.CachedDownload;
import com.libragraph.artifacts.core.storage.DigestMismatchException;
import com.libragraph.artifacts.core.storage.ReferenceNotFoundException;
import com.libragraph.artifacts.core.storage.StorageHandler;
import com.libragraph.artifacts.core.storage.bucket.BucketClient;
import com.libragraph.artifacts.core.storage.bucket.BucketLocation;
import com.libragraph.artifacts.core.storage.bucket.BucketObject;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.jboss.logging.Logger;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * References into Google Cloud Storage ({@code gs://bucket/key[#generation]}).
 *
 * <p>The digest is the object's base64 MD5, so downloads share the md5 cache namespace
 * with uploaded files. The generation is recorded as {@code versionID}; when that
 * generation is gone the latest object is used if its MD5 still matches.
 */
@ApplicationScoped
public class GcsHandler implements StorageHandler {

    private static final Logger log = Logger.getLogger(GcsHandler.class);

    private static final Pattern B64_MD5 = Pattern.compile("^[A-Za-z0-9+/]{22}==$");

    @Inject
    @Named("gcs")
    BucketClient client;

    @Inject
    ObjectCache cache;

    GcsHandler() {
    }

    public GcsHandler(BucketClient client, ObjectCache cache) {
        this.client = client;
        this.cache = cache;
    }

    @Override
    public Set<String> schemes() {
        return Set.of("gs");
    }

    @Override
    public List<ManifestEntry> storePath(String uri, String name, boolean checksum, int maxObjects) {
        BucketLocation location = BucketLocation.parse(uri);
        if (!checksum) {
            String entryName = name != null ? name : BucketEntries.basename(location.key());
            return List.of(ManifestEntry.reference(entryName, uri, uri, null, Map.of()));
        }
        return BucketEntries.expand(client, location, name, maxObjects,
                (entryName, ref, object) -> ManifestEntry.reference(
                        entryName, ref, digestOf(object), object.size(), extra(object)));
    }

    @Override
    public String loadPath(ManifestEntry entry, boolean local) {
        String ref = HandlerSupport.requireRef(entry);
        if (!local) {
            return ref;
        }
        boolean md5Digest = B64_MD5.matcher(entry.digest()).matches();
        CacheKey key = md5Digest ? CacheKey.md5(entry.digest()) : CacheKey.etag(ref, entry.digest());
        CacheLookup lookup = HandlerSupport.lookup(cache, key, entry);
        if (lookup.exists()) {
            return lookup.path().toString();
        }
        BucketObject object = resolve(BucketLocation.parse(ref), entry);
        return CachedDownload.fetch(lookup, ref, entry.size().orElse(null),
                md5Digest ? entry.digest() : null, () -> client.open(object)).toString();
    }

    private BucketObject resolve(BucketLocation location, ManifestEntry entry) {
        String generation = entry.extra().getOrDefault("versionID", location.version());
        if (generation != null && !HandlerSupport.isUnchecked(entry)) {
            var pinned = client.stat(location.bucket(), location.key(), generation);
            if (pinned.isPresent()) {
                return pinned.get();
            }
            log.debugf("Generation %s of %s is gone, falling back to the latest object",
                    generation, location.uri());
        }
        BucketObject latest = client.stat(location.bucket(), location.key(), null)
                .orElseThrow(() -> new ReferenceNotFoundException(generation != null
                        ? "Unable to download " + location.uri() + " with generation " + generation
                        : "Object not found: " + location.uri()));
        if (!HandlerSupport.isUnchecked(entry) && !entry.digest().equals(digestOf(latest))) {
            throw new DigestMismatchException(location.uri(), entry.digest(), digestOf(latest));
        }
        return latest;
    }

    private static String digestOf(BucketObject object) {
        return object.md5() != null ? object.md5() : object.etag();
    }

    private static Map<String, String> extra(BucketObject object) {
        Map<String, String> extra = new LinkedHashMap<>();
        if (object.etag() != null) {
            extra.put("etag", object.etag());
        }
        if (object.versionId() != null) {
            extra.put("versionID", object.versionId());
        }
        return extra;
    }
}

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

/**
 * References into S3 ({@code s3://bucket/key[?versionId=V]}).
 *
 * <p>The digest is the object's etag; {@code extra} records the etag and version id.
 * Downloads are cached under (ref, etag). Without a recorded version, a latest object
 * whose etag changed is located among the bucket's versions when versioning is enabled.
 */
@ApplicationScoped
public class S3Handler implements StorageHandler {

    private static final Logger log = Logger.getLogger(S3Handler.class);

    @Inject
    @Named("s3")
    BucketClient client;

    @Inject
    ObjectCache cache;

    S3Handler() {
    }

    public S3Handler(BucketClient client, ObjectCache cache) {
        this.client = client;
        this.cache = cache;
    }

    @Override
    public Set<String> schemes() {
        return Set.of("s3");
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
                        entryName, ref, object.etag(), object.size(), extra(object)));
    }

    @Override
    public String loadPath(ManifestEntry entry, boolean local) {
        String ref = HandlerSupport.requireRef(entry);
        if (!local) {
            return ref;
        }
        CacheLookup lookup = HandlerSupport.lookup(cache, CacheKey.etag(ref, entry.digest()), entry);
        if (lookup.exists()) {
            return lookup.path().toString();
        }
        BucketObject object = resolve(BucketLocation.parse(ref), entry);
        return CachedDownload.fetch(lookup, ref, entry.size().orElse(null), () -> client.open(object)).toString();
    }

    private BucketObject resolve(BucketLocation location, ManifestEntry entry) {
        String version = entry.extra().getOrDefault("versionID", location.version());
        if (version != null && !HandlerSupport.isUnchecked(entry)) {
            return client.stat(location.bucket(), location.key(), version)
                    .orElseThrow(() -> new ReferenceNotFoundException(
                            "Object version not found: " + location.uri() + " version " + version));
        }
        BucketObject latest = client.stat(location.bucket(), location.key(), null)
                .orElseThrow(() -> new ReferenceNotFoundException("Object not found: " + location.uri()));
        if (HandlerSupport.isUnchecked(entry) || entry.digest().equals(latest.etag())) {
            return latest;
        }
        if (!client.versioningEnabled(location.bucket())) {
            throw new DigestMismatchException(location.uri(), entry.digest(), latest.etag());
        }
        String etag = entry.extra().getOrDefault("etag", entry.digest());
        log.debugf("Latest %s has etag %s, searching versions for %s", location.uri(), latest.etag(), etag);
        return client.listVersions(location.bucket(), location.key()).stream()
                .filter(candidate -> etag.equals(candidate.etag()))
                .findFirst()
                .orElseThrow(() -> new ReferenceNotFoundException(
                        "No version of " + location.uri() + " matches etag " + etag));
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

package com.libragraph.artifacts.core.storage.bucket;

import java.io.InputStream;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Read-only metadata and content access to an object store.
 *
 * <p>Failures surface as {@link com.libragraph.artifacts.core.storage.StorageException}.
 */
public interface BucketClient {

    /**
     * Metadata of {@code key}, optionally at a pinned version; empty if it does not exist.
     */
    Optional<BucketObject> stat(String bucket, String key, String versionId);

    /**
     * Objects below {@code prefix}, fetched lazily page by page. Close the stream when done.
     */
    Stream<BucketObject> list(String bucket, String prefix);

    /**
     * All stored versions of exactly {@code key}, excluding delete markers.
     */
    List<BucketObject> listVersions(String bucket, String key);

    boolean versioningEnabled(String bucket);

    /**
     * Opens the content of {@code object}, honouring its version when set.
     *
     * @throws com.libragraph.artifacts.core.storage.ReferenceNotFoundException if it no longer exists
     */
    InputStream open(BucketObject object);
}

package com.libragraph.artifacts.core.storage.bucket;

import java.util.Objects;

/**
 * Metadata of one object in a bucket.
 *
 * @param etag backend etag with surrounding quotes removed
 * @param versionId S3 version id or GCS generation; null when unversioned
 * @param md5 base64 MD5 when the backend reports one (GCS); null otherwise
 */
public record BucketObject(String bucket, String key, long size, String etag,
                           String versionId, String md5, String contentType) {

    public BucketObject {
        Objects.requireNonNull(bucket, "bucket cannot be null");
        Objects.requireNonNull(key, "key cannot be null");
    }

    /**
     * Zero-byte directory marker written by some S3 tools.
     */
    public boolean isDirectoryMarker() {
        return size == 0 && contentType != null && contentType.startsWith("application/x-directory");
    }

    public BucketObject withVersion(String versionId) {
        return new BucketObject(bucket, key, size, etag, versionId, md5, contentType);
    }

    static String stripQuotes(String etag) {
        if (etag == null) {
            return null;
        }
        String stripped = etag.startsWith("W/") ? etag.substring(2) : etag;
        if (stripped.length() >= 2 && stripped.startsWith("\"") && stripped.endsWith("\"")) {
            stripped = stripped.substring(1, stripped.length() - 1);
        }
        return stripped;
    }
}

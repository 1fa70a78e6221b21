package com.libragraph.artifacts.core.storage.bucket;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * A parsed bucket URI: {@code s3://bucket/key?versionId=V} or {@code gs://bucket/key#generation}.
 *
 * @param version pinned version, or null
 */
public record BucketLocation(String scheme, String bucket, String key, String version) {

    public BucketLocation {
        Objects.requireNonNull(scheme, "scheme cannot be null");
        Objects.requireNonNull(bucket, "bucket cannot be null");
        Objects.requireNonNull(key, "key cannot be null");
    }

    public static BucketLocation parse(String uri) {
        int sep = uri.indexOf("://");
        if (sep <= 0) {
            throw new IllegalArgumentException("Not a bucket URI: " + uri);
        }
        String scheme = uri.substring(0, sep);
        String rest = uri.substring(sep + 3);
        String version = null;

        int hash = rest.indexOf('#');
        if (hash >= 0) {
            version = emptyToNull(rest.substring(hash + 1));
            rest = rest.substring(0, hash);
        }
        int query = rest.indexOf('?');
        if (query >= 0) {
            for (String param : rest.substring(query + 1).split("&")) {
                int eq = param.indexOf('=');
                if (eq > 0 && param.substring(0, eq).equals("versionId")) {
                    version = emptyToNull(URLDecoder.decode(param.substring(eq + 1), StandardCharsets.UTF_8));
                }
            }
            rest = rest.substring(0, query);
        }

        int slash = rest.indexOf('/');
        String bucket = slash < 0 ? rest : rest.substring(0, slash);
        String key = slash < 0 ? "" : rest.substring(slash + 1);
        if (bucket.isEmpty()) {
            throw new IllegalArgumentException("Bucket URI has no bucket: " + uri);
        }
        return new BucketLocation(scheme, bucket, key, version);
    }

    /**
     * The URI without any version pin.
     */
    public String uri() {
        return scheme + "://" + bucket + "/" + key;
    }

    /**
     * {@code key} as a directory prefix: empty, or ending in exactly one slash.
     */
    public String directoryPrefix() {
        String dir = key;
        while (dir.endsWith("/")) {
            dir = dir.substring(0, dir.length() - 1);
        }
        return dir.isEmpty() ? "" : dir + "/";
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}

package com.libragraph.artifacts.core.cache;

import com.libragraph.artifacts.util.HashUtil;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Identity of a cached object: a namespace plus a hex digest.
 *
 * <p>Layout: {@code obj/{kind}/{hex[0:2]}/{hex[2:]}}.
 */
public record CacheKey(Kind kind, String hex) {

    public enum Kind {
        /** Content hashed locally; hex of the MD5. */
        MD5("md5"),
        /** Remote content; SHA-256 hex of {@code url + etag}. */
        ETAG("etag");

        private final String dirName;

        Kind(String dirName) {
            this.dirName = dirName;
        }

        public String dirName() {
            return dirName;
        }
    }

    public CacheKey {
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(hex, "hex cannot be null");
        if (hex.length() < 3) {
            throw new IllegalArgumentException("Cache key too short: " + hex);
        }
    }

    /**
     * Key for content identified by its base64 MD5 digest.
     */
    public static CacheKey md5(String b64Md5) {
        return new CacheKey(Kind.MD5, HashUtil.b64ToHex(b64Md5));
    }

    /**
     * Key for remote content identified by its URL and etag (or other version token).
     */
    public static CacheKey etag(String url, String etag) {
        return new CacheKey(Kind.ETAG, HashUtil.etagKey(url, etag));
    }

    Path resolveUnder(Path root) {
        return root.resolve("obj")
                .resolve(kind.dirName())
                .resolve(hex.substring(0, 2))
                .resolve(hex.substring(2));
    }

    @Override
    public String toString() {
        return kind.dirName() + ":" + hex;
    }
}

package com.libragraph.artifacts.util;

import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;
import org.apache.commons.codec.digest.DigestUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.util.Base64;

/**
 * Content digest helpers shared by the manifest, the cache and the storage handlers.
 *
 * <p>Manifests carry MD5 digests in standard base64; the cache layout and artifact
 * reference URIs use hex. Files are streamed through the digest in fixed-size chunks,
 * so hashing a file never buffers it whole.
 */
public final class HashUtil {

    /** Read chunk for file hashing. */
    static final int CHUNK_SIZE = 64 * 1024;

    private HashUtil() {
    }

    /**
     * Base64 MD5 of the given bytes.
     */
    public static String md5B64(byte[] data) {
        return Base64.getEncoder().encodeToString(DigestUtils.md5(data));
    }

    /**
     * Base64 MD5 of the UTF-8 encoding of {@code value}.
     */
    public static String md5String(String value) {
        return md5B64(value.getBytes(StandardCharsets.UTF_8));
    }

    static byte[] md5(InputStream in) throws IOException {
        MessageDigest digest = DigestUtils.getMd5Digest();
        byte[] chunk = new byte[CHUNK_SIZE];
        int read;
        while ((read = in.read(chunk)) != -1) {
            digest.update(chunk, 0, read);
        }
        return digest.digest();
    }

    /**
     * Base64 MD5 of a file's contents, the digest recorded for locally added files.
     */
    public static String md5FileB64(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return Base64.getEncoder().encodeToString(md5(in));
        }
    }

    /**
     * @throws IllegalArgumentException if {@code b64} is not valid base64
     */
    public static String b64ToHex(String b64) {
        return Hex.encodeHexString(Base64.getDecoder().decode(b64));
    }

    /**
     * @throws IllegalArgumentException if {@code hex} is not valid hex
     */
    public static String hexToB64(String hex) {
        try {
            return Base64.getEncoder().encodeToString(Hex.decodeHex(hex));
        } catch (DecoderException e) {
            throw new IllegalArgumentException("Invalid hex string: " + hex, e);
        }
    }

    /**
     * Cache key for remotely addressed content: SHA-256 hex of {@code url + etag}.
     * Neither component appears verbatim in the result.
     */
    public static String etagKey(String url, String etag) {
        return DigestUtils.sha256Hex(url + etag);
    }
}

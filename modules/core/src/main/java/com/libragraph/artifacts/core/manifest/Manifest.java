package com.libragraph.artifacts.core.manifest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.codec.binary.Hex;
import org.apache.commons.codec.digest.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * The path-keyed entries of one artifact version.
 *
 * <p>Entries are kept in sorted-path order so serialization and digesting are
 * deterministic. Single-writer: callers serialize concurrent mutation.
 */
public class Manifest {

    /** Wire format version written by {@link #toWireFormat()}. */
    public static final int VERSION = 1;

    private static final String DIGEST_HEADER = "artifact-manifest-v1\n";

    private final TreeMap<String, ManifestEntry> entries = new TreeMap<>();
    private final String storagePolicy;
    private final Map<String, Object> storagePolicyConfig;
    private boolean frozen;

    public Manifest(String storagePolicy, Map<String, Object> storagePolicyConfig) {
        this.storagePolicy = Objects.requireNonNull(storagePolicy, "storagePolicy cannot be null");
        this.storagePolicyConfig = storagePolicyConfig == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(storagePolicyConfig));
    }

    /**
     * Inserts an entry. Re-adding a path with the same digest replaces the entry.
     *
     * @throws ManifestConflictException if the path holds a different digest
     * @throws IllegalStateException if the manifest is frozen
     */
    public void addEntry(ManifestEntry entry) {
        if (frozen) {
            throw new IllegalStateException("Manifest is frozen, cannot add " + entry.path());
        }
        ManifestEntry existing = entries.get(entry.path());
        if (existing != null && !existing.digest().equals(entry.digest())) {
            throw new ManifestConflictException(entry.path(), existing.digest(), entry.digest());
        }
        entries.put(entry.path(), entry);
    }

    public Optional<ManifestEntry> getEntryByPath(String path) {
        return Optional.ofNullable(entries.get(ManifestEntry.normalizePath(path)));
    }

    /**
     * Entries below {@code directory}, i.e. whose path starts with {@code directory + "/"}.
     */
    public List<ManifestEntry> getEntriesInDirectory(String directory) {
        String prefix = ManifestEntry.normalizePath(directory);
        while (prefix.endsWith("/")) {
            prefix = prefix.substring(0, prefix.length() - 1);
        }
        if (prefix.isEmpty()) {
            return List.copyOf(entries.values());
        }
        String start = prefix + "/";
        List<ManifestEntry> result = new ArrayList<>();
        for (ManifestEntry entry : entries.tailMap(start, true).values()) {
            if (!entry.path().startsWith(start)) {
                break;
            }
            result.add(entry);
        }
        return result;
    }

    /**
     * Entries in sorted-path order.
     */
    public Collection<ManifestEntry> entries() {
        return Collections.unmodifiableCollection(entries.values());
    }

    public int size() {
        return entries.size();
    }

    /**
     * Sum of known entry sizes.
     */
    public long totalSize() {
        return entries.values().stream()
                .mapToLong(e -> e.size().orElse(0L))
                .sum();
    }

    public String storagePolicy() {
        return storagePolicy;
    }

    public Map<String, Object> storagePolicyConfig() {
        return storagePolicyConfig;
    }

    /**
     * Makes the manifest read-only.
     */
    public void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * Digest of the whole manifest: MD5 hex over a version header and one
     * {@code path:digest:size:ref} line per entry in sorted-path order.
     * Independent of insertion order; {@code extra} is excluded. Separator and newline
     * characters inside a field are percent-encoded so that no two entry sets share a line.
     */
    public String digest() {
        MessageDigest md5 = DigestUtils.getMd5Digest();
        md5.update(DIGEST_HEADER.getBytes(StandardCharsets.UTF_8));
        for (ManifestEntry entry : entries.values()) {
            String line = escape(entry.path())
                    + ":" + escape(entry.digest())
                    + ":" + entry.size().map(String::valueOf).orElse("")
                    + ":" + escape(entry.ref().orElse(""))
                    + "\n";
            md5.update(line.getBytes(StandardCharsets.UTF_8));
        }
        return Hex.encodeHexString(md5.digest());
    }

    private static String escape(String field) {
        if (field.indexOf('%') < 0 && field.indexOf(':') < 0 && field.indexOf('\n') < 0) {
            return field;
        }
        return field.replace("%", "%25").replace(":", "%3A").replace("\n", "%0A");
    }

    public ObjectNode toWireFormat() {
        return ManifestCodec.toJson(this);
    }

    /**
     * @throws ManifestFormatException if the document is malformed or of an unsupported version
     */
    public static Manifest fromWireFormat(JsonNode document) {
        return ManifestCodec.fromJson(document);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Manifest other)) return false;
        return entries.equals(other.entries)
                && storagePolicy.equals(other.storagePolicy)
                && storagePolicyConfig.equals(other.storagePolicyConfig);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entries, storagePolicy, storagePolicyConfig);
    }
}

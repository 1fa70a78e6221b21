package com.libragraph.artifacts.core.manifest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Reads and writes the versioned manifest document:
 * <pre>
 * {"version": 1, "storagePolicy": "...", "storagePolicyConfig": {...},
 *  "contents": {"path": {"digest": "...", "size": 5, "ref": "...", "extra": {...}, "birthArtifactID": "..."}}}
 * </pre>
 *
 * <p>Readers are registered per version; documents without a version, or with one
 * that has no reader, are rejected.
 */
public final class ManifestCodec {

    static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Map<Integer, Function<JsonNode, Manifest>> READERS =
            Map.of(1, ManifestCodec::readV1);

    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {};
    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {};

    private ManifestCodec() {
    }

    public static ObjectNode toJson(Manifest manifest) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("version", Manifest.VERSION);
        root.put("storagePolicy", manifest.storagePolicy());
        root.set("storagePolicyConfig", MAPPER.valueToTree(manifest.storagePolicyConfig()));

        ObjectNode contents = root.putObject("contents");
        for (ManifestEntry entry : manifest.entries()) {
            ObjectNode json = contents.putObject(entry.path());
            json.put("digest", entry.digest());
            entry.birthArtifactId().ifPresent(id -> json.put("birthArtifactID", id));
            entry.ref().ifPresent(ref -> json.put("ref", ref));
            if (!entry.extra().isEmpty()) {
                json.set("extra", MAPPER.valueToTree(entry.extra()));
            }
            entry.size().ifPresent(size -> json.put("size", size));
        }
        return root;
    }

    public static byte[] toBytes(Manifest manifest) {
        try {
            return MAPPER.writeValueAsBytes(toJson(manifest));
        } catch (JsonProcessingException e) {
            throw new ManifestFormatException("Failed to serialize manifest", e);
        }
    }

    public static Manifest fromJson(JsonNode document) {
        if (document == null || !document.isObject()) {
            throw new ManifestFormatException("Manifest document must be a JSON object");
        }
        JsonNode version = document.get("version");
        if (version == null || version.isNull()) {
            throw new ManifestFormatException("Manifest document has no version");
        }
        if (!version.isInt()) {
            throw new ManifestFormatException("Manifest version must be an integer, got: " + version);
        }
        Function<JsonNode, Manifest> reader = READERS.get(version.intValue());
        if (reader == null) {
            throw new ManifestFormatException("Unsupported manifest version: " + version.intValue());
        }
        return reader.apply(document);
    }

    public static Manifest fromBytes(byte[] bytes) {
        JsonNode document;
        try {
            document = MAPPER.readTree(bytes);
        } catch (IOException e) {
            throw new ManifestFormatException("Manifest is not valid JSON", e);
        }
        return fromJson(document);
    }

    private static Manifest readV1(JsonNode document) {
        JsonNode contents = document.get("contents");
        if (contents == null || !contents.isObject()) {
            throw new ManifestFormatException("Manifest v1 requires a 'contents' object");
        }

        String policy = document.path("storagePolicy").asText(ManifestDefaults.STORAGE_POLICY);
        Map<String, Object> policyConfig = document.hasNonNull("storagePolicyConfig")
                ? MAPPER.convertValue(document.get("storagePolicyConfig"), OBJECT_MAP)
                : Map.of();

        Manifest manifest = new Manifest(policy, policyConfig);
        Iterator<Map.Entry<String, JsonNode>> fields = contents.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            JsonNode digest = value.get("digest");
            if (digest == null || !digest.isTextual()) {
                throw new ManifestFormatException("Entry has no digest: " + field.getKey());
            }
            JsonNode size = value.get("size");
            if (size != null && !size.isNull() && !size.isIntegralNumber()) {
                throw new ManifestFormatException("Entry size is not an integer: " + field.getKey());
            }
            Map<String, String> extra = value.hasNonNull("extra")
                    ? MAPPER.convertValue(value.get("extra"), STRING_MAP)
                    : new LinkedHashMap<>();
            manifest.addEntry(new ManifestEntry(
                    field.getKey(),
                    digest.asText(),
                    size != null && !size.isNull() ? size.asLong() : null,
                    value.hasNonNull("ref") ? value.get("ref").asText() : null,
                    extra,
                    value.hasNonNull("birthArtifactID") ? value.get("birthArtifactID").asText() : null,
                    null));
        }
        return manifest;
    }
}

package com.libragraph.artifacts.core.artifact;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.artifacts.core.manifest.Manifest;
import com.libragraph.artifacts.core.manifest.ManifestConflictException;
import com.libragraph.artifacts.core.manifest.ManifestEntry;
import com.libragraph.artifacts.core.storage.DigestMismatchException;
import com.libragraph.artifacts.core.storage.ReferenceNotFoundException;
import com.libragraph.artifacts.core.storage.StorageException;
import com.libragraph.artifacts.core.storage.StoragePolicy;
import com.libragraph.artifacts.util.HashUtil;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Executor;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A named, typed bundle of files and references tracked as one versioned unit.
 *
 * <p>Lifecycle: {@link ArtifactState#PENDING} while entries are added, then
 * {@link ArtifactState#COMMITTED} once the backend has recorded the manifest and every
 * staged upload, then optionally {@link ArtifactState#DELETED}. The manifest is frozen
 * by {@link #finalizeArtifact()} or on commit.
 *
 * <p>Not thread-safe: one thread builds an artifact. Hashing and downloads fan out
 * internally on the supplied executor.
 */
public class Artifact {

    private static final Logger log = Logger.getLogger(Artifact.class);

    private static final Pattern NAME = Pattern.compile("^[a-zA-Z0-9_\\-.]+$");
    static final int MAX_METADATA_KEYS = 100;
    private static final int TMP_DIGEST_CHARS = 8;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String name;
    private final String type;
    private final Manifest manifest;
    private final StoragePolicy policy;
    private final Executor executor;
    private final Map<String, ManifestEntry> addedLocalPaths = new HashMap<>();
    private final List<String> aliases = new ArrayList<>();
    private Map<String, Object> metadata = Map.of();
    private String description;
    private ArtifactState state;
    private boolean finalized;
    private String id;
    private String version;

    public Artifact(String name, String type, StoragePolicy policy, Executor executor) {
        this(name, type, new Manifest(policy.name(), policy.config()), policy, executor, ArtifactState.PENDING);
    }

    private Artifact(String name, String type, Manifest manifest, StoragePolicy policy,
                     Executor executor, ArtifactState state) {
        if (name == null || !NAME.matcher(name).matches()) {
            throw new IllegalArgumentException(
                    "Artifact name may only contain alphanumeric characters, dashes, underscores and dots: " + name);
        }
        this.name = name;
        this.type = Objects.requireNonNull(type, "type cannot be null");
        this.manifest = manifest;
        this.policy = policy;
        this.executor = executor;
        this.state = state;
    }

    /**
     * An artifact the backend already holds, rebuilt from its manifest.
     */
    public static Artifact committed(String name, String type, String id, String version,
                                     Manifest manifest, StoragePolicy policy, Executor executor) {
        Artifact artifact = new Artifact(name, type, manifest, policy, executor, ArtifactState.COMMITTED);
        artifact.id = requireBase64Id(id);
        artifact.version = version;
        artifact.finalizeArtifact();
        return artifact;
    }

    // --- identity and descriptive fields ---

    public String name() {
        return name;
    }

    public String type() {
        return type;
    }

    public Optional<String> id() {
        return Optional.ofNullable(id);
    }

    public Optional<String> version() {
        return Optional.ofNullable(version);
    }

    public ArtifactState state() {
        return state;
    }

    public Manifest manifest() {
        return manifest;
    }

    /**
     * Digest of the manifest; stable once finalized.
     */
    public String digest() {
        return manifest.digest();
    }

    public Optional<String> description() {
        return Optional.ofNullable(description);
    }

    public void setDescription(String description) {
        ensureNotDeleted();
        this.description = description;
    }

    public Map<String, Object> metadata() {
        return metadata;
    }

    /**
     * @throws IllegalArgumentException if {@code metadata} has more than 100 keys
     */
    public void setMetadata(Map<String, Object> metadata) {
        ensureNotDeleted();
        if (metadata.size() > MAX_METADATA_KEYS) {
            throw new IllegalArgumentException("Artifact metadata may have at most " + MAX_METADATA_KEYS
                    + " keys, got " + metadata.size());
        }
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public List<String> aliases() {
        return Collections.unmodifiableList(aliases);
    }

    public void addAlias(String alias) {
        ensureNotDeleted();
        if (!aliases.contains(alias)) {
            aliases.add(alias);
        }
    }

    public boolean removeAlias(String alias) {
        ensureNotDeleted();
        return aliases.remove(alias);
    }

    // --- adding content ---

    /**
     * A new file inside the artifact; it is added under {@code name} when the stream closes.
     *
     * @throws IllegalArgumentException if the artifact already has an entry at {@code name}
     */
    public OutputStream newFile(String name) {
        ensureMutable();
        if (manifest.getEntryByPath(name).isPresent()) {
            throw new IllegalArgumentException("File with name " + name + " already exists in " + this.name);
        }
        Path staged = policy.newStagingFile(name);
        try {
            return new FilterOutputStream(Files.newOutputStream(staged)) {
                private boolean closed;

                @Override
                public void write(byte[] b, int off, int len) throws IOException {
                    out.write(b, off, len);
                }

                @Override
                public void close() throws IOException {
                    if (closed) {
                        return;
                    }
                    closed = true;
                    super.close();
                    addFile(staged, name, false, FilePolicy.IMMUTABLE);
                }
            };
        } catch (IOException e) {
            throw new StorageException("Failed to open staging file for " + name, e);
        }
    }

    public ArtifactEntry addFile(Path localPath) {
        return addFile(localPath, null, false, FilePolicy.MUTABLE);
    }

    public ArtifactEntry addFile(Path localPath, String name) {
        return addFile(localPath, name, false, FilePolicy.MUTABLE);
    }

    /**
     * Adds a local file, staged for upload.
     *
     * @param name entry path; defaults to the file name
     * @param isTmp replace the file stem with the start of the digest, for generated files
     * @throws ArtifactFinalizedException if the artifact is no longer pending
     */
    public ArtifactEntry addFile(Path localPath, String name, boolean isTmp, FilePolicy filePolicy) {
        ensureMutable();
        if (!Files.isRegularFile(localPath)) {
            throw new IllegalArgumentException("Path is not a file: " + localPath);
        }
        String entryName = name != null ? name : localPath.getFileName().toString();
        String digest;
        try {
            digest = HashUtil.md5FileB64(localPath);
        } catch (IOException e) {
            throw new StorageException("Failed to hash " + localPath, e);
        }
        if (isTmp) {
            entryName = tmpName(entryName, digest);
        }
        Path upload = filePolicy == FilePolicy.MUTABLE ? policy.stageCopy(localPath) : localPath;
        ManifestEntry entry = policy.storeFile(upload, entryName, digest);
        try {
            manifest.addEntry(entry);
        } catch (ManifestConflictException e) {
            discardStaged(List.of(Map.entry(localPath, entry)), e);
            throw e;
        }
        addedLocalPaths.put(key(localPath), entry);
        return new ArtifactEntry(this, entry);
    }

    public List<ArtifactEntry> addDir(Path localDir) {
        return addDir(localDir, null, FilePolicy.MUTABLE);
    }

    /**
     * Adds every file below {@code localDir}, under {@code name} when given. Files are
     * hashed in parallel; entries are inserted afterwards in path order.
     */
    public List<ArtifactEntry> addDir(Path localDir, String name, FilePolicy filePolicy) {
        ensureMutable();
        if (!Files.isDirectory(localDir)) {
            throw new IllegalArgumentException("Path is not a directory: " + localDir);
        }
        List<Path> files;
        try (Stream<Path> walk = Files.walk(localDir)) {
            files = walk.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            throw new StorageException("Failed to list " + localDir, e);
        }
        log.infof("Adding directory %s to artifact %s (%d files)", localDir, this.name, files.size());

        List<Map.Entry<Path, ManifestEntry>> hashed = Multi.createFrom().iterable(files)
                .onItem().transformToUniAndMerge(file -> Uni.createFrom()
                        .item(() -> {
                            String relative = ManifestEntry.normalizePath(localDir.relativize(file).toString());
                            String logical = name != null ? joinPath(name, relative) : relative;
                            Path upload = filePolicy == FilePolicy.MUTABLE ? policy.stageCopy(file) : file;
                            return Map.entry(file, policy.storeFile(upload, logical));
                        })
                        .runSubscriptionOn(executor))
                .collect().asList()
                .await().indefinitely();

        List<Map.Entry<Path, ManifestEntry>> sorted = new ArrayList<>(hashed);
        sorted.sort(Map.Entry.comparingByKey());
        List<ArtifactEntry> added = new ArrayList<>();
        for (int i = 0; i < sorted.size(); i++) {
            Map.Entry<Path, ManifestEntry> pair = sorted.get(i);
            try {
                manifest.addEntry(pair.getValue());
            } catch (ManifestConflictException e) {
                discardStaged(sorted.subList(i, sorted.size()), e);
                throw e;
            }
            addedLocalPaths.put(key(pair.getKey()), pair.getValue());
            added.add(new ArtifactEntry(this, pair.getValue()));
        }
        return added;
    }

    /**
     * Removes staging copies of entries that never made it into the manifest.
     * Entries pointing at the caller's own file are left alone.
     */
    private static void discardStaged(List<Map.Entry<Path, ManifestEntry>> rejected, Exception cause) {
        for (Map.Entry<Path, ManifestEntry> pair : rejected) {
            Optional<Path> staged = pair.getValue().localPath();
            if (staged.isEmpty() || staged.get().equals(pair.getKey())) {
                continue;
            }
            try {
                Files.deleteIfExists(staged.get());
            } catch (IOException e) {
                cause.addSuppressed(e);
            }
        }
    }

    public List<ArtifactEntry> addReference(String uri) {
        return addReference(uri, null, true, policy.defaultMaxObjects());
    }

    public List<ArtifactEntry> addReference(String uri, String name) {
        return addReference(uri, name, true, policy.defaultMaxObjects());
    }

    /**
     * Adds entries pointing at {@code uri} without uploading its bytes.
     *
     * @param checksum when false, remote content and metadata are not read
     * @throws com.libragraph.artifacts.core.storage.QuotaExceededException if the URI
     *         expands to more than {@code maxObjects} entries
     */
    public List<ArtifactEntry> addReference(String uri, String name, boolean checksum, int maxObjects) {
        ensureMutable();
        List<ArtifactEntry> added = new ArrayList<>();
        for (ManifestEntry entry : policy.storeReference(uri, name, checksum, maxObjects)) {
            manifest.addEntry(entry);
            added.add(new ArtifactEntry(this, entry));
        }
        return added;
    }

    /**
     * Stores {@code value} as JSON at {@code <name>.<suffix>.json}. Adding the same name
     * again returns the existing entry.
     */
    public ArtifactEntry add(ArtifactValue value, String name) {
        ensureMutable();
        String suffix = "." + value.typeSuffix() + ".json";
        String entryName = name.endsWith(suffix) ? name : name + suffix;
        Optional<ManifestEntry> existing = manifest.getEntryByPath(entryName);
        if (existing.isPresent()) {
            return new ArtifactEntry(this, existing.get());
        }
        JsonNode json = value.toJson(this);
        Path staged = policy.newStagingFile(entryName);
        try {
            MAPPER.writeValue(staged.toFile(), json);
        } catch (IOException e) {
            throw new StorageException("Failed to write " + entryName, e);
        }
        return addFile(staged, entryName, false, FilePolicy.IMMUTABLE);
    }

    /**
     * Entry path under which {@code localPath} was added, if it was.
     */
    public Optional<String> getAddedLocalPathName(Path localPath) {
        return Optional.ofNullable(addedLocalPaths.get(key(localPath))).map(ManifestEntry::path);
    }

    // --- reading content ---

    /**
     * @throws ReferenceNotFoundException if the artifact has no entry at {@code name}
     */
    public ArtifactEntry getPath(String name) {
        ManifestEntry entry = manifest.getEntryByPath(name).orElseThrow(() ->
                new ReferenceNotFoundException("Path not contained in artifact " + this.name + ": " + name));
        return new ArtifactEntry(this, entry);
    }

    /**
     * Materializes every entry under {@code root}, fetching in parallel.
     */
    public Path download(Path root) {
        ensureNotDeleted();
        List<Path> written = Multi.createFrom().iterable(new ArrayList<>(manifest.entries()))
                .onItem().transformToUniAndMerge(entry -> Uni.createFrom()
                        .item(() -> new ArtifactEntry(this, entry).download(root))
                        .runSubscriptionOn(executor))
                .collect().asList()
                .await().indefinitely();
        log.infof("Downloaded %d files of artifact %s into %s", written.size(), name, root);
        return root;
    }

    /**
     * Checks that {@code root} holds exactly this artifact's files with matching content.
     *
     * @throws DigestMismatchException if an uploaded file's content or a reference's size differs
     * @throws ReferenceNotFoundException if a file is missing
     * @throws StorageException if {@code root} holds a file that is not part of the artifact
     */
    public void verify(Path root) {
        Set<String> present = new TreeSet<>();
        try (Stream<Path> walk = Files.walk(root)) {
            walk.filter(Files::isRegularFile)
                    .forEach(file -> present.add(ManifestEntry.normalizePath(root.relativize(file).toString())));
        } catch (IOException e) {
            throw new StorageException("Failed to list " + root, e);
        }
        for (String path : present) {
            if (manifest.getEntryByPath(path).isEmpty()) {
                throw new StorageException("Found file " + path + " which is not a member of artifact " + name);
            }
        }
        for (ManifestEntry entry : manifest.entries()) {
            Path file = root.resolve(entry.path());
            if (!present.contains(entry.path())) {
                throw new ReferenceNotFoundException("Missing file " + entry.path() + " in " + root);
            }
            try {
                if (!entry.isReference()) {
                    String actual = HashUtil.md5FileB64(file);
                    if (!actual.equals(entry.digest())) {
                        throw new DigestMismatchException(file.toString(), entry.digest(), actual);
                    }
                } else if (entry.size().isPresent() && Files.size(file) != entry.size().get()) {
                    throw new DigestMismatchException(file.toString(),
                            entry.size().get() + " bytes", Files.size(file) + " bytes");
                }
            } catch (IOException e) {
                throw new StorageException("Failed to read " + file, e);
            }
        }
    }

    Path resolveLocal(ManifestEntry entry) {
        Optional<Path> staged = entry.localPath();
        if (staged.isPresent()) {
            return staged.get();
        }
        if (entry.isReference()) {
            return Path.of(policy.loadReference(entry, true));
        }
        String artifactId = id().orElseThrow(() ->
                new ArtifactNotLoggedException(name, "downloading " + entry.path(), state));
        return policy.loadFile(artifactId, entry);
    }

    // --- uploads and state ---

    /**
     * Entries whose staged bytes have not been uploaded yet.
     */
    public List<ManifestEntry> pendingUploads() {
        return manifest.entries().stream()
                .filter(entry -> entry.localPath().isPresent())
                .collect(Collectors.toList());
    }

    /**
     * Records that the transport layer uploaded {@code path}; its bytes are written
     * through to the cache and the staged path is released.
     */
    public void markUploaded(String path) {
        ManifestEntry entry = manifest.getEntryByPath(path).orElseThrow(() ->
                new ReferenceNotFoundException("Path not contained in artifact " + name + ": " + path));
        if (entry.localPath().isEmpty()) {
            return;
        }
        policy.cacheUploaded(entry);
        entry.clearLocalPath();
    }

    /**
     * Freezes the manifest. Idempotent.
     */
    public void finalizeArtifact() {
        if (!finalized) {
            manifest.freeze();
            finalized = true;
            log.debugf("Finalized artifact %s with digest %s", name, manifest.digest());
        }
    }

    public boolean isFinalized() {
        return finalized;
    }

    /**
     * Records that the backend has committed this artifact under {@code id}.
     *
     * @throws ArtifactStateException unless pending with every staged file uploaded
     */
    public void markCommitted(String id, String version) {
        if (state != ArtifactState.PENDING) {
            throw new ArtifactStateException("Artifact " + name + " cannot be committed", state);
        }
        int pending = pendingUploads().size();
        if (pending > 0) {
            throw new ArtifactStateException(
                    "Artifact " + name + " has " + pending + " files not yet uploaded", state);
        }
        this.id = requireBase64Id(id);
        this.version = version;
        finalizeArtifact();
        for (ManifestEntry entry : manifest.entries()) {
            if (!entry.isReference() && entry.birthArtifactId().isEmpty()) {
                entry.setBirthArtifactId(id);
            }
        }
        state = ArtifactState.COMMITTED;
        log.infof("Committed artifact %s:%s (%s)", name, version, id);
    }

    /**
     * @throws ArtifactStateException unless committed
     */
    public void delete() {
        if (state != ArtifactState.COMMITTED) {
            throw new ArtifactStateException("Only committed artifacts can be deleted: " + name, state);
        }
        state = ArtifactState.DELETED;
    }

    private void ensureMutable() {
        if (state != ArtifactState.PENDING || finalized) {
            throw new ArtifactFinalizedException(name, state);
        }
    }

    private void ensureNotDeleted() {
        if (state == ArtifactState.DELETED) {
            throw new ArtifactStateException("Artifact " + name + " is deleted", state);
        }
    }

    private static String requireBase64Id(String id) {
        Objects.requireNonNull(id, "id cannot be null");
        try {
            HashUtil.b64ToHex(id);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Artifact id must be base64: " + id, e);
        }
        return id;
    }

    static String tmpName(String name, String digest) {
        int slash = name.lastIndexOf('/');
        String dir = slash >= 0 ? name.substring(0, slash + 1) : "";
        String file = name.substring(slash + 1);
        int dot = file.indexOf('.');
        String rest = dot >= 0 ? file.substring(dot) : "";
        return dir + HashUtil.b64ToHex(digest).substring(0, TMP_DIGEST_CHARS) + rest;
    }

    private static String joinPath(String dir, String relative) {
        String trimmed = dir.endsWith("/") ? dir.substring(0, dir.length() - 1) : dir;
        return trimmed.isEmpty() ? relative : trimmed + "/" + relative;
    }

    private static String key(Path localPath) {
        return localPath.toAbsolutePath().normalize().toString();
    }

    @Override
    public String toString() {
        return "Artifact[" + name + (version != null ? ":" + version : "") + " " + state + "]";
    }
}

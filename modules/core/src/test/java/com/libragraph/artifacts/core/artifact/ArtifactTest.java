package com.libragraph.artifacts.core.artifact;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.libragraph.artifacts.core.cache.ObjectCache;
import com.libragraph.artifacts.core.manifest.Manifest;
import com.libragraph.artifacts.core.manifest.ManifestConflictException;
import com.libragraph.artifacts.core.manifest.ManifestEntry;
import com.libragraph.artifacts.core.storage.ArtifactFileSource;
import com.libragraph.artifacts.core.storage.DigestMismatchException;
import com.libragraph.artifacts.core.storage.ReferenceNotFoundException;
import com.libragraph.artifacts.core.storage.StorageException;
import com.libragraph.artifacts.core.storage.StorageHandlerRegistry;
import com.libragraph.artifacts.core.storage.StoragePolicy;
import com.libragraph.artifacts.core.storage.handlers.ArtifactReferenceHandler;
import com.libragraph.artifacts.core.storage.handlers.LocalFileHandler;
import com.libragraph.artifacts.core.storage.handlers.TrackingHandler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

class ArtifactTest {

    private static final String HELLO_MD5 = "XUFAKrxLKna5cZ2REBfFkg==";
    private static final String FIRST_ID = "QXJ0aWZhY3Q6MQ==";
    private static final String FIRST_HEX = "41727469666163743a31";
    private static final String SECOND_ID = "QXJ0aWZhY3Q6Mg==";
    private static final String SECOND_HEX = "41727469666163743a32";

    @TempDir
    Path tempDir;

    private ExecutorService executor;
    private ArtifactIndex index;
    private StorageHandlerRegistry registry;
    private StoragePolicy policy;
    private final Map<String, byte[]> backend = new HashMap<>();

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        index = new ArtifactIndex();
        LocalFileHandler local = new LocalFileHandler(new ObjectCache(tempDir.resolve("cache")));
        registry = new StorageHandlerRegistry(
                List.of(local, new ArtifactReferenceHandler(index)), new TrackingHandler());
        policy = policyWithCache(tempDir.resolve("cache"));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private StoragePolicy policyWithCache(Path cacheDir) {
        ArtifactFileSource source = (artifactId, entry) -> {
            byte[] content = backend.get(artifactId + "/" + entry.path());
            if (content == null) {
                throw new ReferenceNotFoundException("No uploaded file " + entry.path());
            }
            return new ByteArrayInputStream(content);
        };
        return new StoragePolicy(new ObjectCache(cacheDir), registry, source, tempDir.resolve("staging"), 100);
    }

    private Artifact newArtifact(String name) {
        return new Artifact(name, "dataset", policy, executor);
    }

    private Path write(String relative, String content) throws IOException {
        Path file = tempDir.resolve("src").resolve(relative);
        Files.createDirectories(file.getParent());
        return Files.writeString(file, content);
    }

    /**
     * Uploads every staged file to the in-memory backend and commits.
     */
    private void commit(Artifact artifact, String id) throws IOException {
        for (ManifestEntry entry : artifact.pendingUploads()) {
            backend.put(id + "/" + entry.path(), Files.readAllBytes(entry.localPath().orElseThrow()));
            artifact.markUploaded(entry.path());
        }
        artifact.markCommitted(id, "v0");
        index.register(artifact);
    }

    @Test
    void shouldRejectInvalidName() {
        assertThatThrownBy(() -> newArtifact("bad name!")).isInstanceOf(IllegalArgumentException.class);
        assertThat(newArtifact("model-v1.2_final").name()).isEqualTo("model-v1.2_final");
    }

    @Test
    void shouldLimitMetadataKeys() {
        Artifact artifact = newArtifact("data");
        Map<String, Object> metadata = new HashMap<>();
        for (int i = 0; i <= Artifact.MAX_METADATA_KEYS; i++) {
            metadata.put("k" + i, i);
        }

        assertThatThrownBy(() -> artifact.setMetadata(metadata)).isInstanceOf(IllegalArgumentException.class);
        metadata.remove("k0");
        artifact.setMetadata(metadata);
        assertThat(artifact.metadata()).hasSize(Artifact.MAX_METADATA_KEYS);
    }

    @Test
    void shouldComputeManifestDigest() throws IOException {
        Artifact artifact = newArtifact("data");

        artifact.addFile(write("hello.txt", "hello"), "file1.txt");

        assertThat(artifact.digest()).isEqualTo("89220fa8ac42472dac89f6c6d5c9c297");
        assertThat(artifact.manifest().storagePolicy()).isEqualTo("wandb-storage-policy-v1");
    }

    @Test
    void shouldStageCopyOfMutableFile() throws IOException {
        Artifact artifact = newArtifact("data");
        Path original = write("hello.txt", "hello");

        ArtifactEntry entry = artifact.addFile(original);
        Files.writeString(original, "changed");

        Path staged = entry.entry().localPath().orElseThrow();
        assertThat(staged).isNotEqualTo(original);
        assertThat(Files.readString(staged)).isEqualTo("hello");
        assertThat(entry.digest()).isEqualTo(HELLO_MD5);
        assertThat(artifact.getAddedLocalPathName(original)).contains("hello.txt");
        assertThat(artifact.getAddedLocalPathName(tempDir.resolve("other.txt"))).isEmpty();
    }

    @Test
    void shouldKeepImmutableFileInPlace() throws IOException {
        Artifact artifact = newArtifact("data");
        Path original = write("hello.txt", "hello");

        ArtifactEntry entry = artifact.addFile(original, "h.txt", false, FilePolicy.IMMUTABLE);

        assertThat(entry.entry().localPath()).contains(original);
    }

    @Test
    void shouldNameTemporaryFilesByDigest() throws IOException {
        Artifact artifact = newArtifact("data");

        ArtifactEntry entry = artifact.addFile(write("x.txt", "hello"), "media/generated.txt", true,
                FilePolicy.MUTABLE);

        assertThat(entry.path()).isEqualTo("media/5d41402a.txt");
        assertThat(Artifact.tmpName("plot.table.json", HELLO_MD5)).isEqualTo("5d41402a.table.json");
    }

    @Test
    void shouldAddDirectoryInPathOrder() throws IOException {
        write("dir/b.txt", "b");
        write("dir/a.txt", "a");
        write("dir/sub/c.txt", "c");
        Artifact artifact = newArtifact("data");

        List<ArtifactEntry> added = artifact.addDir(tempDir.resolve("src/dir"), "d", FilePolicy.MUTABLE);

        assertThat(added).extracting(ArtifactEntry::path).containsExactly("d/a.txt", "d/b.txt", "d/sub/c.txt");
        assertThat(artifact.manifest().size()).isEqualTo(3);
        assertThat(artifact.getAddedLocalPathName(tempDir.resolve("src/dir/sub/c.txt"))).contains("d/sub/c.txt");
    }

    @Test
    void shouldDropStagedCopyOnConflictingFile() throws IOException {
        Artifact artifact = newArtifact("data");
        artifact.addFile(write("one.txt", "hello"), "file1.txt");
        Path staging = tempDir.resolve("staging");
        List<Path> before = listFiles(staging);

        assertThatThrownBy(() -> artifact.addFile(write("two.txt", "other"), "file1.txt"))
                .isInstanceOf(ManifestConflictException.class);

        assertThat(listFiles(staging)).containsExactlyInAnyOrderElementsOf(before);
        assertThat(artifact.getPath("file1.txt").digest()).isEqualTo(HELLO_MD5);
    }

    @Test
    void shouldDropStagedCopiesOnConflictingDirectory() throws IOException {
        Artifact artifact = newArtifact("data");
        artifact.addFile(write("one.txt", "hello"), "d/b.txt");
        write("dir/a.txt", "a");
        write("dir/b.txt", "b");
        write("dir/c.txt", "c");
        Path staging = tempDir.resolve("staging");
        List<Path> before = listFiles(staging);

        assertThatThrownBy(() -> artifact.addDir(tempDir.resolve("src/dir"), "d", FilePolicy.MUTABLE))
                .isInstanceOf(ManifestConflictException.class);

        assertThat(artifact.manifest().getEntryByPath("d/a.txt")).isPresent();
        assertThat(artifact.manifest().getEntryByPath("d/c.txt")).isEmpty();
        List<Path> after = listFiles(staging);
        assertThat(after).hasSize(before.size() + 1);
        assertThat(after).containsAll(before)
                .contains(artifact.manifest().getEntryByPath("d/a.txt").get().localPath().get());
    }

    private static List<Path> listFiles(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files.collect(Collectors.toList());
        }
    }

    @Test
    void shouldAddFileWrittenThroughStream() throws IOException {
        Artifact artifact = newArtifact("data");

        try (OutputStream out = artifact.newFile("notes/new.txt")) {
            out.write("hello".getBytes(StandardCharsets.UTF_8));
        }

        assertThat(artifact.getPath("notes/new.txt").digest()).isEqualTo(HELLO_MD5);
        assertThatThrownBy(() -> artifact.newFile("notes/new.txt")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldStoreValueAsJson() {
        Artifact artifact = newArtifact("data");
        ArtifactValue value = new ArtifactValue() {
            @Override
            public String typeSuffix() {
                return "table";
            }

            @Override
            public JsonNode toJson(Artifact target) {
                return JsonNodeFactory.instance.objectNode().put("a", 1);
            }
        };

        ArtifactEntry entry = artifact.add(value, "results");

        assertThat(entry.path()).isEqualTo("results.table.json");
        assertThat(entry.digest()).isEqualTo("u2y1xo30ZSlByvZSo2by2A==");
        assertThat(artifact.add(value, "results.table.json").digest()).isEqualTo(entry.digest());
        assertThat(artifact.manifest().size()).isEqualTo(1);
    }

    @Test
    void shouldRefuseAddsOnceFinalized() throws IOException {
        Artifact artifact = newArtifact("data");
        Path file = write("hello.txt", "hello");
        artifact.finalizeArtifact();

        assertThat(artifact.isFinalized()).isTrue();
        assertThat(artifact.manifest().isFrozen()).isTrue();
        assertThatThrownBy(() -> artifact.addFile(file)).isInstanceOf(ArtifactFinalizedException.class);
        assertThatThrownBy(() -> artifact.addReference("file://" + file))
                .isInstanceOf(ArtifactFinalizedException.class);
    }

    @Test
    void shouldRequireUploadsBeforeCommit() throws IOException {
        Artifact artifact = newArtifact("data");
        artifact.addFile(write("hello.txt", "hello"), "file1.txt");

        assertThatThrownBy(() -> artifact.markCommitted(FIRST_ID, "v0")).isInstanceOf(ArtifactStateException.class);
        assertThat(artifact.state()).isEqualTo(ArtifactState.PENDING);

        commit(artifact, FIRST_ID);

        assertThat(artifact.state()).isEqualTo(ArtifactState.COMMITTED);
        assertThat(artifact.id()).contains(FIRST_ID);
        assertThat(artifact.pendingUploads()).isEmpty();
        assertThat(artifact.getPath("file1.txt").entry().birthArtifactId()).contains(FIRST_ID);
        assertThat(policy.cache().checkMd5ObjPath(HELLO_MD5, 5).exists()).isTrue();
    }

    @Test
    void shouldRejectNonBase64Id() {
        Artifact artifact = newArtifact("data");

        assertThatThrownBy(() -> artifact.markCommitted("not base64!", "v0"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldOnlyDeleteCommittedArtifacts() throws IOException {
        Artifact artifact = newArtifact("data");

        assertThatThrownBy(artifact::delete).isInstanceOf(ArtifactStateException.class);

        commit(artifact, FIRST_ID);
        artifact.delete();

        assertThat(artifact.state()).isEqualTo(ArtifactState.DELETED);
        assertThatThrownBy(() -> artifact.setDescription("gone")).isInstanceOf(ArtifactStateException.class);
        assertThatThrownBy(() -> artifact.download(tempDir.resolve("out")))
                .isInstanceOf(ArtifactStateException.class);
    }

    @Test
    void shouldResolveRefTargets() throws IOException {
        Artifact artifact = newArtifact("data");
        ArtifactEntry entry = artifact.addFile(write("hello.txt", "hello"), "file1.txt");

        assertThatThrownBy(entry::refTarget).isInstanceOf(ArtifactNotLoggedException.class);

        commit(artifact, FIRST_ID);

        assertThat(entry.refTarget()).isEqualTo("wandb-artifact://" + FIRST_HEX + "/file1.txt");
        assertThatThrownBy(() -> artifact.getPath("absent.txt")).isInstanceOf(ReferenceNotFoundException.class);
    }

    @Test
    void shouldDownloadAndVerify() throws IOException {
        Artifact artifact = newArtifact("data");
        artifact.addFile(write("hello.txt", "hello"), "file1.txt");
        write("dir/a.txt", "a");
        artifact.addDir(tempDir.resolve("src/dir"), "d", FilePolicy.MUTABLE);
        commit(artifact, FIRST_ID);
        Path root = tempDir.resolve("out");

        artifact.download(root);

        assertThat(Files.readString(root.resolve("file1.txt"))).isEqualTo("hello");
        assertThat(Files.readString(root.resolve("d/a.txt"))).isEqualTo("a");
        artifact.verify(root);

        Files.writeString(root.resolve("file1.txt"), "jello");
        assertThatThrownBy(() -> artifact.verify(root)).isInstanceOf(DigestMismatchException.class);

        Files.writeString(root.resolve("file1.txt"), "hello");
        Files.writeString(root.resolve("stray.txt"), "x");
        assertThatThrownBy(() -> artifact.verify(root))
                .isInstanceOf(StorageException.class)
                .hasMessageContaining("not a member");

        Files.delete(root.resolve("stray.txt"));
        Files.delete(root.resolve("d/a.txt"));
        assertThatThrownBy(() -> artifact.verify(root)).isInstanceOf(ReferenceNotFoundException.class);
    }

    @Test
    void shouldFetchUploadedFilesOnFreshCache() throws IOException {
        Artifact original = newArtifact("data");
        original.addFile(write("hello.txt", "hello"), "file1.txt");
        commit(original, FIRST_ID);
        Manifest manifest = Manifest.fromWireFormat(original.manifest().toWireFormat());

        StoragePolicy fresh = policyWithCache(tempDir.resolve("fresh-cache"));
        Artifact loaded = Artifact.committed("data", "dataset", FIRST_ID, "v0", manifest, fresh, executor);
        Path path = loaded.getPath("file1.txt").download();

        assertThat(path.startsWith(tempDir.resolve("fresh-cache"))).isTrue();
        assertThat(Files.readString(path)).isEqualTo("hello");
        assertThat(loaded.isFinalized()).isTrue();
        assertThat(loaded.digest()).isEqualTo(original.digest());
    }

    @Test
    void shouldFollowArtifactReferenceChains() throws IOException {
        Artifact first = newArtifact("first");
        first.addFile(write("hello.txt", "hello"), "file1.txt");
        commit(first, FIRST_ID);

        Artifact second = newArtifact("second");
        ArtifactEntry viaFirst = second.addReference("wandb-artifact://" + FIRST_HEX + "/file1.txt").get(0);
        commit(second, SECOND_ID);

        Artifact third = newArtifact("third");
        ArtifactEntry viaSecond = third.addReference("wandb-artifact://" + SECOND_HEX + "/file1.txt", "copy.txt")
                .get(0);

        assertThat(viaFirst.path()).isEqualTo("file1.txt");
        assertThat(viaFirst.digest()).isEqualTo(HELLO_MD5);
        assertThat(viaFirst.size()).contains(5L);
        assertThat(viaSecond.ref()).contains("wandb-artifact://" + FIRST_HEX + "/file1.txt");
        assertThat(viaSecond.digest()).isEqualTo(HELLO_MD5);
        assertThat(Files.readString(viaSecond.download())).isEqualTo("hello");
        assertThat(viaSecond.refTarget()).isEqualTo("wandb-artifact://" + FIRST_HEX + "/file1.txt");
    }

    @Test
    void shouldFailForUnknownReferencedArtifact() {
        Artifact artifact = newArtifact("data");

        assertThatThrownBy(() -> artifact.addReference("wandb-artifact://" + SECOND_HEX + "/x.txt"))
                .isInstanceOf(ReferenceNotFoundException.class);
    }

    @Test
    void shouldTrackUnknownSchemesByName() {
        Artifact artifact = newArtifact("data");

        ArtifactEntry entry = artifact.addReference("ftp://host/x.bin", "x.bin").get(0);

        assertThat(entry.digest()).isEqualTo("ftp://host/x.bin");
        assertThat(entry.refTarget()).isEqualTo("ftp://host/x.bin");
    }
}

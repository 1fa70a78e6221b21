package com.libragraph.artifacts.app;

import com.libragraph.artifacts.core.cache.ObjectCache;
import com.libragraph.artifacts.core.manifest.ManifestEntry;
import com.libragraph.artifacts.core.storage.DigestMismatchException;
import com.libragraph.artifacts.core.storage.QuotaExceededException;
import com.libragraph.artifacts.core.storage.ReferenceNotFoundException;
import com.libragraph.artifacts.core.storage.bucket.BucketObject;
import com.libragraph.artifacts.core.storage.bucket.MinioBucketClient;
import com.libragraph.artifacts.core.storage.handlers.S3Handler;
import io.minio.BucketExistsArgs;
import io.minio.MakeBucketArgs;
import io.minio.MinioClient;
import io.minio.ObjectWriteResponse;
import io.minio.PutObjectArgs;
import io.minio.SetBucketVersioningArgs;
import io.minio.messages.VersioningConfiguration;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.testcontainers.containers.MinIOContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

/**
 * S3 references against a real MinIO server.
 */
@Testcontainers(disabledWithoutDocker = true)
class MinioBucketClientTest {

    static {
        // Ryuk has connectivity issues on WSL2; container cleanup handled by stop()
        System.setProperty("testcontainers.ryuk.disabled", "true");
    }

    private static final String BUCKET = "refs";
    private static final String VERSIONED = "versioned";

    @Container
    static final MinIOContainer MINIO = new MinIOContainer("minio/minio:RELEASE.2024-11-07T00-52-20Z");

    private static MinioClient minioClient;

    @TempDir
    Path tempDir;

    private MinioBucketClient client;
    private S3Handler handler;

    @BeforeAll
    static void createBuckets() throws Exception {
        minioClient = MinioClient.builder()
                .endpoint(MINIO.getS3URL())
                .region("us-east-1")
                .credentials(MINIO.getUserName(), MINIO.getPassword())
                .build();
        for (String bucket : List.of(BUCKET, VERSIONED)) {
            if (!minioClient.bucketExists(BucketExistsArgs.builder().bucket(bucket).build())) {
                minioClient.makeBucket(MakeBucketArgs.builder().bucket(bucket).build());
            }
        }
        minioClient.setBucketVersioning(SetBucketVersioningArgs.builder()
                .bucket(VERSIONED)
                .config(new VersioningConfiguration(VersioningConfiguration.Status.ENABLED, null))
                .build());
    }

    @BeforeEach
    void setUp() {
        client = new MinioBucketClient(minioClient);
        handler = new S3Handler(client, new ObjectCache(tempDir.resolve("cache")));
    }

    private static ObjectWriteResponse put(String bucket, String key, String content) throws Exception {
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        return minioClient.putObject(PutObjectArgs.builder()
                .bucket(bucket)
                .object(key)
                .stream(new ByteArrayInputStream(bytes), bytes.length, -1)
                .build());
    }

    @Test
    void statReportsEtagAndSize() throws Exception {
        String key = UUID.randomUUID() + "/a.txt";
        put(BUCKET, key, "hello");

        BucketObject object = client.stat(BUCKET, key, null).orElseThrow();

        assertThat(object.size()).isEqualTo(5);
        assertThat(object.etag()).isEqualTo("5d41402abc4b2a76b9719d911017c592");
        assertThat(client.stat(BUCKET, key + ".missing", null)).isEmpty();
        assertThat(client.versioningEnabled(BUCKET)).isFalse();
        assertThat(client.versioningEnabled(VERSIONED)).isTrue();
    }

    @Test
    void listWalksPrefixRecursively() throws Exception {
        String prefix = UUID.randomUUID() + "/";
        put(BUCKET, prefix + "1.txt", "one");
        put(BUCKET, prefix + "deeper/2.txt", "two");

        List<String> keys;
        try (Stream<BucketObject> objects = client.list(BUCKET, prefix)) {
            keys = objects.map(BucketObject::key).collect(Collectors.toList());
        }

        assertThat(keys).containsExactlyInAnyOrder(prefix + "1.txt", prefix + "deeper/2.txt");
    }

    @Test
    void openReadsContent() throws Exception {
        String key = UUID.randomUUID() + "/a.txt";
        put(BUCKET, key, "hello");
        BucketObject object = client.stat(BUCKET, key, null).orElseThrow();

        try (InputStream in = client.open(object)) {
            assertThat(new String(in.readAllBytes(), StandardCharsets.UTF_8)).isEqualTo("hello");
        }
        assertThatThrownBy(() -> client.open(new BucketObject(BUCKET, key + ".gone", 1, null, null, null, null)))
                .isInstanceOf(ReferenceNotFoundException.class);
    }

    @Test
    void referencedObjectIsDownloadedThroughCache() throws Exception {
        String key = UUID.randomUUID() + "/a.txt";
        put(BUCKET, key, "hello");

        ManifestEntry entry = handler.storePath("s3://" + BUCKET + "/" + key, null, true, 10).get(0);
        Path local = Path.of(handler.loadPath(entry, true));

        assertThat(entry.path()).isEqualTo("a.txt");
        assertThat(entry.size()).contains(5L);
        assertThat(Files.readString(local)).isEqualTo("hello");
        assertThat(local.startsWith(tempDir.resolve("cache"))).isTrue();
    }

    @Test
    void prefixExpansionHonoursQuota() throws Exception {
        String prefix = UUID.randomUUID().toString();
        put(BUCKET, prefix + "/x/1.txt", "one");
        put(BUCKET, prefix + "/x/2.txt", "two");
        put(BUCKET, prefix + "/x/deeper/3.txt", "three");

        List<ManifestEntry> entries = handler.storePath("s3://" + BUCKET + "/" + prefix + "/x", "x", true, 10);

        assertThat(entries).extracting(ManifestEntry::path)
                .containsExactlyInAnyOrder("x/1.txt", "x/2.txt", "x/deeper/3.txt");
        assertThatThrownBy(() -> handler.storePath("s3://" + BUCKET + "/" + prefix + "/x", null, true, 2))
                .isInstanceOf(QuotaExceededException.class);
    }

    @Test
    void recordedVersionSurvivesOverwrite() throws Exception {
        String key = UUID.randomUUID() + "/model.bin";
        put(VERSIONED, key, "first");
        ManifestEntry entry = handler.storePath("s3://" + VERSIONED + "/" + key, null, true, 10).get(0);
        put(VERSIONED, key, "second");

        assertThat(entry.extra()).containsKey("versionID");
        assertThat(client.listVersions(VERSIONED, key)).hasSize(2);
        assertThat(Files.readString(Path.of(handler.loadPath(entry, true)))).isEqualTo("first");
    }

    @Test
    void changedObjectIsRejectedWithoutVersioning() throws Exception {
        String key = UUID.randomUUID() + "/a.txt";
        put(BUCKET, key, "hello");
        ManifestEntry entry = handler.storePath("s3://" + BUCKET + "/" + key, null, true, 10).get(0);
        put(BUCKET, key, "jello");

        assertThatThrownBy(() -> handler.loadPath(entry, true)).isInstanceOf(DigestMismatchException.class);
    }

    @Test
    void missingPrefixIsReported() {
        assertThatThrownBy(() -> handler.storePath("s3://" + BUCKET + "/" + UUID.randomUUID(), null, true, 10))
                .isInstanceOf(ReferenceNotFoundException.class);
    }
}

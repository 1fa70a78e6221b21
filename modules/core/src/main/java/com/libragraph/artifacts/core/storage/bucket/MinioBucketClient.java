package com.libragraph.artifacts.core.storage.bucket;

import com.libragraph.artifacts.core.storage.ReferenceNotFoundException;
import com.libragraph.artifacts.core.storage.StorageException;
import io.minio.GetBucketVersioningArgs;
import io.minio.GetObjectArgs;
import io.minio.ListObjectsArgs;
import io.minio.MinioClient;
import io.minio.Result;
import io.minio.StatObjectArgs;
import io.minio.StatObjectResponse;
import io.minio.errors.ErrorResponseException;
import io.minio.messages.Item;
import io.minio.messages.VersioningConfiguration;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * {@link BucketClient} for S3 and S3-compatible services through the MinIO client.
 */
public class MinioBucketClient implements BucketClient {

    private static final Set<String> MISSING_CODES = Set.of("NoSuchKey", "NoSuchVersion", "NoSuchBucket");

    private final MinioClient minioClient;

    public MinioBucketClient(MinioClient minioClient) {
        this.minioClient = minioClient;
    }

    @Override
    public Optional<BucketObject> stat(String bucket, String key, String versionId) {
        if (key.isEmpty()) {
            return Optional.empty();
        }
        try {
            StatObjectResponse stat = minioClient.statObject(StatObjectArgs.builder()
                    .bucket(bucket).object(key).versionId(versionId).build());
            return Optional.of(new BucketObject(bucket, key, stat.size(),
                    BucketObject.stripQuotes(stat.etag()), versionOrNull(stat.versionId()), null, stat.contentType()));
        } catch (ErrorResponseException e) {
            if (MISSING_CODES.contains(e.errorResponse().code())) {
                return Optional.empty();
            }
            throw new StorageException("Failed to stat s3://" + bucket + "/" + key, e);
        } catch (Exception e) {
            throw new StorageException("Failed to stat s3://" + bucket + "/" + key, e);
        }
    }

    @Override
    public Stream<BucketObject> list(String bucket, String prefix) {
        Iterable<Result<Item>> results = minioClient.listObjects(ListObjectsArgs.builder()
                .bucket(bucket).prefix(prefix).recursive(true).build());
        return StreamSupport.stream(results.spliterator(), false)
                .map(result -> item(bucket, result))
                .filter(item -> !item.isDir())
                .map(item -> toObject(bucket, item));
    }

    @Override
    public List<BucketObject> listVersions(String bucket, String key) {
        List<BucketObject> versions = new ArrayList<>();
        for (Result<Item> result : minioClient.listObjects(ListObjectsArgs.builder()
                .bucket(bucket).prefix(key).recursive(true).includeVersions(true).build())) {
            Item item = item(bucket, result);
            if (item.objectName().equals(key) && !item.isDeleteMarker()) {
                versions.add(toObject(bucket, item));
            }
        }
        return versions;
    }

    @Override
    public boolean versioningEnabled(String bucket) {
        try {
            VersioningConfiguration config = minioClient.getBucketVersioning(
                    GetBucketVersioningArgs.builder().bucket(bucket).build());
            return config.status() == VersioningConfiguration.Status.ENABLED;
        } catch (Exception e) {
            throw new StorageException("Failed to read versioning state of bucket " + bucket, e);
        }
    }

    @Override
    public InputStream open(BucketObject object) {
        String location = "s3://" + object.bucket() + "/" + object.key();
        try {
            return minioClient.getObject(GetObjectArgs.builder()
                    .bucket(object.bucket()).object(object.key()).versionId(object.versionId()).build());
        } catch (ErrorResponseException e) {
            if (MISSING_CODES.contains(e.errorResponse().code())) {
                throw new ReferenceNotFoundException("Object not found: " + location, e);
            }
            throw new StorageException("Failed to read " + location, e);
        } catch (Exception e) {
            throw new StorageException("Failed to read " + location, e);
        }
    }

    private static Item item(String bucket, Result<Item> result) {
        try {
            return result.get();
        } catch (ErrorResponseException e) {
            if ("NoSuchBucket".equals(e.errorResponse().code())) {
                throw new ReferenceNotFoundException("Bucket not found: " + bucket, e);
            }
            throw new StorageException("Failed to list bucket " + bucket, e);
        } catch (Exception e) {
            throw new StorageException("Failed to list bucket " + bucket, e);
        }
    }

    private static BucketObject toObject(String bucket, Item item) {
        return new BucketObject(bucket, item.objectName(), item.size(),
                BucketObject.stripQuotes(item.etag()), versionOrNull(item.versionId()), null, null);
    }

    // unversioned objects report the literal version id "null"
    private static String versionOrNull(String versionId) {
        return "null".equals(versionId) ? null : versionId;
    }
}

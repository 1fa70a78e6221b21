package com.libragraph.artifacts.core.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.artifacts.core.storage.bucket.BucketClient;
import com.libragraph.artifacts.core.storage.bucket.GcsJsonBucketClient;
import com.libragraph.artifacts.core.storage.bucket.MinioBucketClient;
import io.minio.MinioClient;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Optional;

/**
 * Network clients used by the storage handlers.
 */
@ApplicationScoped
public class ClientProducer {

    @ConfigProperty(name = "artifacts.http.connect-timeout", defaultValue = "PT30S")
    Duration connectTimeout;

    @ConfigProperty(name = "artifacts.gcs.endpoint", defaultValue = "https://storage.googleapis.com")
    String gcsEndpoint;

    @ConfigProperty(name = "artifacts.gcs.access-token")
    Optional<String> gcsAccessToken;

    @Produces
    @Singleton
    public HttpClient httpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Produces
    @Singleton
    @Named("s3")
    public BucketClient s3BucketClient(MinioClient minioClient) {
        return new MinioBucketClient(minioClient);
    }

    @Produces
    @Singleton
    @Named("gcs")
    public BucketClient gcsBucketClient(HttpClient httpClient, ObjectMapper objectMapper) {
        return new GcsJsonBucketClient(httpClient, objectMapper, gcsEndpoint, gcsAccessToken.orElse(null));
    }
}

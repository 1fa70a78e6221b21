package com.libragraph.artifacts.core.storage;

import io.minio.MinioClient;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.Optional;

@ApplicationScoped
public class MinioClientProducer {

    @ConfigProperty(name = "artifacts.s3.endpoint", defaultValue = "https://s3.amazonaws.com")
    String endpoint;

    @ConfigProperty(name = "artifacts.s3.region")
    Optional<String> region;

    @ConfigProperty(name = "artifacts.s3.access-key")
    Optional<String> accessKey;

    @ConfigProperty(name = "artifacts.s3.secret-key")
    Optional<String> secretKey;

    @Produces
    @Singleton
    public MinioClient minioClient() {
        MinioClient.Builder builder = MinioClient.builder().endpoint(endpoint);
        region.ifPresent(builder::region);
        if (accessKey.isPresent() && secretKey.isPresent()) {
            builder.credentials(accessKey.get(), secretKey.get());
        }
        return builder.build();
    }
}

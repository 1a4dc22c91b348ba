package com.scholary.transcriber.objectstore;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for object storage.
 *
 * <p>{@code type} selects the backend: {@code local} stores blobs under {@code localRoot},
 * {@code s3} talks to S3 or MinIO using the remaining fields.
 */
@ConfigurationProperties(prefix = "objectstore")
@Validated
public record ObjectStoreProperties(
    @NotBlank String type,
    String localRoot,
    String endpoint,
    String accessKey,
    String secretKey,
    String bucket,
    String region,
    boolean pathStyleAccess) {}

package com.scholary.transcriber.objectstore;

import java.io.InputStream;
import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * S3/MinIO implementation of ObjectStoreClient.
 *
 * <p>This uses AWS SDK v2, which works with both real S3 and S3-compatible services like MinIO. The
 * key difference is the endpoint and path-style access configuration.
 *
 * <p>The SDK retries transient failures (network issues, 500 errors, throttling) itself. For
 * non-retryable errors (404, 403) we fail fast. A single PUT is atomic in S3, which gives the
 * all-or-nothing write the interface promises.
 */
public class S3ObjectStoreClient implements ObjectStoreClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(S3ObjectStoreClient.class);

  private final S3Client s3Client;
  private final String bucket;

  public S3ObjectStoreClient(ObjectStoreProperties properties) {
    LOGGER.info(
        "Initializing S3 client: endpoint={}, bucket={}, pathStyleAccess={}",
        properties.endpoint(),
        properties.bucket(),
        properties.pathStyleAccess());

    if (properties.bucket() == null || properties.bucket().isBlank()) {
      throw new ObjectStoreException("objectstore.bucket must be set for the s3 backend");
    }
    this.bucket = properties.bucket();

    AwsBasicCredentials credentials =
        AwsBasicCredentials.create(properties.accessKey(), properties.secretKey());
    StaticCredentialsProvider credentialsProvider = StaticCredentialsProvider.create(credentials);

    Region region =
        properties.region() != null && !properties.region().isEmpty()
            ? Region.of(properties.region())
            : Region.US_EAST_1;

    var builder =
        S3Client.builder()
            .region(region)
            .credentialsProvider(credentialsProvider)
            .forcePathStyle(properties.pathStyleAccess()); // Required for MinIO
    if (properties.endpoint() != null && !properties.endpoint().isBlank()) {
      builder.endpointOverride(URI.create(properties.endpoint()));
    }
    this.s3Client = builder.build();

    ensureBucket();
    LOGGER.info("S3 client initialized successfully");
  }

  @Override
  public InputStream getObjectStream(String key) {
    LOGGER.debug("Fetching object: bucket={}, key={}", bucket, key);

    try {
      GetObjectRequest request = GetObjectRequest.builder().bucket(bucket).key(key).build();
      return s3Client.getObject(request);

    } catch (NoSuchKeyException e) {
      String message = String.format("Object not found: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message);
      throw new ObjectStoreException(message, e);

    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to retrieve object: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    }
  }

  @Override
  public void putObject(String key, InputStream data, long contentLength, String contentType) {
    LOGGER.debug(
        "Uploading object: bucket={}, key={}, contentLength={}, contentType={}",
        bucket,
        key,
        contentLength,
        contentType);

    try {
      PutObjectRequest request =
          PutObjectRequest.builder()
              .bucket(bucket)
              .key(key)
              .contentType(contentType)
              .contentLength(contentLength)
              .build();

      s3Client.putObject(request, RequestBody.fromInputStream(data, contentLength));

      LOGGER.info("Successfully uploaded object: bucket={}, key={}", bucket, key);

    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to upload object: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    }
  }

  @Override
  public ObjectMetadata getObjectMetadata(String key) {
    try {
      HeadObjectResponse response = head(key);
      return new ObjectMetadata(response.contentLength(), response.contentType());

    } catch (NoSuchKeyException e) {
      String message = String.format("Object not found: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message);
      throw new ObjectStoreException(message, e);

    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to get metadata: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    }
  }

  @Override
  public boolean exists(String key) {
    try {
      head(key);
      return true;
    } catch (NoSuchKeyException e) {
      return false;
    } catch (S3Exception e) {
      // HEAD responses carry no body, so a missing key can surface as a bare 404
      if (e.statusCode() == 404) {
        return false;
      }
      throw new ObjectStoreException(
          String.format(
              "Failed to check object: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode()),
          e);
    }
  }

  @Override
  public void deleteObject(String key) {
    try {
      s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
      LOGGER.debug("Deleted object: bucket={}, key={}", bucket, key);
    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to delete object: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    }
  }

  /**
   * Clean up resources when the client is no longer needed.
   *
   * <p>Called by Spring on shutdown to release connections and threads.
   */
  public void close() {
    LOGGER.info("Closing S3 client");
    s3Client.close();
  }

  private HeadObjectResponse head(String key) {
    return s3Client.headObject(HeadObjectRequest.builder().bucket(bucket).key(key).build());
  }

  private void ensureBucket() {
    try {
      s3Client.headBucket(HeadBucketRequest.builder().bucket(bucket).build());
    } catch (NoSuchBucketException e) {
      LOGGER.info("Bucket {} does not exist, creating it", bucket);
      s3Client.createBucket(CreateBucketRequest.builder().bucket(bucket).build());
    } catch (S3Exception e) {
      if (e.statusCode() != 404) {
        throw new ObjectStoreException("Failed to check bucket: " + bucket, e);
      }
      LOGGER.info("Bucket {} does not exist, creating it", bucket);
      s3Client.createBucket(CreateBucketRequest.builder().bucket(bucket).build());
    }
  }
}

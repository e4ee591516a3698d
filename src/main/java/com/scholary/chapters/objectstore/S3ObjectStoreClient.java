package com.scholary.chapters.objectstore;

import java.net.URI;
import java.net.URL;
import java.nio.file.Path;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

/**
 * Object store client for S3 and S3-compatible services such as MinIO.
 *
 * <p>Merged files are uploaded straight from disk, so even multi-gigabyte outputs are never held
 * in memory. The SDK retries transient failures itself; whatever still fails surfaces as {@link
 * ObjectStoreException} with the S3 status code when there is one.
 */
public class S3ObjectStoreClient implements ObjectStoreClient, AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(S3ObjectStoreClient.class);

  private final S3Client s3Client;
  private final S3Presigner s3Presigner;

  public S3ObjectStoreClient(ObjectStoreProperties properties) {
    URI endpoint = URI.create(properties.endpoint());
    Region region = regionOf(properties.region());
    AwsCredentialsProvider credentials =
        StaticCredentialsProvider.create(
            AwsBasicCredentials.create(properties.accessKey(), properties.secretKey()));

    this.s3Client =
        S3Client.builder()
            .endpointOverride(endpoint)
            .region(region)
            .credentialsProvider(credentials)
            .forcePathStyle(properties.pathStyleAccess())
            .build();
    this.s3Presigner =
        S3Presigner.builder()
            .endpointOverride(endpoint)
            .region(region)
            .credentialsProvider(credentials)
            .serviceConfiguration(
                S3Configuration.builder()
                    .pathStyleAccessEnabled(properties.pathStyleAccess())
                    .build())
            .build();

    LOGGER.info(
        "Archive store ready: endpoint={}, region={}, bucket={}",
        endpoint,
        region,
        properties.bucket());
  }

  private static Region regionOf(String name) {
    return name == null || name.isBlank() ? Region.US_EAST_1 : Region.of(name);
  }

  @Override
  public void putFile(String bucket, String key, Path file, String contentType) {
    long start = System.currentTimeMillis();
    try {
      s3Client.putObject(
          builder -> builder.bucket(bucket).key(key).contentType(contentType),
          RequestBody.fromFile(file));
    } catch (RuntimeException e) {
      throw failure("upload", bucket, key, e);
    }
    LOGGER.info(
        "Archived {} to {}/{} in {}ms", file, bucket, key, System.currentTimeMillis() - start);
  }

  @Override
  public URL presignGet(String bucket, String key, Duration ttl) {
    try {
      URL url =
          s3Presigner
              .presignGetObject(
                  presign ->
                      presign
                          .signatureDuration(ttl)
                          .getObjectRequest(get -> get.bucket(bucket).key(key)))
              .url();
      LOGGER.debug("Presigned {}/{} for {}", bucket, key, ttl);
      return url;
    } catch (RuntimeException e) {
      throw failure("presign", bucket, key, e);
    }
  }

  private static ObjectStoreException failure(
      String action, String bucket, String key, RuntimeException e) {
    String status =
        e instanceof S3Exception ? ", statusCode=" + ((S3Exception) e).statusCode() : "";
    return new ObjectStoreException(
        String.format("Could not %s object: bucket=%s, key=%s%s", action, bucket, key, status), e);
  }

  /** Called by Spring on shutdown. */
  @Override
  public void close() {
    s3Client.close();
    s3Presigner.close();
  }
}

package com.scholary.chapters.objectstore;

import java.net.URL;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Abstraction for object storage operations.
 *
 * <p>Decouples the archive step from a specific backend (S3, MinIO, ...) and keeps it mockable.
 */
public interface ObjectStoreClient {

  /**
   * Upload a local file.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @param file the file to upload
   * @param contentType the MIME type of the object
   * @throws ObjectStoreException if the upload fails
   */
  void putFile(String bucket, String key, Path file, String contentType);

  /**
   * Generate a presigned URL for temporary access to an object.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @param ttl time-to-live for the URL
   * @return a presigned URL
   * @throws ObjectStoreException if URL generation fails
   */
  URL presignGet(String bucket, String key, Duration ttl);
}

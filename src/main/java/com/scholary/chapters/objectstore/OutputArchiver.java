package com.scholary.chapters.objectstore;

import java.net.URL;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Mirrors completed outputs to object storage when it is configured.
 *
 * <p>Archiving never fails a job: the local file is the primary copy, so an upload error is logged
 * and the output is recorded without an archive key.
 */
@Component
public class OutputArchiver {

  private static final Logger LOGGER = LoggerFactory.getLogger(OutputArchiver.class);

  static final String CONTENT_TYPE = "video/mp4";

  private final ObjectStoreClient client;
  private final ObjectStoreProperties properties;

  public OutputArchiver(
      Optional<ObjectStoreClient> client, Optional<ObjectStoreProperties> properties) {
    this.client = client.orElse(null);
    this.properties = properties.orElse(null);
  }

  public boolean isEnabled() {
    return client != null && properties != null;
  }

  /**
   * Upload an output file under {@code <sessionId>/<filename>}.
   *
   * @return the object key, or null if archiving is disabled or failed
   */
  public String archive(String sessionId, Path file) {
    if (!isEnabled()) {
      return null;
    }

    String key = sessionId + "/" + file.getFileName();
    try {
      client.putFile(properties.bucket(), key, file, CONTENT_TYPE);
      return key;
    } catch (ObjectStoreException e) {
      LOGGER.warn("Archiving {} failed, keeping local copy only: {}", key, e.getMessage(), e);
      return null;
    }
  }

  /**
   * Presigned download link for an archived output.
   *
   * @return the URL, or empty if archiving is disabled or signing failed
   */
  public Optional<URL> downloadUrl(String archiveKey) {
    if (!isEnabled() || archiveKey == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(
          client.presignGet(properties.bucket(), archiveKey, properties.presignTtl()));
    } catch (ObjectStoreException e) {
      LOGGER.warn("Could not presign {}: {}", archiveKey, e.getMessage(), e);
      return Optional.empty();
    }
  }
}

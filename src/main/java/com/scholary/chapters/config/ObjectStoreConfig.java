package com.scholary.chapters.config;

import com.scholary.chapters.objectstore.ObjectStoreClient;
import com.scholary.chapters.objectstore.ObjectStoreProperties;
import com.scholary.chapters.objectstore.S3ObjectStoreClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for object storage.
 *
 * <p>Only active with {@code objectstore.enabled=true}; without it no client bean exists and
 * outputs stay on local disk only.
 */
@Configuration
@ConditionalOnProperty(name = "objectstore.enabled", havingValue = "true")
@EnableConfigurationProperties(ObjectStoreProperties.class)
public class ObjectStoreConfig {

  @Bean
  public ObjectStoreClient objectStoreClient(ObjectStoreProperties properties) {
    return new S3ObjectStoreClient(properties);
  }
}

package com.scholary.video.summarizer.config;

import com.scholary.video.summarizer.objectstore.ObjectStoreClient;
import com.scholary.video.summarizer.objectstore.ObjectStoreProperties;
import com.scholary.video.summarizer.objectstore.S3ObjectStoreClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for object storage.
 *
 * <p>Source videos are read from the bucket named in {@code objectstore.bucket}. The client is
 * closed with the application context.
 */
@Configuration
@EnableConfigurationProperties(ObjectStoreProperties.class)
public class ObjectStoreConfig {

  @Bean(destroyMethod = "close")
  public ObjectStoreClient objectStoreClient(ObjectStoreProperties properties) {
    return new S3ObjectStoreClient(properties);
  }
}

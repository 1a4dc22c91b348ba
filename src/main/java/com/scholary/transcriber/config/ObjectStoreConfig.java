package com.scholary.transcriber.config;

import com.scholary.transcriber.objectstore.LocalObjectStoreClient;
import com.scholary.transcriber.objectstore.ObjectStoreClient;
import com.scholary.transcriber.objectstore.ObjectStoreProperties;
import com.scholary.transcriber.objectstore.S3ObjectStoreClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for object storage.
 *
 * <p>Wires the ObjectStoreClient for the backend named by {@code objectstore.type}. The local
 * filesystem store is the default.
 */
@Configuration
@EnableConfigurationProperties(ObjectStoreProperties.class)
public class ObjectStoreConfig {

  @Bean(destroyMethod = "close")
  @ConditionalOnProperty(name = "objectstore.type", havingValue = "s3")
  public ObjectStoreClient s3ObjectStoreClient(ObjectStoreProperties properties) {
    return new S3ObjectStoreClient(properties);
  }

  @Bean
  @ConditionalOnProperty(name = "objectstore.type", havingValue = "local", matchIfMissing = true)
  public ObjectStoreClient localObjectStoreClient(ObjectStoreProperties properties) {
    String root = properties.localRoot() != null ? properties.localRoot() : "./uploads";
    return new LocalObjectStoreClient(root);
  }
}

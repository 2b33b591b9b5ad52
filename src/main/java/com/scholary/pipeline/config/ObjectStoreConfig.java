package com.scholary.pipeline.config;

import com.scholary.pipeline.objectstore.ObjectStoreClient;
import com.scholary.pipeline.objectstore.ObjectStoreProperties;
import com.scholary.pipeline.objectstore.S3ObjectStoreClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for object storage.
 *
 * <p>Wires the ObjectStoreClient used to stage uploaded audio. The client is closed with the
 * context.
 */
@Configuration
@EnableConfigurationProperties(ObjectStoreProperties.class)
public class ObjectStoreConfig {

  @Bean(destroyMethod = "close")
  public ObjectStoreClient objectStoreClient(ObjectStoreProperties properties) {
    return new S3ObjectStoreClient(properties);
  }
}

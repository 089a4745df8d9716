package com.scholary.bulkupload.config;

import com.scholary.bulkupload.objectstore.ObjectStoreClient;
import com.scholary.bulkupload.objectstore.ObjectStoreProperties;
import com.scholary.bulkupload.objectstore.S3ObjectStoreClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for object storage.
 *
 * <p>Wires the S3 client that upload attempts write to, from the "objectstore.*" properties.
 */
@Configuration
@EnableConfigurationProperties(ObjectStoreProperties.class)
public class ObjectStoreConfig {

  @Bean
  public ObjectStoreClient objectStoreClient(ObjectStoreProperties properties) {
    return new S3ObjectStoreClient(properties);
  }
}

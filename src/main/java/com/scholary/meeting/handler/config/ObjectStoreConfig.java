package com.scholary.meeting.handler.config;

import com.scholary.meeting.handler.objectstore.ObjectStoreClient;
import com.scholary.meeting.handler.objectstore.ObjectStoreProperties;
import com.scholary.meeting.handler.objectstore.S3ObjectStoreClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Object store client for chunk files, chunk results and merged documents. */
@Configuration
@EnableConfigurationProperties(ObjectStoreProperties.class)
public class ObjectStoreConfig {

  @Bean(destroyMethod = "close")
  public ObjectStoreClient objectStoreClient(ObjectStoreProperties properties) {
    return new S3ObjectStoreClient(properties);
  }
}

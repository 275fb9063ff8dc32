package com.scholary.meeting.handler.objectstore;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Where meeting artifacts are stored, bound from {@code objectstore.*}.
 *
 * <p>{@code bucket} is the default for requests that do not name one. MinIO needs {@code
 * pathStyleAccess}; a blank region falls back to {@code us-east-1}.
 */
@ConfigurationProperties(prefix = "objectstore")
@Validated
public record ObjectStoreProperties(
    @NotBlank String endpoint,
    @NotBlank String accessKey,
    @NotBlank String secretKey,
    @NotBlank String bucket,
    String region,
    boolean pathStyleAccess) {

  public static final String DEFAULT_REGION = "us-east-1";

  public ObjectStoreProperties {
    if (region == null || region.isBlank()) {
      region = DEFAULT_REGION;
    }
  }
}

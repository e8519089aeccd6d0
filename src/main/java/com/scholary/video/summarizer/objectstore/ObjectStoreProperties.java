package com.scholary.video.summarizer.objectstore;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Where uploaded source videos are read from ({@code objectstore.*}).
 *
 * @param endpoint S3 or MinIO endpoint URL
 * @param bucket bucket holding the videos; request keys are resolved against it
 * @param region signing region, {@value #DEFAULT_REGION} when blank
 * @param pathStyleAccess address the bucket in the path instead of the host name, as MinIO needs
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

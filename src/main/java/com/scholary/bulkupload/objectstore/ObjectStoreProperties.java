package com.scholary.bulkupload.objectstore;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for object storage.
 *
 * <p>These map to the "objectstore.*" keys in application.yml. Spring Boot will automatically bind
 * and validate them at startup.
 *
 * @param keyPrefix prepended to every object key, may be empty
 * @param multipartPartSize part size for chunked uploads; S3 rejects parts below 5 MiB
 */
@ConfigurationProperties(prefix = "objectstore")
@Validated
public record ObjectStoreProperties(
    @NotBlank String endpoint,
    @NotBlank String accessKey,
    @NotBlank String secretKey,
    @NotBlank String bucket,
    String region,
    boolean pathStyleAccess,
    String keyPrefix,
    @Min(MIN_PART_SIZE) long multipartPartSize) {

  public static final long MIN_PART_SIZE = 5L * 1024 * 1024;
}

package com.scholary.bulkupload.queue;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for upload queues.
 *
 * <p>These map to the "upload.queue.*" keys in application.yml and provide the default {@link
 * QueueOptions} of every batch.
 */
@ConfigurationProperties(prefix = "upload.queue")
@Validated
public record UploadQueueProperties(
    @Positive int concurrency,
    @Min(0) int maxRetries,
    @NotNull Duration retryDelay,
    @NotNull Duration timeout,
    @Positive int schedulerThreads) {

  public QueueOptions toOptions() {
    return new QueueOptions(concurrency, maxRetries, retryDelay, timeout);
  }
}

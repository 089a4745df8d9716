package com.scholary.bulkupload.queue;

import java.time.Duration;

/**
 * Tuning knobs of an {@link UploadQueueManager}.
 *
 * @param concurrency maximum number of uploads in flight
 * @param maxRetries automatic retries per file after the first attempt
 * @param retryDelay base backoff delay; attempt n waits {@code retryDelay * n}
 * @param timeout hard limit for a single attempt
 */
public record QueueOptions(int concurrency, int maxRetries, Duration retryDelay, Duration timeout) {

  public QueueOptions {
    if (concurrency < 1) {
      throw new IllegalArgumentException("concurrency must be at least 1: " + concurrency);
    }
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
    }
    if (retryDelay == null || retryDelay.isNegative()) {
      throw new IllegalArgumentException("retryDelay must not be negative: " + retryDelay);
    }
    if (timeout == null || timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be positive: " + timeout);
    }
  }

  public static QueueOptions defaults() {
    return new QueueOptions(5, 3, Duration.ofSeconds(1), Duration.ofSeconds(30));
  }

  public QueueOptions withConcurrency(int concurrency) {
    return new QueueOptions(concurrency, maxRetries, retryDelay, timeout);
  }

  public QueueOptions withMaxRetries(int maxRetries) {
    return new QueueOptions(concurrency, maxRetries, retryDelay, timeout);
  }
}

package com.scholary.bulkupload.strategy;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Thresholds for automatic strategy selection, in bytes.
 *
 * <p>Maps to "upload.strategy.*". The defaults are 10 MiB, 50 MiB and 100 MiB.
 */
@ConfigurationProperties(prefix = "upload.strategy")
@Validated
public record StrategyProperties(
    boolean autoSelect,
    @Positive long directThreshold,
    @Positive long chunkedThreshold,
    @Positive long streamingThreshold) {

  public static StrategyProperties defaults() {
    return new StrategyProperties(
        true, 10L * 1024 * 1024, 50L * 1024 * 1024, 100L * 1024 * 1024);
  }
}

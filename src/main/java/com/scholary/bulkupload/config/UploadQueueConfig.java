package com.scholary.bulkupload.config;

import com.scholary.bulkupload.queue.DelayScheduler;
import com.scholary.bulkupload.queue.ExecutorDelayScheduler;
import com.scholary.bulkupload.queue.UploadQueueProperties;
import com.scholary.bulkupload.strategy.StrategyProperties;
import com.scholary.bulkupload.validation.ValidationProperties;
import java.time.Clock;
import java.util.concurrent.ScheduledExecutorService;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for upload orchestration beans.
 *
 * <p>Enables the upload properties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties({
  UploadQueueProperties.class,
  ValidationProperties.class,
  StrategyProperties.class
})
public class UploadQueueConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public DelayScheduler delayScheduler(ScheduledExecutorService uploadScheduledExecutor) {
    return new ExecutorDelayScheduler(uploadScheduledExecutor);
  }
}

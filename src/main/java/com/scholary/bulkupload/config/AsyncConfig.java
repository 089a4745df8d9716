package com.scholary.bulkupload.config;

import com.scholary.bulkupload.queue.UploadQueueProperties;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Configuration for upload thread pools.
 *
 * <p>Transfers block on I/O, so they run on a bounded pool of their own. Retry backoff and attempt
 * timeouts run on a small scheduler.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "uploadExecutor")
  public Executor uploadExecutor(
      @Value("${upload.executor.threads}") int threads,
      @Value("${upload.executor.queueSize}") int queueSize) {

    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(queueSize);
    executor.setThreadNamePrefix("upload-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "uploadScheduler")
  public ThreadPoolTaskScheduler uploadScheduler(UploadQueueProperties properties) {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(properties.schedulerThreads());
    scheduler.setThreadNamePrefix("upload-timer-");
    scheduler.setRemoveOnCancelPolicy(true);
    scheduler.initialize();
    return scheduler;
  }

  @Bean
  public ScheduledExecutorService uploadScheduledExecutor(ThreadPoolTaskScheduler uploadScheduler) {
    return uploadScheduler.getScheduledExecutor();
  }
}

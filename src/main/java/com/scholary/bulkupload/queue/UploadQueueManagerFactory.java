package com.scholary.bulkupload.queue;

import com.scholary.bulkupload.progress.ProgressAggregator;
import java.time.Clock;
import org.springframework.stereotype.Component;

/** Builds one {@link UploadQueueManager} per batch, sharing the scheduler and clock. */
@Component
public class UploadQueueManagerFactory {

  private final UploadQueueProperties properties;
  private final DelayScheduler scheduler;
  private final Clock clock;
  private final ProgressAggregator progressAggregator;

  public UploadQueueManagerFactory(
      UploadQueueProperties properties,
      DelayScheduler scheduler,
      Clock clock,
      ProgressAggregator progressAggregator) {
    this.properties = properties;
    this.scheduler = scheduler;
    this.clock = clock;
    this.progressAggregator = progressAggregator;
  }

  public UploadQueueManager create(String name) {
    return create(name, properties.toOptions());
  }

  public UploadQueueManager create(String name, QueueOptions options) {
    return new UploadQueueManager(name, options, scheduler, clock, progressAggregator);
  }
}

package com.scholary.bulkupload.queue;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/** {@link DelayScheduler} backed by a {@link ScheduledExecutorService}. */
public class ExecutorDelayScheduler implements DelayScheduler {

  private final ScheduledExecutorService executor;

  public ExecutorDelayScheduler(ScheduledExecutorService executor) {
    this.executor = executor;
  }

  @Override
  public Scheduled schedule(Runnable task, Duration delay) {
    ScheduledFuture<?> future = executor.schedule(task, delay.toMillis(), TimeUnit.MILLISECONDS);
    return () -> future.cancel(false);
  }
}

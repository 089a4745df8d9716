package com.scholary.bulkupload.queue;

import java.time.Duration;

/**
 * Runs a task after a delay. The manager uses it for retry backoff and attempt timeouts.
 *
 * <p>Injected so tests can drive time by hand instead of sleeping.
 */
public interface DelayScheduler {

  /**
   * Schedule a task.
   *
   * @param task the task to run
   * @param delay how long to wait; zero means "as soon as possible, but not inline"
   * @return a handle that can cancel the task before it runs
   * @throws java.util.concurrent.RejectedExecutionException if the scheduler is shut down
   */
  Scheduled schedule(Runnable task, Duration delay);

  /** Handle to a scheduled task. */
  interface Scheduled {
    void cancel();
  }
}

package com.scholary.bulkupload.progress;

import com.scholary.bulkupload.queue.UploadItemSnapshot;
import com.scholary.bulkupload.queue.UploadStatus;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import org.springframework.stereotype.Component;

/**
 * Derives batch statistics from file snapshots.
 *
 * <p>{@code overallProgress} is the plain mean of per-file percentages: a 1 KB file and a 1 GB
 * file weigh the same. Throughput only counts bytes of completed files, so it moves in steps
 * rather than smoothly while large files are in flight.
 */
@Component
public class ProgressAggregator {

  /**
   * Aggregate the given snapshots.
   *
   * @param items current file snapshots
   * @param startedAt when the run started, or null if it never did
   * @param now the instant the elapsed time is measured to
   * @return batch statistics
   */
  public ProgressSnapshot aggregate(
      Collection<UploadItemSnapshot> items, Instant startedAt, Instant now) {
    int completed = 0;
    int failed = 0;
    int uploading = 0;
    int pending = 0;
    int paused = 0;
    int cancelled = 0;
    long progressSum = 0;
    long completedBytes = 0;
    long remainingBytes = 0;

    for (UploadItemSnapshot item : items) {
      progressSum += item.progress();
      switch (item.status()) {
        case COMPLETED -> {
          completed++;
          completedBytes += item.size();
        }
        case ERROR -> failed++;
        case UPLOADING -> uploading++;
        case PENDING -> pending++;
        case PAUSED -> paused++;
        case CANCELLED -> cancelled++;
      }
      if (isOutstanding(item.status())) {
        remainingBytes += item.size();
      }
    }

    int total = items.size();
    int overallProgress = total > 0 ? (int) Math.round((double) progressSum / total) : 0;

    double uploadSpeed = 0.0;
    if (startedAt != null && now != null) {
      double elapsedSeconds = Duration.between(startedAt, now).toMillis() / 1000.0;
      if (elapsedSeconds > 0) {
        uploadSpeed = completedBytes / elapsedSeconds;
      }
    }
    double estimatedTimeRemaining = uploadSpeed > 0 ? remainingBytes / uploadSpeed : 0.0;

    return new ProgressSnapshot(
        completed,
        failed,
        uploading,
        pending,
        paused,
        cancelled,
        total,
        overallProgress,
        uploadSpeed,
        estimatedTimeRemaining);
  }

  /** Files that still have bytes to send. Errored files wait for a manual retry. */
  private static boolean isOutstanding(UploadStatus status) {
    return status == UploadStatus.PENDING
        || status == UploadStatus.UPLOADING
        || status == UploadStatus.PAUSED;
  }
}

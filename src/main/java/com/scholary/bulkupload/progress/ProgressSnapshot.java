package com.scholary.bulkupload.progress;

/**
 * Batch-level progress derived from per-file states.
 *
 * @param overallProgress unweighted mean of per-file progress, 0-100
 * @param uploadSpeed bytes per second, counting completed files only
 * @param estimatedTimeRemaining seconds; 0 when no speed is known yet
 */
public record ProgressSnapshot(
    int completed,
    int failed,
    int uploading,
    int pending,
    int paused,
    int cancelled,
    int total,
    int overallProgress,
    double uploadSpeed,
    double estimatedTimeRemaining) {

  public static ProgressSnapshot empty() {
    return new ProgressSnapshot(0, 0, 0, 0, 0, 0, 0, 0, 0.0, 0.0);
  }
}

package com.scholary.bulkupload.queue;

import com.scholary.bulkupload.file.UploadFile;
import com.scholary.bulkupload.strategy.UploadStrategy;
import java.time.Instant;

/**
 * Mutable per-file state owned by {@link UploadQueueManager}.
 *
 * <p>Only the manager touches instances of this class, always while holding its lock. Everything
 * outside the package sees {@link UploadItemSnapshot} copies.
 */
final class UploadItem {

  private final String id;
  private final UploadFile file;
  private final UploadStrategy strategy;

  private UploadStatus status = UploadStatus.PENDING;
  private int progress;
  private int retryCount;
  private UploadOutcome.Failure failure;
  private Object result;
  private Instant startedAt;
  private Instant endedAt;

  UploadItem(QueuedFile queuedFile) {
    this.id = queuedFile.id();
    this.file = queuedFile.file();
    this.strategy = queuedFile.strategy();
  }

  String id() {
    return id;
  }

  UploadFile file() {
    return file;
  }

  UploadStatus status() {
    return status;
  }

  int progress() {
    return progress;
  }

  int retryCount() {
    return retryCount;
  }

  void markUploading(Instant now) {
    status = UploadStatus.UPLOADING;
    startedAt = now;
    endedAt = null;
  }

  void markPaused() {
    status = UploadStatus.PAUSED;
  }

  void markResumedInFlight() {
    status = UploadStatus.UPLOADING;
  }

  void complete(Object value, Instant now) {
    status = UploadStatus.COMPLETED;
    progress = 100;
    result = value;
    failure = null;
    endedAt = now;
  }

  void fail(UploadOutcome.Failure lastFailure, Instant now) {
    status = UploadStatus.ERROR;
    failure = lastFailure;
    endedAt = now;
  }

  void cancel(Instant now) {
    status = UploadStatus.CANCELLED;
    endedAt = now;
  }

  /** Back to PENDING for another attempt, charging one retry to the budget. */
  void requeueForRetry() {
    retryCount++;
    resetToPending();
  }

  /** Back to PENDING without touching the retry budget. */
  void resetToPending() {
    status = UploadStatus.PENDING;
    progress = 0;
    failure = null;
  }

  /**
   * Record reported progress. Values are clamped and never move backwards.
   *
   * @return true if the stored value changed
   */
  boolean updateProgress(int percent) {
    int clamped = Math.min(100, Math.max(0, percent));
    if (clamped <= progress) {
      return false;
    }
    progress = clamped;
    return true;
  }

  UploadItemSnapshot toSnapshot() {
    return new UploadItemSnapshot(
        id,
        file,
        strategy,
        status,
        progress,
        retryCount,
        status == UploadStatus.ERROR && failure != null ? failure.code() : null,
        status == UploadStatus.ERROR && failure != null ? failure.message() : null,
        status == UploadStatus.COMPLETED ? result : null,
        startedAt,
        endedAt);
  }
}

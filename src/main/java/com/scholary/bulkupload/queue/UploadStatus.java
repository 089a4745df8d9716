package com.scholary.bulkupload.queue;

/**
 * Lifecycle states of a queued file.
 *
 * <pre>
 * PENDING -> UPLOADING -> COMPLETED | ERROR | PAUSED | CANCELLED
 * ERROR   -> PENDING   (automatic retry while budget remains, or retryFailedFiles)
 * PAUSED  -> PENDING   (resume)
 * </pre>
 */
public enum UploadStatus {
  PENDING,
  UPLOADING,
  PAUSED,
  COMPLETED,
  ERROR,
  CANCELLED;

  /** COMPLETED and CANCELLED never leave their state. */
  public boolean isFinal() {
    return this == COMPLETED || this == CANCELLED;
  }
}

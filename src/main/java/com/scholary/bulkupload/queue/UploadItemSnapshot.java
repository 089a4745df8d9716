package com.scholary.bulkupload.queue;

import com.scholary.bulkupload.file.UploadFile;
import com.scholary.bulkupload.strategy.UploadStrategy;
import java.time.Instant;

/**
 * Immutable copy of a queued file's state at one point in time.
 *
 * <p>Returned by every query on the manager. Holding on to a snapshot never exposes live queue
 * state.
 */
public record UploadItemSnapshot(
    String id,
    UploadFile file,
    UploadStrategy strategy,
    UploadStatus status,
    int progress,
    int retryCount,
    UploadErrorCode errorCode, // null unless status == ERROR
    String error, // null unless status == ERROR
    Object result, // null unless status == COMPLETED
    Instant startedAt,
    Instant endedAt) {

  public String fileName() {
    return file.name();
  }

  public long size() {
    return file.size();
  }
}

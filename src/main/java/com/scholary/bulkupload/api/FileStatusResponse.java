package com.scholary.bulkupload.api;

import com.scholary.bulkupload.queue.UploadErrorCode;
import com.scholary.bulkupload.queue.UploadItemSnapshot;
import com.scholary.bulkupload.queue.UploadStatus;
import com.scholary.bulkupload.strategy.UploadStrategy;
import java.time.Instant;

/** State of one file in a batch. */
public record FileStatusResponse(
    String id,
    String name,
    long size,
    UploadStrategy strategy,
    UploadStatus status,
    int progress,
    int retryCount,
    UploadErrorCode errorCode,
    String error,
    Object result,
    Instant startedAt,
    Instant endedAt) {

  static FileStatusResponse from(UploadItemSnapshot item) {
    return new FileStatusResponse(
        item.id(),
        item.fileName(),
        item.size(),
        item.strategy(),
        item.status(),
        item.progress(),
        item.retryCount(),
        item.errorCode(),
        item.error(),
        item.result(),
        item.startedAt(),
        item.endedAt());
  }
}

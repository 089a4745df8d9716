package com.scholary.bulkupload.api;

import com.scholary.bulkupload.batch.UploadBatch;
import com.scholary.bulkupload.progress.ProgressSnapshot;
import com.scholary.bulkupload.queue.UploadQueueManager;
import com.scholary.bulkupload.validation.FileRejection;
import java.time.Instant;
import java.util.List;

/**
 * Response for batch status query.
 *
 * <p>Shows batch progress, every queued file, and the files that were rejected when the batch was
 * created.
 */
public record BatchStatusResponse(
    String batchId,
    boolean paused,
    ProgressSnapshot progress,
    List<FileStatusResponse> files,
    List<FileRejection> rejections,
    List<String> batchErrors,
    Instant createdAt) {

  static BatchStatusResponse from(UploadBatch batch) {
    UploadQueueManager manager = batch.getManager();
    return new BatchStatusResponse(
        batch.getBatchId(),
        manager.isPaused(),
        manager.getProgress(),
        manager.getFiles().stream().map(FileStatusResponse::from).toList(),
        batch.getRejections(),
        batch.getBatchErrors(),
        batch.getCreatedAt());
  }
}

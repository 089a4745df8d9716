package com.scholary.bulkupload.batch;

import com.scholary.bulkupload.queue.UploadQueueManager;
import com.scholary.bulkupload.validation.FileRejection;
import java.time.Instant;
import java.util.List;

/**
 * A batch of files being uploaded together.
 *
 * <p>Owns the batch's {@link UploadQueueManager}, plus the validation outcome reported when the
 * batch was created. Stored in memory using Caffeine cache.
 */
public class UploadBatch {

  private final String batchId;
  private final UploadQueueManager manager;
  private final List<FileRejection> rejections;
  private final List<String> batchErrors;
  private final Instant createdAt;

  public UploadBatch(
      String batchId,
      UploadQueueManager manager,
      List<FileRejection> rejections,
      List<String> batchErrors,
      Instant createdAt) {
    this.batchId = batchId;
    this.manager = manager;
    this.rejections = List.copyOf(rejections);
    this.batchErrors = List.copyOf(batchErrors);
    this.createdAt = createdAt;
  }

  public String getBatchId() {
    return batchId;
  }

  public UploadQueueManager getManager() {
    return manager;
  }

  public List<FileRejection> getRejections() {
    return rejections;
  }

  public List<String> getBatchErrors() {
    return batchErrors;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}

package com.scholary.bulkupload.queue;

import com.scholary.bulkupload.file.UploadFile;
import com.scholary.bulkupload.strategy.UploadStrategy;
import java.util.Objects;
import java.util.UUID;

/**
 * A validated file handed to {@link UploadQueueManager#addFiles}, together with its identifier and
 * the strategy chosen for it.
 */
public record QueuedFile(String id, UploadFile file, UploadStrategy strategy) {

  public QueuedFile {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(file, "file");
    Objects.requireNonNull(strategy, "strategy");
  }

  /** Wrap a file with a freshly generated identifier. */
  public static QueuedFile of(UploadFile file, UploadStrategy strategy) {
    return new QueuedFile("upl_" + UUID.randomUUID().toString().replace("-", ""), file, strategy);
  }
}

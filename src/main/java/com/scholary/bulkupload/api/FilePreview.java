package com.scholary.bulkupload.api;

import com.scholary.bulkupload.queue.QueuedFile;
import com.scholary.bulkupload.strategy.UploadStrategy;

/** An accepted file and the strategy it would be uploaded with. */
public record FilePreview(String name, long size, String contentType, UploadStrategy strategy) {

  static FilePreview from(QueuedFile file) {
    return new FilePreview(
        file.file().name(), file.file().size(), file.file().contentType(), file.strategy());
  }
}

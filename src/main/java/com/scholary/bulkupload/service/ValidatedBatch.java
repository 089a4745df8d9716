package com.scholary.bulkupload.service;

import com.scholary.bulkupload.queue.QueuedFile;
import com.scholary.bulkupload.validation.FileRejection;
import java.util.List;

/**
 * Files that passed every check, each with its upload strategy, plus what was turned away.
 *
 * @param totalSize combined size of the accepted files
 */
public record ValidatedBatch(
    List<QueuedFile> files,
    List<FileRejection> rejections,
    List<String> batchErrors,
    long totalSize) {

  public ValidatedBatch {
    files = List.copyOf(files);
    rejections = List.copyOf(rejections);
    batchErrors = List.copyOf(batchErrors);
  }

  public boolean hasUploadableFiles() {
    return !files.isEmpty();
  }
}

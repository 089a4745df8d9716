package com.scholary.bulkupload.validation;

import com.scholary.bulkupload.file.UploadFile;
import java.util.List;

/**
 * Outcome of validating a batch of files.
 *
 * <p>Batch-level errors (too many files, duplicate names, aggregate size) are reported separately
 * from per-file rejections. A duplicate-name error does not remove files from {@code validFiles};
 * the quota errors do.
 */
public record BatchValidationResult(
    List<UploadFile> validFiles,
    List<FileRejection> rejections,
    List<String> batchErrors,
    long totalSize) {

  public BatchValidationResult {
    validFiles = List.copyOf(validFiles);
    rejections = List.copyOf(rejections);
    batchErrors = List.copyOf(batchErrors);
  }

  /** True when nothing at all was reported. */
  public boolean isValid() {
    return rejections.isEmpty() && batchErrors.isEmpty();
  }
}

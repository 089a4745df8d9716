package com.scholary.bulkupload.api;

import com.scholary.bulkupload.service.ValidatedBatch;
import com.scholary.bulkupload.validation.FileRejection;
import java.util.List;

/** Dry-run validation result. */
public record BatchValidationResponse(
    boolean valid,
    List<FilePreview> files,
    List<FileRejection> rejections,
    List<String> batchErrors,
    long totalSize) {

  static BatchValidationResponse from(ValidatedBatch batch) {
    return new BatchValidationResponse(
        batch.rejections().isEmpty() && batch.batchErrors().isEmpty(),
        batch.files().stream().map(FilePreview::from).toList(),
        batch.rejections(),
        batch.batchErrors(),
        batch.totalSize());
  }
}

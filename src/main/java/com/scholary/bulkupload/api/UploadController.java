package com.scholary.bulkupload.api;

import com.scholary.bulkupload.batch.UploadBatch;
import com.scholary.bulkupload.logging.StructuredLogger;
import com.scholary.bulkupload.service.BulkUploadService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for bulk uploads.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Dry-run validation with a strategy preview
 *   <li>Starting a batch (returns the batch ID immediately)
 *   <li>Status polling, pause, resume, retry and cancellation
 * </ul>
 *
 * <p>Uploads run in the background; clients poll the batch for progress.
 */
@RestController
@RequestMapping("/api/uploads")
@Tag(name = "Uploads", description = "Bulk upload orchestration API")
public class UploadController {

  private static final Logger LOGGER = LoggerFactory.getLogger(UploadController.class);

  private final BulkUploadService uploadService;

  public UploadController(BulkUploadService uploadService) {
    this.uploadService = uploadService;
  }

  @PostMapping("/validate")
  @Operation(
      summary = "Validate files",
      description = "Check files against the upload rules and preview their strategies")
  public ResponseEntity<BatchValidationResponse> validate(
      @Valid @RequestBody BatchUploadRequest request) {
    LOGGER.info("Validation request: files={}", request.filePaths().size());
    return ResponseEntity.ok(
        BatchValidationResponse.from(uploadService.validate(request.filePaths())));
  }

  @PostMapping
  @Operation(
      summary = "Start batch upload",
      description =
          "Validate files, queue the accepted ones and start uploading. Returns the batch ID for"
              + " status polling.")
  public ResponseEntity<BatchStatusResponse> create(@Valid @RequestBody BatchUploadRequest request) {
    LOGGER.info("Upload request: files={}", request.filePaths().size());
    UploadBatch batch = uploadService.createBatch(request.filePaths());
    return withBatchContext(
        batch.getBatchId(), () -> ResponseEntity.accepted().body(BatchStatusResponse.from(batch)));
  }

  @GetMapping("/{batchId}")
  @Operation(summary = "Get batch status", description = "Progress and per-file state of a batch")
  public ResponseEntity<BatchStatusResponse> status(@PathVariable String batchId) {
    return withBatchContext(
        batchId,
        () -> ResponseEntity.ok(BatchStatusResponse.from(uploadService.getBatch(batchId))));
  }

  @PostMapping("/{batchId}/pause")
  @Operation(summary = "Pause batch", description = "Stop starting new uploads")
  public ResponseEntity<BatchStatusResponse> pause(@PathVariable String batchId) {
    return withBatchContext(
        batchId, () -> ResponseEntity.ok(BatchStatusResponse.from(uploadService.pause(batchId))));
  }

  @PostMapping("/{batchId}/resume")
  @Operation(summary = "Resume batch", description = "Continue a paused batch")
  public ResponseEntity<BatchStatusResponse> resume(@PathVariable String batchId) {
    return withBatchContext(
        batchId, () -> ResponseEntity.ok(BatchStatusResponse.from(uploadService.resume(batchId))));
  }

  @PostMapping("/{batchId}/retry")
  @Operation(summary = "Retry failed files", description = "Re-queue every file in error")
  public ResponseEntity<BatchStatusResponse> retry(@PathVariable String batchId) {
    return withBatchContext(
        batchId,
        () -> ResponseEntity.ok(BatchStatusResponse.from(uploadService.retryFailed(batchId))));
  }

  @DeleteMapping("/{batchId}/files/{fileId}")
  @Operation(summary = "Cancel file", description = "Abort and cancel a single file")
  public ResponseEntity<BatchStatusResponse> cancelFile(
      @PathVariable String batchId, @PathVariable String fileId) {
    return withBatchContext(
        batchId,
        () ->
            ResponseEntity.ok(
                BatchStatusResponse.from(uploadService.cancelFile(batchId, fileId))));
  }

  @DeleteMapping("/{batchId}")
  @Operation(summary = "Delete batch", description = "Abort all uploads and forget the batch")
  public ResponseEntity<Void> delete(@PathVariable String batchId) {
    return withBatchContext(
        batchId,
        () -> {
          uploadService.delete(batchId);
          return ResponseEntity.noContent().build();
        });
  }

  private static <T> T withBatchContext(String batchId, Supplier<T> action) {
    try {
      StructuredLogger.setBatchContext(batchId);
      return action.get();
    } finally {
      StructuredLogger.clearBatchContext();
    }
  }
}

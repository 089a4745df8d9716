package com.scholary.bulkupload.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event puts its fields into the MDC for the duration of a single log statement, so log
 * shippers can index attempts, retries and failures by file and batch.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log an upload attempt being admitted into the active set. */
  public void logAttemptStarted(
      String fileId, String fileName, String strategy, int attempt, int activeCount) {
    try {
      MDC.put("event_type", "upload_started");
      MDC.put("file_id", fileId);
      MDC.put("fileName", fileName);
      MDC.put("strategy", strategy);
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("activeCount", String.valueOf(activeCount));

      logger.debug(
          "Upload started: file={}, name={}, strategy={}, attempt={}, active={}",
          fileId,
          fileName,
          strategy,
          attempt,
          activeCount);
    } finally {
      clearEventFields();
    }
  }

  /** Log a successful attempt. */
  public void logAttemptSucceeded(String fileId, int attempt, long durationMs) {
    try {
      MDC.put("event_type", "upload_completed");
      MDC.put("file_id", fileId);
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("durationMs", String.valueOf(durationMs));

      logger.info(
          "Upload completed: file={}, attempt={}, duration={}ms", fileId, attempt, durationMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log a failed attempt that will be retried after a backoff delay. */
  public void logRetryScheduled(
      String fileId, int retry, int maxRetries, String errorType, String message, long delayMs) {
    try {
      MDC.put("event_type", "upload_retry");
      MDC.put("file_id", fileId);
      MDC.put("attempt", String.valueOf(retry));
      MDC.put("maxRetries", String.valueOf(maxRetries));
      MDC.put("errorType", errorType);
      MDC.put("delayMs", String.valueOf(delayMs));

      logger.warn(
          "Upload retry scheduled: file={}, retry={}/{}, error={}, delay={}ms, message={}",
          fileId,
          retry,
          maxRetries,
          errorType,
          delayMs,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log a terminal failure. */
  public void logUploadFailed(String fileId, int retryCount, String errorType, String message) {
    try {
      MDC.put("event_type", "upload_failed");
      MDC.put("file_id", fileId);
      MDC.put("retryCount", String.valueOf(retryCount));
      MDC.put("errorType", errorType);

      logger.error(
          "Upload failed: file={}, retries={}, error={}, message={}",
          fileId,
          retryCount,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log batch progress. */
  public void logBatchProgress(
      String batchId, int completed, int failed, int total, int percentComplete) {
    try {
      MDC.put("event_type", "batch_progress");
      MDC.put("completed", String.valueOf(completed));
      MDC.put("failed", String.valueOf(failed));
      MDC.put("total", String.valueOf(total));
      MDC.put("percentComplete", String.valueOf(percentComplete));

      logger.info(
          "Batch progress: batchId={}, completed={}/{}, failed={}, progress={}%",
          batchId,
          completed,
          total,
          failed,
          percentComplete);
    } finally {
      clearEventFields();
    }
  }

  /** Set batch context in MDC. */
  public static void setBatchContext(String batchId) {
    MDC.put("batchId", batchId);
  }

  /** Clear batch context from MDC. */
  public static void clearBatchContext() {
    MDC.remove("batchId");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("file_id");
    MDC.remove("fileName");
    MDC.remove("strategy");
    MDC.remove("attempt");
    MDC.remove("activeCount");
    MDC.remove("durationMs");
    MDC.remove("maxRetries");
    MDC.remove("errorType");
    MDC.remove("delayMs");
    MDC.remove("retryCount");
    MDC.remove("completed");
    MDC.remove("failed");
    MDC.remove("total");
    MDC.remove("percentComplete");
  }
}

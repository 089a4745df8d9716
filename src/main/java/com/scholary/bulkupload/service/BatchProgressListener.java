package com.scholary.bulkupload.service;

import com.scholary.bulkupload.logging.StructuredLogger;
import com.scholary.bulkupload.progress.ProgressSnapshot;
import com.scholary.bulkupload.queue.UploadQueueListener;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs batch progress each time another file settles.
 *
 * <p>Progress events fire on every percent a transfer reports; only changes to the settled count
 * are logged.
 */
class BatchProgressListener implements UploadQueueListener {

  private static final Logger LOGGER = LoggerFactory.getLogger(BatchProgressListener.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final String batchId;
  private int lastSettled = -1;

  BatchProgressListener(String batchId) {
    this.batchId = batchId;
  }

  @Override
  public void onProgress(ProgressSnapshot progress) {
    int settled = progress.completed() + progress.failed() + progress.cancelled();
    if (settled == lastSettled) {
      return;
    }
    lastSettled = settled;
    structuredLogger.logBatchProgress(
        batchId,
        progress.completed(),
        progress.failed(),
        progress.total(),
        progress.overallProgress());
  }

  @Override
  public void onComplete(List<Object> results) {
    LOGGER.info("Batch finished: batchId={}, uploaded={}", batchId, results.size());
  }

  @Override
  public void onError(Throwable error) {
    LOGGER.error("Upload queue error: batchId={}", batchId, error);
  }
}

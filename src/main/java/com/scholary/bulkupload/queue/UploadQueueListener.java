package com.scholary.bulkupload.queue;

import com.scholary.bulkupload.progress.ProgressSnapshot;
import java.util.List;

/**
 * Callbacks emitted by {@link UploadQueueManager}.
 *
 * <p>Callbacks run synchronously inside the manager's state transitions while it holds its lock.
 * They may query the manager but must not block.
 */
public interface UploadQueueListener {

  default void onProgress(ProgressSnapshot progress) {}

  default void onFileStatusChange(String fileId, UploadStatus status) {}

  /** The queue drained; {@code results} holds the values of every completed file. */
  default void onComplete(List<Object> results) {}

  /** A failure of the manager itself, not of an individual upload. */
  default void onError(Throwable error) {}
}

package com.scholary.bulkupload.queue;

import java.util.function.IntConsumer;

/**
 * Everything an {@link UploadFunction} needs for one attempt.
 *
 * <p>The task is bound to a single attempt. Progress reported after the attempt has been settled,
 * cancelled or timed out is ignored by the manager.
 */
public final class UploadTask {

  private final UploadItemSnapshot item;
  private final int attempt;
  private final CancellationToken token;
  private final IntConsumer progressSink;

  UploadTask(UploadItemSnapshot item, int attempt, CancellationToken token, IntConsumer progressSink) {
    this.item = item;
    this.attempt = attempt;
    this.token = token;
    this.progressSink = progressSink;
  }

  /** State of the file when the attempt was admitted. */
  public UploadItemSnapshot item() {
    return item;
  }

  /** 1-based attempt number. */
  public int attempt() {
    return attempt;
  }

  public CancellationToken token() {
    return token;
  }

  /** Report transfer progress in percent (0-100). */
  public void reportProgress(int percent) {
    progressSink.accept(percent);
  }
}

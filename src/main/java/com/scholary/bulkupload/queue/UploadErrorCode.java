package com.scholary.bulkupload.queue;

/** Classification of a failed upload attempt. */
public enum UploadErrorCode {
  NETWORK(true),
  TIMEOUT(true),
  SERVER(true),
  /** Rejected by the store (4xx). Resending the same bytes will not help. */
  CLIENT(false),
  INVALID_PAYLOAD(false),
  CANCELLED(false),
  UNKNOWN(true);

  private final boolean retryable;

  UploadErrorCode(boolean retryable) {
    this.retryable = retryable;
  }

  public boolean isRetryable() {
    return retryable;
  }
}

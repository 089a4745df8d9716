package com.scholary.bulkupload.queue;

/**
 * Thrown when the upload queue is used incorrectly: a duplicate identifier, or a call on a closed
 * manager.
 */
public class UploadQueueException extends RuntimeException {

  public UploadQueueException(String message) {
    super(message);
  }

  public UploadQueueException(String message, Throwable cause) {
    super(message, cause);
  }
}

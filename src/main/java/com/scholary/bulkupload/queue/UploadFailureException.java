package com.scholary.bulkupload.queue;

/**
 * Exception an upload function may complete its future with to control how the failure is
 * classified.
 *
 * <p>Any other exception is classified by type: timeouts as TIMEOUT, I/O errors as NETWORK and
 * everything else as UNKNOWN.
 */
public class UploadFailureException extends RuntimeException {

  private final UploadErrorCode code;

  public UploadFailureException(UploadErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public UploadFailureException(UploadErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public UploadErrorCode getCode() {
    return code;
  }
}

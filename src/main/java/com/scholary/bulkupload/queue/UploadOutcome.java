package com.scholary.bulkupload.queue;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Result of one upload attempt: either {@link Success} or {@link Failure}.
 *
 * <p>Upload functions may also complete their future exceptionally; the manager converts the
 * exception with {@link Failure#fromThrowable(Throwable)}.
 */
public interface UploadOutcome {

  static UploadOutcome success(Object value) {
    return new Success(value);
  }

  static UploadOutcome failure(UploadErrorCode code, String message) {
    return new Failure(code, message);
  }

  /** The transfer finished; {@code value} is whatever the upload function produced. */
  record Success(Object value) implements UploadOutcome {}

  /** The transfer failed. */
  record Failure(UploadErrorCode code, String message) implements UploadOutcome {

    public Failure {
      code = code != null ? code : UploadErrorCode.UNKNOWN;
      message = message != null ? message : "Upload failed";
    }

    /**
     * Classify an exception raised by an upload function.
     *
     * @param throwable the failure, possibly wrapped in a completion exception
     * @return the classified failure
     */
    public static Failure fromThrowable(Throwable throwable) {
      Throwable cause = unwrap(throwable);
      String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();

      if (cause instanceof UploadFailureException failure) {
        return new Failure(failure.getCode(), message);
      }
      if (cause instanceof TimeoutException) {
        return new Failure(UploadErrorCode.TIMEOUT, message);
      }
      if (cause instanceof IOException || cause instanceof UncheckedIOException) {
        return new Failure(UploadErrorCode.NETWORK, message);
      }
      return new Failure(UploadErrorCode.UNKNOWN, message);
    }

    private static Throwable unwrap(Throwable throwable) {
      Throwable current = throwable;
      while ((current instanceof CompletionException || current instanceof ExecutionException)
          && current.getCause() != null) {
        current = current.getCause();
      }
      return current;
    }
  }
}

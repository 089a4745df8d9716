package com.scholary.bulkupload.objectstore;

/**
 * Exception thrown when object storage operations fail.
 *
 * <p>Carries the HTTP status reported by the store when there was one, so upload attempts can tell
 * a rejected request from a transient outage.
 */
public class ObjectStoreException extends RuntimeException {

  private final int statusCode;

  public ObjectStoreException(String message) {
    this(message, 0, null);
  }

  public ObjectStoreException(String message, Throwable cause) {
    this(message, 0, cause);
  }

  public ObjectStoreException(String message, int statusCode, Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
  }

  /** HTTP status from the store, or 0 when the request never got a response. */
  public int getStatusCode() {
    return statusCode;
  }
}

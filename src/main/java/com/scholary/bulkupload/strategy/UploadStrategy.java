package com.scholary.bulkupload.strategy;

/** How a single file's bytes are transferred. */
public enum UploadStrategy {
  /** One request carrying the whole file. Used for small files. */
  DIRECT,

  /**
   * Split into fixed-size parts uploaded one after another.
   *
   * <p>Progress is reported per part and cancellation is honoured between parts.
   */
  CHUNKED,

  /** Streamed without buffering. Used for large videos. */
  STREAMING,

  /** Mid-sized files: a single streamed request with progress tracking. */
  HYBRID
}

package com.scholary.bulkupload.file;

import java.io.IOException;
import java.io.InputStream;

/**
 * Handle to the bytes of a file that is about to be uploaded.
 *
 * <p>The orchestration layer never copies content. It only looks at the name, size and content
 * type. The bytes are read by whoever performs the transfer, through {@link #openStream()}.
 */
public interface UploadFile {

  /** File name as presented by the client, including its extension. */
  String name();

  /** Size in bytes. */
  long size();

  /** MIME type, or {@code null} when it could not be determined. */
  String contentType();

  /**
   * Open a fresh stream over the file's bytes.
   *
   * <p>Every call returns a new stream positioned at the start. The caller is responsible for
   * closing it.
   *
   * @return an input stream over the content
   * @throws IOException if the content cannot be read
   */
  InputStream openStream() throws IOException;
}

package com.scholary.bulkupload.file;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URLConnection;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * An {@link UploadFile} backed by a file on the local file system.
 *
 * <p>Size and content type are captured once when the handle is created, so validation and
 * strategy selection see a stable view even if the file changes afterwards.
 */
public record LocalUploadFile(Path path, String name, long size, String contentType)
    implements UploadFile {

  private static final String FALLBACK_CONTENT_TYPE = "application/octet-stream";

  /**
   * Create a handle for a local file, probing its size and content type.
   *
   * @param path the file to upload
   * @return the file handle
   * @throws UncheckedIOException if the file attributes cannot be read
   */
  public static LocalUploadFile of(Path path) {
    try {
      long size = Files.size(path);
      String fileName = path.getFileName() != null ? path.getFileName().toString() : "";
      return new LocalUploadFile(path, fileName, size, detectContentType(path, fileName));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read file attributes: " + path, e);
    }
  }

  @Override
  public InputStream openStream() throws IOException {
    return Files.newInputStream(path);
  }

  private static String detectContentType(Path path, String fileName) throws IOException {
    String detected = Files.probeContentType(path);
    if (detected != null) {
      return detected;
    }
    // The platform detector is often unavailable in slim containers
    String guessed = URLConnection.guessContentTypeFromName(fileName);
    return guessed != null ? guessed : FALLBACK_CONTENT_TYPE;
  }
}

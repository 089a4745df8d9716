package com.scholary.bulkupload.objectstore;

import java.io.InputStream;
import java.util.function.BooleanSupplier;

/**
 * Abstraction for object storage writes.
 *
 * <p>Decouples uploads from a specific storage backend (S3, MinIO). Tests mock this interface.
 */
public interface ObjectStoreClient extends AutoCloseable {

  /**
   * Store an object from a stream in a single request.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @param data the input stream containing object data
   * @param contentLength the size of the object in bytes
   * @param contentType the MIME type of the object
   * @return the ETag assigned by the store
   * @throws ObjectStoreException if the upload fails
   */
  String putObject(
      String bucket, String key, InputStream data, long contentLength, String contentType);

  /**
   * Store an object as a multipart upload.
   *
   * <p>The stream is read one part at a time, so memory use is bounded by the part size. The
   * abort check runs before every part; when it returns true the multipart upload is aborted and
   * an {@link ObjectStoreException} is thrown.
   *
   * @param partSize bytes per part, every part but the last
   * @param abortRequested polled between parts
   * @return the ETag of the completed object
   * @throws ObjectStoreException if any part fails or the upload is aborted
   */
  String putObjectMultipart(
      String bucket,
      String key,
      InputStream data,
      long contentLength,
      String contentType,
      long partSize,
      BooleanSupplier abortRequested);

  /**
   * Get object metadata without downloading the content.
   *
   * @throws ObjectStoreException if the object doesn't exist or retrieval fails
   */
  ObjectMetadata getObjectMetadata(String bucket, String key);

  @Override
  void close();

  /** Object metadata returned by getObjectMetadata. */
  record ObjectMetadata(long contentLength, String contentType) {}
}

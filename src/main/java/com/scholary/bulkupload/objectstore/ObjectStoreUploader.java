package com.scholary.bulkupload.objectstore;

import com.scholary.bulkupload.file.UploadFile;
import com.scholary.bulkupload.queue.CancellationToken;
import com.scholary.bulkupload.queue.UploadErrorCode;
import com.scholary.bulkupload.queue.UploadFunction;
import com.scholary.bulkupload.queue.UploadItemSnapshot;
import com.scholary.bulkupload.queue.UploadOutcome;
import com.scholary.bulkupload.queue.UploadTask;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Uploads queued files to the object store.
 *
 * <p>The strategy picked at validation time decides the wire protocol:
 *
 * <ul>
 *   <li>DIRECT, HYBRID, STREAMING: one streaming PUT
 *   <li>CHUNKED: S3 multipart upload, checking for cancellation between parts
 * </ul>
 *
 * <p>Transfers block, so they run on the {@code uploadExecutor} pool. Cancelling an attempt closes
 * its source stream, which fails any read in progress.
 *
 * <p>Objects are stored under {@code <keyPrefix>/<batchId>/<fileId>/<fileName>}.
 */
@Component
public class ObjectStoreUploader {

  private static final Logger LOGGER = LoggerFactory.getLogger(ObjectStoreUploader.class);

  private final ObjectStoreClient objectStoreClient;
  private final ObjectStoreProperties properties;
  private final Executor executor;

  public ObjectStoreUploader(
      ObjectStoreClient objectStoreClient,
      ObjectStoreProperties properties,
      @Qualifier("uploadExecutor") Executor executor) {
    this.objectStoreClient = objectStoreClient;
    this.properties = properties;
    this.executor = executor;
  }

  /** An upload function writing the files of one batch. */
  public UploadFunction forBatch(String batchId) {
    return task -> CompletableFuture.supplyAsync(() -> upload(batchId, task), executor);
  }

  UploadOutcome upload(String batchId, UploadTask task) {
    UploadItemSnapshot item = task.item();
    UploadFile file = item.file();
    CancellationToken token = task.token();
    String bucket = properties.bucket();
    String key = objectKey(batchId, item.id(), file.name());

    LOGGER.debug(
        "Transferring file: key={}, size={}, strategy={}, attempt={}",
        key,
        file.size(),
        item.strategy(),
        task.attempt());

    try {
      token.throwIfCancelled();

      try (InputStream source = file.openStream();
          ProgressInputStream in =
              new ProgressInputStream(source, file.size(), task::reportProgress)) {
        token.onCancel(() -> closeOnCancel(in, key));

        String eTag =
            switch (item.strategy()) {
              case CHUNKED -> objectStoreClient.putObjectMultipart(
                  bucket,
                  key,
                  in,
                  file.size(),
                  file.contentType(),
                  properties.multipartPartSize(),
                  token::isCancelled);
              case DIRECT, HYBRID, STREAMING -> objectStoreClient.putObject(
                  bucket, key, in, file.size(), file.contentType());
            };

        task.reportProgress(100);
        return UploadOutcome.success(
            new StoredObject(bucket, key, file.size(), item.strategy(), eTag));
      }

    } catch (CancellationException e) {
      return cancelled(token);

    } catch (ObjectStoreException e) {
      return token.isCancelled() ? cancelled(token) : classify(e);

    } catch (IOException | UncheckedIOException e) {
      if (token.isCancelled()) {
        return cancelled(token);
      }
      LOGGER.warn("Failed reading upload source: key={}, error={}", key, e.getMessage());
      return UploadOutcome.failure(UploadErrorCode.NETWORK, "Failed reading file: " + e.getMessage());
    }
  }

  String objectKey(String batchId, String fileId, String fileName) {
    String prefix = properties.keyPrefix();
    String path = batchId + "/" + fileId + "/" + fileName;
    if (prefix == null || prefix.isBlank()) {
      return path;
    }
    return prefix.endsWith("/") ? prefix + path : prefix + "/" + path;
  }

  /** Map a store failure onto the queue's retry classes by HTTP status. */
  static UploadOutcome classify(ObjectStoreException e) {
    int status = e.getStatusCode();
    UploadErrorCode code;
    if (status == 408) {
      code = UploadErrorCode.TIMEOUT;
    } else if (status == 429 || status >= 500) {
      code = UploadErrorCode.SERVER;
    } else if (status >= 400) {
      code = UploadErrorCode.CLIENT;
    } else {
      code = UploadErrorCode.NETWORK;
    }
    return UploadOutcome.failure(code, e.getMessage());
  }

  private static UploadOutcome cancelled(CancellationToken token) {
    return UploadOutcome.failure(UploadErrorCode.CANCELLED, "Upload aborted: " + token.reason());
  }

  private static void closeOnCancel(InputStream in, String key) {
    try {
      in.close();
    } catch (IOException e) {
      LOGGER.debug("Failed closing source of aborted upload: key={}", key, e);
    }
  }
}

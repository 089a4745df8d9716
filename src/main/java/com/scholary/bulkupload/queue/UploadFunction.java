package com.scholary.bulkupload.queue;

import java.util.concurrent.CompletableFuture;

/**
 * Performs the transfer of one file.
 *
 * <p>The manager does not know how bytes travel. It only needs a future that settles with an
 * {@link UploadOutcome}, or completes exceptionally. Implementations should return quickly and do
 * the blocking work elsewhere, and should stop early once the task's token is cancelled.
 */
@FunctionalInterface
public interface UploadFunction {

  CompletableFuture<UploadOutcome> upload(UploadTask task);
}

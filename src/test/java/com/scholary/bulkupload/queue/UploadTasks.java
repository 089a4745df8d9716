package com.scholary.bulkupload.queue;

import com.scholary.bulkupload.file.UploadFile;
import com.scholary.bulkupload.strategy.UploadStrategy;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Builds upload tasks outside a manager, recording reported progress. */
public final class UploadTasks {

  private UploadTasks() {}

  public static Recorded task(String fileId, UploadFile file, UploadStrategy strategy) {
    UploadItemSnapshot item =
        new UploadItemSnapshot(
            fileId, file, strategy, UploadStatus.UPLOADING, 0, 0, null, null, null, null, null);
    CancellationToken token = new CancellationToken();
    List<Integer> progress = new CopyOnWriteArrayList<>();
    return new Recorded(new UploadTask(item, 1, token, progress::add), token, progress);
  }

  /** A task together with its token and every percentage it reported. */
  public record Recorded(UploadTask task, CancellationToken token, List<Integer> progress) {}
}

package com.scholary.bulkupload.service;

import com.scholary.bulkupload.batch.BatchRepository;
import com.scholary.bulkupload.batch.UploadBatch;
import com.scholary.bulkupload.file.LocalUploadFile;
import com.scholary.bulkupload.file.UploadFile;
import com.scholary.bulkupload.objectstore.ObjectStoreUploader;
import com.scholary.bulkupload.queue.QueuedFile;
import com.scholary.bulkupload.queue.UploadQueueManager;
import com.scholary.bulkupload.queue.UploadQueueManagerFactory;
import com.scholary.bulkupload.strategy.StrategySelector;
import com.scholary.bulkupload.validation.BatchValidationResult;
import com.scholary.bulkupload.validation.FileRejection;
import com.scholary.bulkupload.validation.FileValidator;
import com.scholary.bulkupload.validation.ValidationResult;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Turns lists of server-local file paths into running upload batches.
 *
 * <p>Pipeline per batch:
 *
 * <ol>
 *   <li>resolve paths; missing files are rejected
 *   <li>validate the batch (quota, names, sizes, types), then sniff file headers
 *   <li>select a strategy per accepted file
 *   <li>queue everything on a fresh {@link UploadQueueManager} and start it
 * </ol>
 */
@Service
public class BulkUploadService {

  private static final Logger LOGGER = LoggerFactory.getLogger(BulkUploadService.class);

  private final FileValidator validator;
  private final StrategySelector strategySelector;
  private final UploadQueueManagerFactory managerFactory;
  private final ObjectStoreUploader uploader;
  private final BatchRepository batchRepository;
  private final Clock clock;
  private final Executor executor;

  public BulkUploadService(
      FileValidator validator,
      StrategySelector strategySelector,
      UploadQueueManagerFactory managerFactory,
      ObjectStoreUploader uploader,
      BatchRepository batchRepository,
      Clock clock,
      @Qualifier("uploadExecutor") Executor executor) {
    this.validator = validator;
    this.strategySelector = strategySelector;
    this.managerFactory = managerFactory;
    this.uploader = uploader;
    this.batchRepository = batchRepository;
    this.clock = clock;
    this.executor = executor;
  }

  /**
   * Validate files without uploading anything.
   *
   * @param filePaths server-local paths
   * @return accepted files with their strategies, and everything rejected
   */
  public ValidatedBatch validate(List<String> filePaths) {
    List<UploadFile> found = new ArrayList<>();
    List<FileRejection> rejections = new ArrayList<>();
    for (String filePath : filePaths) {
      resolve(filePath, rejections).ifPresent(found::add);
    }

    BatchValidationResult batchResult = validator.validateFiles(found, 0);
    rejections.addAll(batchResult.rejections());

    List<UploadFile> candidates = batchResult.validFiles();
    List<CompletableFuture<ValidationResult>> contentChecks = new ArrayList<>();
    for (UploadFile file : candidates) {
      contentChecks.add(validator.validateFileContent(file, executor));
    }

    List<QueuedFile> accepted = new ArrayList<>();
    long totalSize = 0;
    for (int i = 0; i < candidates.size(); i++) {
      UploadFile file = candidates.get(i);
      ValidationResult content = contentChecks.get(i).join();
      if (!content.valid()) {
        rejections.add(new FileRejection(file.name(), content.error()));
        continue;
      }
      accepted.add(QueuedFile.of(file, strategySelector.selectStrategy(file)));
      totalSize += file.size();
    }

    LOGGER.info(
        "Validated {} paths: accepted={}, rejected={}, batchErrors={}",
        filePaths.size(),
        accepted.size(),
        rejections.size(),
        batchResult.batchErrors().size());
    return new ValidatedBatch(accepted, rejections, batchResult.batchErrors(), totalSize);
  }

  /**
   * Validate the files and start uploading the accepted ones as a new batch.
   *
   * @throws InvalidBatchException if no file was accepted
   */
  public UploadBatch createBatch(List<String> filePaths) {
    ValidatedBatch validation = validate(filePaths);
    if (!validation.hasUploadableFiles()) {
      throw new InvalidBatchException("No file passed validation", validation);
    }

    String batchId = UUID.randomUUID().toString();
    UploadQueueManager manager = managerFactory.create(batchId);
    manager.addListener(new BatchProgressListener(batchId));
    manager.addFiles(validation.files());

    UploadBatch batch =
        new UploadBatch(
            batchId, manager, validation.rejections(), validation.batchErrors(), clock.instant());
    batchRepository.save(batch);

    LOGGER.info(
        "Created batch: batchId={}, files={}, totalSize={} bytes",
        batchId,
        validation.files().size(),
        validation.totalSize());
    manager.startUpload(uploader.forBatch(batchId));
    return batch;
  }

  public UploadBatch getBatch(String batchId) {
    return batchRepository
        .findById(batchId)
        .orElseThrow(() -> new BatchNotFoundException(batchId));
  }

  public UploadBatch pause(String batchId) {
    UploadBatch batch = getBatch(batchId);
    batch.getManager().pauseUpload();
    return batch;
  }

  public UploadBatch resume(String batchId) {
    UploadBatch batch = getBatch(batchId);
    batch.getManager().resumeUpload(uploader.forBatch(batchId));
    return batch;
  }

  public UploadBatch retryFailed(String batchId) {
    UploadBatch batch = getBatch(batchId);
    batch.getManager().retryFailedFiles(uploader.forBatch(batchId));
    return batch;
  }

  /**
   * Cancel a single file of a batch.
   *
   * @throws NoSuchElementException if the batch has no such file
   */
  public UploadBatch cancelFile(String batchId, String fileId) {
    UploadBatch batch = getBatch(batchId);
    UploadQueueManager manager = batch.getManager();
    if (manager.getFile(fileId).isEmpty()) {
      throw new NoSuchElementException("File not found in batch: " + fileId);
    }
    manager.cancelUpload(fileId);
    return batch;
  }

  /** Abort every upload of the batch and forget it. */
  public void delete(String batchId) {
    getBatch(batchId);
    batchRepository.delete(batchId);
    LOGGER.info("Deleted batch: batchId={}", batchId);
  }

  private Optional<UploadFile> resolve(String filePath, List<FileRejection> rejections) {
    try {
      Path path = Path.of(filePath);
      if (!Files.isRegularFile(path)) {
        rejections.add(new FileRejection(filePath, "File not found"));
        return Optional.empty();
      }
      return Optional.of(LocalUploadFile.of(path));
    } catch (InvalidPathException e) {
      rejections.add(new FileRejection(filePath, "Invalid path: " + e.getReason()));
      return Optional.empty();
    } catch (UncheckedIOException e) {
      LOGGER.warn("Could not read file attributes: path={}", filePath, e);
      rejections.add(new FileRejection(filePath, "File could not be read"));
      return Optional.empty();
    }
  }
}

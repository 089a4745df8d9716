package com.scholary.bulkupload.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;

import com.scholary.bulkupload.batch.BatchRepository;
import com.scholary.bulkupload.batch.UploadBatch;
import com.scholary.bulkupload.objectstore.ObjectStoreUploader;
import com.scholary.bulkupload.progress.ProgressAggregator;
import com.scholary.bulkupload.queue.ManualDelayScheduler;
import com.scholary.bulkupload.queue.MutableClock;
import com.scholary.bulkupload.queue.QueuedFile;
import com.scholary.bulkupload.queue.ScriptedUploadFunction;
import com.scholary.bulkupload.queue.UploadErrorCode;
import com.scholary.bulkupload.queue.UploadItemSnapshot;
import com.scholary.bulkupload.queue.UploadQueueManager;
import com.scholary.bulkupload.queue.UploadQueueManagerFactory;
import com.scholary.bulkupload.queue.UploadQueueProperties;
import com.scholary.bulkupload.queue.UploadStatus;
import com.scholary.bulkupload.strategy.StrategyProperties;
import com.scholary.bulkupload.strategy.StrategySelector;
import com.scholary.bulkupload.strategy.UploadStrategy;
import com.scholary.bulkupload.validation.FileRejection;
import com.scholary.bulkupload.validation.FileValidator;
import com.scholary.bulkupload.validation.ValidationProperties;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class BulkUploadServiceTest {

  private static final byte[] PNG_HEADER = {
    (byte) 0x89, 0x50, 0x4E, 0x47, 0x0D, 0x0A, 0x1A, 0x0A, 0, 0, 0, 0x0D
  };

  @Mock private ObjectStoreUploader uploader;

  @TempDir Path tempDir;

  private final ScriptedUploadFunction uploads = new ScriptedUploadFunction();
  private BatchRepository batchRepository;
  private BulkUploadService service;

  @BeforeEach
  void setUp() {
    MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    UploadQueueManagerFactory factory =
        new UploadQueueManagerFactory(
            new UploadQueueProperties(1, 0, Duration.ofSeconds(1), Duration.ofSeconds(30), 1),
            new ManualDelayScheduler(),
            clock,
            new ProgressAggregator());
    batchRepository = new BatchRepository(100, 60);
    service =
        new BulkUploadService(
            new FileValidator(
                new ValidationProperties(
                    1024 * 1024, 10, List.of("image/*", "video/*", "application/pdf"))),
            new StrategySelector(StrategyProperties.defaults()),
            factory,
            uploader,
            batchRepository,
            clock,
            Runnable::run);
    lenient().when(uploader.forBatch(anyString())).thenReturn(uploads);
  }

  private String png(String name) throws IOException {
    Path file = tempDir.resolve(name);
    Files.write(file, PNG_HEADER);
    return file.toString();
  }

  private String file(String name, String content) throws IOException {
    Path file = tempDir.resolve(name);
    Files.writeString(file, content, StandardCharsets.UTF_8);
    return file.toString();
  }

  @Test
  void validate_shouldSplitAcceptedAndRejectedFiles() throws IOException {
    String good = png("good.png");
    String fake = file("fake.png", "not really an image");
    String text = file("notes.txt", "hello");
    String missing = tempDir.resolve("missing.png").toString();

    ValidatedBatch result = service.validate(List.of(good, fake, text, missing));

    assertThat(result.files()).singleElement().satisfies(
        queued -> {
          assertThat(queued.file().name()).isEqualTo("good.png");
          assertThat(queued.strategy()).isEqualTo(UploadStrategy.DIRECT);
          assertThat(queued.id()).startsWith("upl_");
        });
    assertThat(result.totalSize()).isEqualTo(PNG_HEADER.length);
    assertThat(result.rejections())
        .extracting(FileRejection::error)
        .anySatisfy(error -> assertThat(error).isEqualTo("File not found"))
        .anySatisfy(error -> assertThat(error).startsWith("Unsupported file type"))
        .anySatisfy(error -> assertThat(error).startsWith("File appears to be corrupted"));
    assertThat(result.hasUploadableFiles()).isTrue();
  }

  @Test
  void createBatch_shouldRejectBatchWithoutValidFiles() throws IOException {
    String text = file("notes.txt", "hello");

    assertThatThrownBy(() -> service.createBatch(List.of(text)))
        .isInstanceOf(InvalidBatchException.class)
        .satisfies(
            e ->
                assertThat(((InvalidBatchException) e).getValidation().rejections()).hasSize(1));
    assertThat(batchRepository.size()).isZero();
  }

  @Test
  void createBatch_shouldQueueAndStartAcceptedFiles() throws IOException {
    UploadBatch batch = service.createBatch(List.of(png("a.png"), png("b.png")));

    assertThat(service.getBatch(batch.getBatchId())).isSameAs(batch);
    verify(uploader).forBatch(batch.getBatchId());
    UploadQueueManager manager = batch.getManager();
    assertThat(manager.getFiles()).hasSize(2);
    assertThat(manager.getFilesByStatus(UploadStatus.UPLOADING)).hasSize(1);
    assertThat(manager.getFilesByStatus(UploadStatus.PENDING)).hasSize(1);

    String first = uploads.calledFileIds().get(0);
    uploads.succeed(first);

    assertThat(manager.getFile(first)).map(UploadItemSnapshot::status).contains(UploadStatus.COMPLETED);
    assertThat(uploads.calls()).hasSize(2);
  }

  @Test
  void pauseAndResume_shouldControlAdmission() throws IOException {
    UploadBatch batch = service.createBatch(List.of(png("a.png"), png("b.png")));
    String first = uploads.calledFileIds().get(0);

    service.pause(batch.getBatchId());
    uploads.succeed(first);

    assertThat(batch.getManager().isPaused()).isTrue();
    assertThat(uploads.calls()).hasSize(1);

    service.resume(batch.getBatchId());

    assertThat(uploads.calls()).hasSize(2);
  }

  @Test
  void retryFailed_shouldRequeueErroredFiles() throws IOException {
    UploadBatch batch = service.createBatch(List.of(png("a.png")));
    String fileId = uploads.calledFileIds().get(0);
    uploads.fail(fileId, UploadErrorCode.SERVER);
    assertThat(batch.getManager().getFile(fileId))
        .map(UploadItemSnapshot::status)
        .contains(UploadStatus.ERROR);

    service.retryFailed(batch.getBatchId());

    assertThat(batch.getManager().getFile(fileId))
        .map(UploadItemSnapshot::retryCount)
        .contains(1);
    assertThat(uploads.calls()).hasSize(2);
  }

  @Test
  void cancelFile_shouldCancelKnownFilesOnly() throws IOException {
    UploadBatch batch = service.createBatch(List.of(png("a.png"), png("b.png")));
    String pending =
        batch.getManager().getFilesByStatus(UploadStatus.PENDING).get(0).id();

    service.cancelFile(batch.getBatchId(), pending);

    assertThat(batch.getManager().getFile(pending))
        .map(UploadItemSnapshot::status)
        .contains(UploadStatus.CANCELLED);
    assertThatThrownBy(() -> service.cancelFile(batch.getBatchId(), "upl_unknown"))
        .isInstanceOf(NoSuchElementException.class)
        .hasMessage("File not found in batch: upl_unknown");
  }

  @Test
  void delete_shouldAbortUploadsAndForgetBatch() throws IOException {
    UploadBatch batch = service.createBatch(List.of(png("a.png")));
    String fileId = uploads.calledFileIds().get(0);

    service.delete(batch.getBatchId());

    assertThat(uploads.lastCall(fileId).task().token().isCancelled()).isTrue();
    assertThat(batch.getManager().getFiles()).isEmpty();
    assertThatThrownBy(() -> service.getBatch(batch.getBatchId()))
        .isInstanceOf(BatchNotFoundException.class);
  }

  @Test
  void getBatch_shouldFailForUnknownBatch() {
    assertThatThrownBy(() -> service.getBatch("nope"))
        .isInstanceOf(BatchNotFoundException.class)
        .hasMessage("Batch not found: nope");
  }

  @Test
  void validate_shouldNotQueueAnything() throws IOException {
    ValidatedBatch result = service.validate(List.of(png("a.png")));

    assertThat(result.files()).extracting(QueuedFile::strategy).containsExactly(UploadStrategy.DIRECT);
    assertThat(uploads.calls()).isEmpty();
    assertThat(batchRepository.size()).isZero();
  }
}

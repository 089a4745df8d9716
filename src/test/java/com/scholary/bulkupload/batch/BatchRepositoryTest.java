package com.scholary.bulkupload.batch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.bulkupload.progress.ProgressAggregator;
import com.scholary.bulkupload.queue.ManualDelayScheduler;
import com.scholary.bulkupload.queue.MutableClock;
import com.scholary.bulkupload.queue.QueueOptions;
import com.scholary.bulkupload.queue.UploadQueueException;
import com.scholary.bulkupload.queue.UploadQueueManager;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BatchRepositoryTest {

  private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

  private final AtomicLong nanos = new AtomicLong();
  private BatchRepository repository;

  @BeforeEach
  void setUp() {
    repository = new BatchRepository(2, Duration.ofMinutes(60), nanos::get);
  }

  private static UploadBatch batch(String batchId) {
    UploadQueueManager manager =
        new UploadQueueManager(
            batchId,
            QueueOptions.defaults(),
            new ManualDelayScheduler(),
            new MutableClock(NOW),
            new ProgressAggregator());
    return new UploadBatch(batchId, manager, List.of(), List.of(), NOW);
  }

  private static boolean isClosed(UploadBatch batch) {
    try {
      batch.getManager().addFiles(List.of());
      return false;
    } catch (UploadQueueException e) {
      return true;
    }
  }

  @Test
  void findById_shouldReturnSavedBatch() {
    UploadBatch batch = batch("b1");
    repository.save(batch);

    assertThat(repository.findById("b1")).containsSame(batch);
    assertThat(repository.findById("missing")).isEmpty();
  }

  @Test
  void delete_shouldCloseTheBatchQueue() {
    UploadBatch batch = batch("b1");
    repository.save(batch);

    repository.delete("b1");

    assertThat(repository.findById("b1")).isEmpty();
    assertThat(isClosed(batch)).isTrue();
  }

  @Test
  void expiry_shouldCloseIdleBatches() {
    UploadBatch idle = batch("idle");
    repository.save(idle);

    nanos.addAndGet(TimeUnit.MINUTES.toNanos(61));
    repository.cleanUp();

    assertThat(repository.findById("idle")).isEmpty();
    assertThat(isClosed(idle)).isTrue();
  }

  @Test
  void expiry_shouldCountFromLastAccess() {
    UploadBatch polled = batch("polled");
    repository.save(polled);

    nanos.addAndGet(TimeUnit.MINUTES.toNanos(40));
    assertThat(repository.findById("polled")).isPresent();
    nanos.addAndGet(TimeUnit.MINUTES.toNanos(40));
    repository.cleanUp();

    assertThat(repository.findById("polled")).isPresent();
    assertThat(isClosed(polled)).isFalse();
  }

  @Test
  void save_shouldNotCloseQueueWhenReplacingSameBatch() {
    UploadBatch batch = batch("b1");
    repository.save(batch);

    assertThatCode(() -> repository.save(batch)).doesNotThrowAnyException();

    assertThat(isClosed(batch)).isFalse();
  }

  @Test
  void size_shouldStayWithinMaximum() {
    repository.save(batch("b1"));
    repository.save(batch("b2"));
    repository.save(batch("b3"));

    assertThat(repository.size()).isLessThanOrEqualTo(2);
  }

  @Test
  void closedQueue_shouldRejectFurtherWork() {
    UploadBatch batch = batch("b1");
    repository.save(batch);
    repository.delete("b1");

    assertThatThrownBy(() -> batch.getManager().addFiles(List.of()))
        .isInstanceOf(UploadQueueException.class)
        .hasMessageContaining("closed");
  }
}

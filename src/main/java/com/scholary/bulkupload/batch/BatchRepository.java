package com.scholary.bulkupload.batch;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory repository for upload batches.
 *
 * <p>Uses Caffeine cache for automatic eviction of idle batches. A batch leaving the cache, by
 * eviction or explicit deletion, has its queue closed: in-flight uploads are aborted and nothing
 * further is admitted.
 *
 * <p>Expiry counts from the last access, so a batch that is still being polled stays alive.
 */
@Repository
public class BatchRepository {

  private static final Logger LOGGER = LoggerFactory.getLogger(BatchRepository.class);

  private final Cache<String, UploadBatch> cache;

  @Autowired
  public BatchRepository(
      @Value("${batchstore.maxSize}") int maxSize,
      @Value("${batchstore.expireAfterMinutes}") int expireAfterMinutes) {
    this(maxSize, Duration.ofMinutes(expireAfterMinutes), Ticker.systemTicker());
  }

  BatchRepository(int maxSize, Duration expireAfterAccess, Ticker ticker) {
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterAccess(expireAfterAccess)
            .ticker(ticker)
            .executor(Runnable::run)
            .removalListener(
                (String batchId, UploadBatch batch, RemovalCause cause) ->
                    onRemoval(batchId, batch, cause))
            .build();
  }

  public void save(UploadBatch batch) {
    cache.put(batch.getBatchId(), batch);
  }

  public Optional<UploadBatch> findById(String batchId) {
    return Optional.ofNullable(cache.getIfPresent(batchId));
  }

  public void delete(String batchId) {
    cache.invalidate(batchId);
  }

  public long size() {
    cache.cleanUp();
    return cache.estimatedSize();
  }

  /** Run pending evictions now instead of on the next cache access. */
  void cleanUp() {
    cache.cleanUp();
  }

  private void onRemoval(String batchId, UploadBatch batch, RemovalCause cause) {
    if (batch == null || cause == RemovalCause.REPLACED) {
      return;
    }
    LOGGER.info("Closing batch: batchId={}, cause={}", batchId, cause);
    batch.getManager().close();
  }
}

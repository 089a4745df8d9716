package com.scholary.bulkupload.queue;

import com.scholary.bulkupload.logging.StructuredLogger;
import com.scholary.bulkupload.progress.ProgressAggregator;
import com.scholary.bulkupload.progress.ProgressSnapshot;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives a batch of uploads through a bounded pool of concurrent attempts.
 *
 * <p>The manager owns:
 *
 * <ul>
 *   <li>the per-file state machine (see {@link UploadStatus})
 *   <li>a FIFO queue of pending files
 *   <li>the active set, never larger than {@link QueueOptions#concurrency()}
 *   <li>retry with linear backoff, a hard timeout per attempt
 *   <li>pause, resume and cancellation
 * </ul>
 *
 * <p>Threading: every state transition happens while holding a single lock. Upload results may
 * arrive on any thread. Upload functions are always invoked outside the lock, and a drain loop
 * keeps synchronous completions from recursing.
 *
 * <p>Admission only happens in {@code fillSlots()}, under the lock. It runs after every settled
 * attempt and on start, resume, retry and backoff expiry, and stops at the concurrency limit.
 *
 * <p>Retried files go to the <em>front</em> of the queue, ahead of files never attempted.
 */
public class UploadQueueManager implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(UploadQueueManager.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final String name;
  private final DelayScheduler scheduler;
  private final Clock clock;
  private final ProgressAggregator progressAggregator;

  private final Object lock = new Object();
  private final Map<String, UploadItem> items = new LinkedHashMap<>();
  private final Deque<String> queue = new ArrayDeque<>();
  private final Map<String, Attempt> active = new LinkedHashMap<>();
  private final Map<String, DelayScheduler.Scheduled> retryTimers = new HashMap<>();
  private final List<UploadQueueListener> listeners = new CopyOnWriteArrayList<>();

  private final Queue<Attempt> launchQueue = new ConcurrentLinkedQueue<>();
  private final AtomicBoolean launching = new AtomicBoolean();

  private QueueOptions options;
  private UploadFunction uploadFunction;
  private boolean paused;
  private boolean closed;
  private Instant startedAt;
  private Instant idleSince;
  private CompletableFuture<List<Object>> run;

  public UploadQueueManager(
      String name,
      QueueOptions options,
      DelayScheduler scheduler,
      Clock clock,
      ProgressAggregator progressAggregator) {
    this.name = Objects.requireNonNull(name, "name");
    this.options = Objects.requireNonNull(options, "options");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.progressAggregator = Objects.requireNonNull(progressAggregator, "progressAggregator");
  }

  public void addListener(UploadQueueListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  /**
   * Add files in PENDING state to the back of the queue.
   *
   * <p>Files are not uploaded until {@link #startUpload} is called, unless a run is already in
   * progress, in which case they are picked up as slots free.
   *
   * @param files validated files with their strategies
   * @return snapshots of the added files
   * @throws UploadQueueException if an identifier is already present
   */
  public List<UploadItemSnapshot> addFiles(Collection<QueuedFile> files) {
    synchronized (lock) {
      ensureOpen();
      Set<String> seen = new HashSet<>();
      for (QueuedFile file : files) {
        if (items.containsKey(file.id()) || !seen.add(file.id())) {
          throw new UploadQueueException("File already queued: " + file.id());
        }
      }

      List<UploadItemSnapshot> added = new ArrayList<>(files.size());
      for (QueuedFile file : files) {
        UploadItem item = new UploadItem(file);
        items.put(item.id(), item);
        queue.addLast(item.id());
        added.add(item.toSnapshot());
      }

      LOGGER.info("Queued {} files: queue={}, total={}", files.size(), name, items.size());
      notifyProgress();
      return added;
    }
  }

  /**
   * Start draining the queue.
   *
   * <p>A no-op when the queue is empty. Otherwise clears the paused flag and fills the active set
   * up to the concurrency limit; every settled attempt admits the next file until the queue is
   * empty.
   *
   * @param function performs one transfer
   * @return a future completing with the results of all completed files once the queue has
   *     drained, or when the run is paused and its in-flight work settled
   */
  public CompletableFuture<List<Object>> startUpload(UploadFunction function) {
    Objects.requireNonNull(function, "function");
    Effects effects = new Effects();
    CompletableFuture<List<Object>> current;

    synchronized (lock) {
      ensureOpen();
      if (queue.isEmpty()) {
        LOGGER.debug("Nothing queued, ignoring start: queue={}", name);
        return run != null ? run : CompletableFuture.completedFuture(completedResults());
      }

      uploadFunction = function;
      unpause();
      current = beginRun(true);
      LOGGER.info(
          "Starting uploads: queue={}, queued={}, concurrency={}",
          name,
          queue.size(),
          options.concurrency());

      effects.launches.addAll(fillSlots());
      notifyProgress();
      checkIdle(effects);
    }

    apply(effects);
    return current;
  }

  /**
   * Stop admitting new work.
   *
   * <p>In-flight attempts are marked PAUSED but not aborted; their results are still recorded
   * when they settle.
   */
  public void pauseUpload() {
    Effects effects = new Effects();
    synchronized (lock) {
      ensureOpen();
      if (paused) {
        return;
      }
      paused = true;

      for (Attempt attempt : active.values()) {
        UploadItem item = items.get(attempt.itemId);
        if (item.status() == UploadStatus.UPLOADING) {
          item.markPaused();
          notifyStatus(item.id(), UploadStatus.PAUSED);
        }
      }

      LOGGER.info(
          "Uploads paused: queue={}, inFlight={}, queued={}", name, active.size(), queue.size());
      notifyProgress();
      checkIdle(effects);
    }
    apply(effects);
  }

  /**
   * Resume after {@link #pauseUpload()}.
   *
   * <p>Paused files are still in flight, so they go back to UPLOADING. Files that failed while
   * paused were already re-queued at the front, and admission restarts from there.
   *
   * @param function performs one transfer
   * @return the future of the resumed run
   */
  public CompletableFuture<List<Object>> resumeUpload(UploadFunction function) {
    Objects.requireNonNull(function, "function");
    Effects effects = new Effects();
    CompletableFuture<List<Object>> current;

    synchronized (lock) {
      ensureOpen();
      if (!paused) {
        return run != null ? run : CompletableFuture.completedFuture(completedResults());
      }

      uploadFunction = function;
      unpause();
      current = beginRun(false);
      LOGGER.info(
          "Uploads resumed: queue={}, inFlight={}, queued={}", name, active.size(), queue.size());

      effects.launches.addAll(fillSlots());
      notifyProgress();
      checkIdle(effects);
    }

    apply(effects);
    return current;
  }

  /**
   * Cancel one file. Its in-flight attempt is aborted and it is never retried.
   *
   * <p>Completed files stay completed. Unknown identifiers are ignored.
   */
  public void cancelUpload(String fileId) {
    Effects effects = new Effects();
    synchronized (lock) {
      ensureOpen();
      UploadItem item = items.get(fileId);
      if (item == null) {
        LOGGER.debug("Cancel ignored for unknown file: queue={}, file={}", name, fileId);
        return;
      }

      boolean freedSlot = detach(fileId, CancellationToken.Reason.CANCELLED);
      if (!item.status().isFinal()) {
        item.cancel(clock.instant());
        LOGGER.info("Upload cancelled: queue={}, file={}", name, fileId);
        notifyStatus(fileId, UploadStatus.CANCELLED);
      }

      notifyProgress();
      if (freedSlot) {
        effects.launches.addAll(fillSlots());
      }
      checkIdle(effects);
    }
    apply(effects);
  }

  /** Cancel any in-flight attempt for the file and forget it entirely. Safe in any state. */
  public void removeFile(String fileId) {
    Effects effects = new Effects();
    synchronized (lock) {
      ensureOpen();
      UploadItem item = items.get(fileId);
      if (item == null) {
        return;
      }

      boolean freedSlot = detach(fileId, CancellationToken.Reason.CANCELLED);
      if (freedSlot) {
        item.cancel(clock.instant());
        notifyStatus(fileId, UploadStatus.CANCELLED);
      }
      items.remove(fileId);
      LOGGER.info("File removed: queue={}, file={}", name, fileId);

      notifyProgress();
      if (freedSlot) {
        effects.launches.addAll(fillSlots());
      }
      checkIdle(effects);
    }
    apply(effects);
  }

  /**
   * Give every file in ERROR another attempt.
   *
   * <p>Manual retries draw on the same retry budget: the retry count is incremented. Retried files
   * go to the front of the queue and draining restarts.
   *
   * @param function performs one transfer
   * @return the future of the run
   */
  public CompletableFuture<List<Object>> retryFailedFiles(UploadFunction function) {
    Objects.requireNonNull(function, "function");
    Effects effects = new Effects();
    CompletableFuture<List<Object>> current;

    synchronized (lock) {
      ensureOpen();
      List<UploadItem> failed =
          items.values().stream().filter(item -> item.status() == UploadStatus.ERROR).toList();
      if (failed.isEmpty()) {
        return run != null ? run : CompletableFuture.completedFuture(completedResults());
      }

      for (UploadItem item : failed) {
        item.requeueForRetry();
        notifyStatus(item.id(), UploadStatus.PENDING);
      }
      for (int i = failed.size() - 1; i >= 0; i--) {
        queue.addFirst(failed.get(i).id());
      }

      uploadFunction = function;
      unpause();
      current = beginRun(true);
      LOGGER.info("Retrying {} failed files: queue={}", failed.size(), name);

      effects.launches.addAll(fillSlots());
      notifyProgress();
      checkIdle(effects);
    }

    apply(effects);
    return current;
  }

  /**
   * Record progress for a file that is in flight.
   *
   * <p>Values are clamped to 0-100 and never move backwards during an attempt. Ignored for files
   * that are not uploading.
   */
  public void updateFileProgress(String fileId, int percent) {
    synchronized (lock) {
      UploadItem item = items.get(fileId);
      if (item == null || !isInFlight(item)) {
        return;
      }
      if (item.updateProgress(percent)) {
        notifyProgress();
      }
    }
  }

  /** Replace the queue options. Takes effect for the next admission, retry and timeout. */
  public void updateOptions(QueueOptions newOptions) {
    Objects.requireNonNull(newOptions, "newOptions");
    synchronized (lock) {
      ensureOpen();
      options = newOptions;
      LOGGER.info("Queue options updated: queue={}, options={}", name, newOptions);
    }
  }

  /**
   * Abort everything and forget every file.
   *
   * <p>In-flight attempts are cancelled, pending backoff timers are dropped and the future of the
   * current run is cancelled.
   */
  public void clearAll() {
    clear(false);
  }

  /** Clear the queue and refuse any further mutation. */
  @Override
  public void close() {
    if (!clear(true)) {
      return;
    }
    listeners.clear();
    LOGGER.debug("Queue closed: queue={}", name);
  }

  /**
   * Abort and forget everything. With {@code close}, the queue is marked closed under the same
   * lock.
   *
   * @return false if the queue had already been closed
   */
  private boolean clear(boolean close) {
    CompletableFuture<List<Object>> abandoned;
    synchronized (lock) {
      if (closed) {
        return false;
      }
      for (Attempt attempt : active.values()) {
        attempt.token.cancel(CancellationToken.Reason.CLEARED);
        attempt.cancelTimeout();
      }
      retryTimers.values().forEach(DelayScheduler.Scheduled::cancel);

      int cleared = items.size();
      active.clear();
      retryTimers.clear();
      queue.clear();
      items.clear();
      paused = false;
      startedAt = null;
      idleSince = null;
      abandoned = run;
      run = null;
      closed = close;

      LOGGER.info("Queue cleared: queue={}, files={}", name, cleared);
      notifyProgress();
    }
    if (abandoned != null) {
      abandoned.cancel(false);
    }
    return true;
  }

  public List<UploadItemSnapshot> getFiles() {
    synchronized (lock) {
      return items.values().stream().map(UploadItem::toSnapshot).toList();
    }
  }

  public List<UploadItemSnapshot> getFilesByStatus(UploadStatus status) {
    synchronized (lock) {
      return items.values().stream()
          .filter(item -> item.status() == status)
          .map(UploadItem::toSnapshot)
          .toList();
    }
  }

  public Optional<UploadItemSnapshot> getFile(String fileId) {
    synchronized (lock) {
      return Optional.ofNullable(items.get(fileId)).map(UploadItem::toSnapshot);
    }
  }

  /**
   * Batch progress.
   *
   * <p>While work is in flight throughput is measured against the current time. Once the queue has
   * drained it is frozen at the moment the run went idle, so repeated calls agree.
   */
  public ProgressSnapshot getProgress() {
    synchronized (lock) {
      return computeProgress();
    }
  }

  /** Number of attempts currently occupying a slot, including paused in-flight files. */
  public int getActiveCount() {
    synchronized (lock) {
      return active.size();
    }
  }

  public boolean isPaused() {
    synchronized (lock) {
      return paused;
    }
  }

  public QueueOptions getOptions() {
    synchronized (lock) {
      return options;
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Transitions. Everything below that touches state is called with the lock held.
  // ---------------------------------------------------------------------------------------------

  private List<Attempt> fillSlots() {
    List<Attempt> admitted = new ArrayList<>();
    if (uploadFunction == null) {
      return admitted;
    }
    while (!paused && !closed && active.size() < options.concurrency() && !queue.isEmpty()) {
      String fileId = queue.pollFirst();
      UploadItem item = items.get(fileId);
      if (item == null || item.status() != UploadStatus.PENDING) {
        continue;
      }
      admitted.add(admit(item));
    }
    return admitted;
  }

  private Attempt admit(UploadItem item) {
    Instant now = clock.instant();
    item.markUploading(now);

    Attempt attempt = new Attempt(item.id(), item.retryCount() + 1, uploadFunction, now);
    attempt.task =
        new UploadTask(
            item.toSnapshot(),
            attempt.number,
            attempt.token,
            percent -> reportProgress(attempt, percent));
    active.put(item.id(), attempt);
    attempt.timeout = scheduleTimeout(attempt);

    structuredLogger.logAttemptStarted(
        item.id(), item.file().name(), attempt.task.item().strategy().name(), attempt.number, active.size());
    notifyStatus(item.id(), UploadStatus.UPLOADING);
    return attempt;
  }

  private DelayScheduler.Scheduled scheduleTimeout(Attempt attempt) {
    Duration timeout = options.timeout();
    try {
      return scheduler.schedule(() -> onTimeout(attempt, timeout), timeout);
    } catch (RejectedExecutionException e) {
      LOGGER.error("Could not schedule timeout: queue={}, file={}", name, attempt.itemId, e);
      notifyError(
          new UploadQueueException("Could not schedule timeout for " + attempt.itemId, e));
      return null;
    }
  }

  private void onTimeout(Attempt attempt, Duration timeout) {
    if (attempt.token.cancel(CancellationToken.Reason.TIMED_OUT)) {
      settle(
          attempt,
          null,
          new TimeoutException(
              String.format("Upload timed out after %d ms", timeout.toMillis())));
    }
  }

  private void settle(Attempt attempt, UploadOutcome outcome, Throwable error) {
    Effects effects = new Effects();
    synchronized (lock) {
      if (active.get(attempt.itemId) != attempt) {
        LOGGER.debug(
            "Ignoring stale result: queue={}, file={}, attempt={}",
            name,
            attempt.itemId,
            attempt.number);
        return;
      }
      active.remove(attempt.itemId);
      attempt.cancelTimeout();

      UploadItem item = items.get(attempt.itemId);
      Instant now = clock.instant();

      if (error == null && outcome instanceof UploadOutcome.Success success) {
        item.complete(success.value(), now);
        structuredLogger.logAttemptSucceeded(
            item.id(), attempt.number, Duration.between(attempt.startedAt, now).toMillis());
        notifyStatus(item.id(), UploadStatus.COMPLETED);
      } else {
        handleFailure(item, attempt, toFailure(outcome, error), now);
      }

      notifyProgress();
      effects.launches.addAll(fillSlots());
      checkIdle(effects);
    }
    apply(effects);
  }

  private void handleFailure(
      UploadItem item, Attempt attempt, UploadOutcome.Failure failure, Instant now) {
    if (attempt.token.isExplicitlyCancelled()) {
      item.cancel(now);
      notifyStatus(item.id(), UploadStatus.CANCELLED);
      return;
    }

    int retriesSoFar = item.retryCount();
    if (failure.code().isRetryable() && retriesSoFar < options.maxRetries()) {
      item.requeueForRetry();
      Duration delay = options.retryDelay().multipliedBy(retriesSoFar + 1L);
      structuredLogger.logRetryScheduled(
          item.id(),
          item.retryCount(),
          options.maxRetries(),
          failure.code().name(),
          failure.message(),
          delay.toMillis());
      notifyStatus(item.id(), UploadStatus.PENDING);
      scheduleRetry(item, delay, failure, now);
      return;
    }

    item.fail(failure, now);
    structuredLogger.logUploadFailed(
        item.id(), item.retryCount(), failure.code().name(), failure.message());
    notifyStatus(item.id(), UploadStatus.ERROR);
  }

  private void scheduleRetry(
      UploadItem item, Duration delay, UploadOutcome.Failure failure, Instant now) {
    String fileId = item.id();
    try {
      retryTimers.put(fileId, scheduler.schedule(() -> requeueAfterBackoff(fileId), delay));
    } catch (RejectedExecutionException e) {
      LOGGER.error("Could not schedule retry: queue={}, file={}", name, fileId, e);
      item.fail(failure, now);
      notifyStatus(fileId, UploadStatus.ERROR);
      notifyError(new UploadQueueException("Could not schedule retry for " + fileId, e));
    }
  }

  private void requeueAfterBackoff(String fileId) {
    Effects effects = new Effects();
    synchronized (lock) {
      if (retryTimers.remove(fileId) == null) {
        return;
      }
      UploadItem item = items.get(fileId);
      if (item != null && item.status() == UploadStatus.PENDING) {
        queue.addFirst(fileId);
        LOGGER.debug("Backoff elapsed, re-queued at front: queue={}, file={}", name, fileId);
        effects.launches.addAll(fillSlots());
      }
      checkIdle(effects);
    }
    apply(effects);
  }

  private void reportProgress(Attempt attempt, int percent) {
    synchronized (lock) {
      if (active.get(attempt.itemId) != attempt) {
        return;
      }
      UploadItem item = items.get(attempt.itemId);
      if (item.updateProgress(percent)) {
        notifyProgress();
      }
    }
  }

  /**
   * Take a file out of the queue, the active set and the backoff timers.
   *
   * @return true if an in-flight attempt was aborted, freeing a slot
   */
  private boolean detach(String fileId, CancellationToken.Reason reason) {
    queue.remove(fileId);
    DelayScheduler.Scheduled timer = retryTimers.remove(fileId);
    if (timer != null) {
      timer.cancel();
    }
    Attempt attempt = active.remove(fileId);
    if (attempt == null) {
      return false;
    }
    attempt.token.cancel(reason);
    attempt.cancelTimeout();
    return true;
  }

  private void unpause() {
    if (!paused) {
      return;
    }
    paused = false;
    for (Attempt attempt : active.values()) {
      UploadItem item = items.get(attempt.itemId);
      if (item.status() == UploadStatus.PAUSED) {
        item.markResumedInFlight();
        notifyStatus(item.id(), UploadStatus.UPLOADING);
      }
    }
  }

  private CompletableFuture<List<Object>> beginRun(boolean restartClock) {
    idleSince = null;
    if (run == null) {
      run = new CompletableFuture<>();
      if (restartClock || startedAt == null) {
        startedAt = clock.instant();
      }
    }
    return run;
  }

  /** Finish the current run once nothing is in flight, waiting on backoff, or admissible. */
  private void checkIdle(Effects effects) {
    if (run == null) {
      return;
    }
    if (!active.isEmpty() || !retryTimers.isEmpty()) {
      return;
    }
    if (!queue.isEmpty() && !paused) {
      return;
    }

    idleSince = clock.instant();
    List<Object> results = completedResults();
    effects.finishedRun = run;
    effects.results = results;
    run = null;

    ProgressSnapshot progress = computeProgress();
    LOGGER.info(
        "Upload run settled: queue={}, completed={}, failed={}, cancelled={}, paused={}",
        name,
        progress.completed(),
        progress.failed(),
        progress.cancelled(),
        paused);
    if (!paused) {
      dispatch(listener -> listener.onComplete(results));
    }
  }

  private List<Object> completedResults() {
    List<Object> results = new ArrayList<>();
    for (UploadItem item : items.values()) {
      if (item.status() == UploadStatus.COMPLETED) {
        results.add(item.toSnapshot().result());
      }
    }
    return Collections.unmodifiableList(results);
  }

  private ProgressSnapshot computeProgress() {
    Instant now = run == null && idleSince != null ? idleSince : clock.instant();
    List<UploadItemSnapshot> snapshots =
        items.values().stream().map(UploadItem::toSnapshot).toList();
    return progressAggregator.aggregate(snapshots, startedAt, now);
  }

  private static boolean isInFlight(UploadItem item) {
    return item.status() == UploadStatus.UPLOADING || item.status() == UploadStatus.PAUSED;
  }

  private static UploadOutcome.Failure toFailure(UploadOutcome outcome, Throwable error) {
    if (error != null) {
      return UploadOutcome.Failure.fromThrowable(error);
    }
    if (outcome instanceof UploadOutcome.Failure failure) {
      return failure;
    }
    return new UploadOutcome.Failure(UploadErrorCode.UNKNOWN, "Upload function returned no outcome");
  }

  private void ensureOpen() {
    if (closed) {
      throw new UploadQueueException("Upload queue is closed: " + name);
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Launching. Runs without the lock.
  // ---------------------------------------------------------------------------------------------

  private void apply(Effects effects) {
    if (effects.finishedRun != null) {
      effects.finishedRun.complete(effects.results);
    }
    launch(effects.launches);
  }

  /**
   * Invoke the upload function for each admitted attempt.
   *
   * <p>Upload functions that complete synchronously settle inline, which admits the next attempt,
   * which would recurse. Only one thread drains the launch queue at a time; nested calls enqueue
   * and return.
   */
  private void launch(List<Attempt> attempts) {
    launchQueue.addAll(attempts);
    while (!launchQueue.isEmpty() && launching.compareAndSet(false, true)) {
      try {
        Attempt next;
        while ((next = launchQueue.poll()) != null) {
          invoke(next);
        }
      } finally {
        launching.set(false);
      }
    }
  }

  private void invoke(Attempt attempt) {
    if (attempt.token.isCancelled()) {
      return;
    }

    CompletableFuture<UploadOutcome> future;
    try {
      future = attempt.function.upload(attempt.task);
    } catch (RuntimeException e) {
      future = CompletableFuture.failedFuture(e);
    }
    if (future == null) {
      future =
          CompletableFuture.failedFuture(
              new UploadQueueException("Upload function returned no future for " + attempt.itemId));
    }
    future.whenComplete((outcome, error) -> settle(attempt, outcome, error));
  }

  // ---------------------------------------------------------------------------------------------
  // Notifications
  // ---------------------------------------------------------------------------------------------

  private void notifyStatus(String fileId, UploadStatus status) {
    dispatch(listener -> listener.onFileStatusChange(fileId, status));
  }

  private void notifyProgress() {
    if (listeners.isEmpty()) {
      return;
    }
    ProgressSnapshot progress = computeProgress();
    dispatch(listener -> listener.onProgress(progress));
  }

  private void dispatch(Consumer<UploadQueueListener> event) {
    for (UploadQueueListener listener : listeners) {
      try {
        event.accept(listener);
      } catch (RuntimeException e) {
        LOGGER.warn("Upload listener failed: queue={}, error={}", name, e.getMessage(), e);
        notifyError(e);
      }
    }
  }

  private void notifyError(Throwable error) {
    for (UploadQueueListener listener : listeners) {
      try {
        listener.onError(error);
      } catch (RuntimeException e) {
        LOGGER.error("Upload listener failed while handling an error: queue={}", name, e);
      }
    }
  }

  /** One attempt at uploading one file. */
  private static final class Attempt {
    final String itemId;
    final int number;
    final CancellationToken token = new CancellationToken();
    final UploadFunction function;
    final Instant startedAt;
    UploadTask task;
    DelayScheduler.Scheduled timeout;

    Attempt(String itemId, int number, UploadFunction function, Instant startedAt) {
      this.itemId = itemId;
      this.number = number;
      this.function = function;
      this.startedAt = startedAt;
    }

    void cancelTimeout() {
      if (timeout != null) {
        timeout.cancel();
      }
    }
  }

  /** Work collected under the lock and carried out after releasing it. */
  private static final class Effects {
    final List<Attempt> launches = new ArrayList<>();
    CompletableFuture<List<Object>> finishedRun;
    List<Object> results;
  }
}
